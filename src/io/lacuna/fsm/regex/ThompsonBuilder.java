package io.lacuna.fsm.regex;

import io.lacuna.fsm.Automaton;
import io.lacuna.fsm.AutomatonBuilder;
import io.lacuna.fsm.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Compiles a regular expression into an ε-NFA by Thompson's construction. Every subexpression becomes a fragment
 * with exactly one entry and one exit state, and fragments are only ever joined by ε-transitions.
 */
public class ThompsonBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(ThompsonBuilder.class);

  private final AutomatonBuilder builder = new AutomatonBuilder(Kind.ENFA);
  private int counter = 0;

  private static class Fragment {
    final String start, accept;

    Fragment(String start, String accept) {
      this.start = start;
      this.accept = accept;
    }
  }

  private ThompsonBuilder() {
  }

  public static Automaton build(String regex) {
    return build(RegexParser.parse(regex));
  }

  public static Automaton build(RegexNode node) {
    return build(node, Collections.emptyList());
  }

  /**
   * @param alphabet symbols to include in the automaton's alphabet in addition to the expression's literals
   * @return an ε-NFA with a single start and a single accepting state
   */
  public static Automaton build(RegexNode node, Iterable<String> alphabet) {
    ThompsonBuilder b = new ThompsonBuilder();
    b.builder.alphabet(alphabet);

    Fragment f = b.compile(node);
    Automaton result = b.builder
            .start(f.start)
            .accept(f.accept)
            .build();

    LOG.debug("compiled {} into an ε-NFA with {} states", node, result.stateCount());
    return result;
  }

  ///

  private Fragment compile(RegexNode node) {
    switch (node.type()) {
      case LITERAL:
        return literal(node.symbol());
      case EPSILON:
        return epsilon();
      case CONCATENATION:
        return concat(compile(node.left()), compile(node.right()));
      case UNION:
        return union(compile(node.left()), compile(node.right()));
      case STAR:
        return kleene(compile(node.left()), true);
      case PLUS:
        return kleene(compile(node.left()), false);
      default:
        throw new IllegalStateException("unknown node type " + node.type());
    }
  }

  private String newState() {
    String name = "q" + counter++;
    builder.state(name);
    return name;
  }

  /// combinators

  private Fragment literal(String symbol) {
    Fragment f = new Fragment(newState(), newState());
    builder.symbol(symbol).transition(f.start, symbol, f.accept);
    return f;
  }

  private Fragment epsilon() {
    Fragment f = new Fragment(newState(), newState());
    builder.epsilon(f.start, f.accept);
    return f;
  }

  private Fragment concat(Fragment a, Fragment b) {
    builder.epsilon(a.accept, b.start);
    return new Fragment(a.start, b.accept);
  }

  private Fragment union(Fragment a, Fragment b) {
    Fragment f = new Fragment(newState(), newState());
    builder.epsilon(f.start, a.start)
            .epsilon(f.start, b.start)
            .epsilon(a.accept, f.accept)
            .epsilon(b.accept, f.accept);
    return f;
  }

  // without the bypass edge the body must be matched at least once, which is '+'
  private Fragment kleene(Fragment body, boolean bypass) {
    Fragment f = new Fragment(newState(), newState());
    builder.epsilon(f.start, body.start)
            .epsilon(body.accept, body.start)
            .epsilon(body.accept, f.accept);
    if (bypass) {
      builder.epsilon(f.start, f.accept);
    }
    return f;
  }
}
