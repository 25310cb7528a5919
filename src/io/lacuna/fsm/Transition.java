package io.lacuna.fsm;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.Objects;

/**
 * A single edge of an automaton. Which fields are meaningful depends on the automaton's {@link Kind}:
 * <ul>
 *   <li>finite automata and Moore machines use {@code from}, {@code input} and {@code to}</li>
 *   <li>Mealy machines add {@code output}</li>
 *   <li>pushdown automata add {@code pop} and {@code push}</li>
 * </ul>
 * The unused fields are {@code null}, or empty for {@code push}.
 */
public final class Transition {

  private static final IList<String> NOTHING = new LinearList<String>().forked();

  private final State from;
  private final String input;
  private final State to;
  private final String pop;
  private final IList<String> push;
  private final String output;

  private Transition(State from, String input, State to, String pop, IList<String> push, String output) {
    this.from = Objects.requireNonNull(from, "from");
    this.input = Symbols.isEpsilon(input) ? Symbols.EPSILON : input;
    this.to = Objects.requireNonNull(to, "to");
    this.pop = pop == null ? null : (Symbols.isEpsilon(pop) ? Symbols.EPSILON : pop);
    this.push = push;
    this.output = output;
  }

  /**
   * @return a transition for a DFA, NFA, ε-NFA or Moore machine
   */
  public static Transition of(State from, String input, State to) {
    return new Transition(from, input, to, null, NOTHING, null);
  }

  public static Transition epsilon(State from, State to) {
    return of(from, Symbols.EPSILON, to);
  }

  public static Transition mealy(State from, String input, State to, String output) {
    return new Transition(from, input, to, null, NOTHING, Objects.requireNonNull(output, "output"));
  }

  /**
   * @param push the symbols to push once {@code pop} is removed, in push order: the last element becomes the new top
   */
  public static Transition pushdown(State from, String input, String pop, State to, Iterable<String> push) {
    LinearList<String> symbols = new LinearList<>();
    push.forEach(s -> {
      if (!Symbols.isEpsilon(s)) {
        symbols.addLast(s);
      }
    });
    return new Transition(from, input, to, pop == null ? Symbols.EPSILON : pop, symbols, null);
  }

  public State from() {
    return from;
  }

  public String input() {
    return input;
  }

  public State to() {
    return to;
  }

  public boolean isEpsilon() {
    return Symbols.EPSILON.equals(input);
  }

  public String pop() {
    return pop;
  }

  public boolean popsNothing() {
    return pop == null || Symbols.EPSILON.equals(pop);
  }

  public IList<String> push() {
    return push;
  }

  public String output() {
    return output;
  }

  /**
   * @return the edge label as drawn: {@code a}, {@code a/1} for Mealy edges, {@code a,Z/AZ} for pushdown edges
   */
  public String label() {
    if (pop != null) {
      StringBuilder sb = new StringBuilder(input).append(',').append(pop).append('/');
      if (push.size() == 0) {
        sb.append(Symbols.EPSILON);
      } else {
        // top of stack first, as pushdown transitions are conventionally written
        for (long i = push.size() - 1; i >= 0; i--) {
          sb.append(push.nth(i));
        }
      }
      return sb.toString();
    }
    return output == null ? input : input + "/" + output;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition t = (Transition) obj;
    return from.equals(t.from)
            && input.equals(t.input)
            && to.equals(t.to)
            && Objects.equals(pop, t.pop)
            && Objects.equals(output, t.output)
            && sameSymbols(push, t.push);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, input, to, pop, output, Symbols.join(push));
  }

  private static boolean sameSymbols(IList<String> a, IList<String> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (long i = 0; i < a.size(); i++) {
      if (!a.nth(i).equals(b.nth(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return from + " --" + label() + "--> " + to;
  }
}
