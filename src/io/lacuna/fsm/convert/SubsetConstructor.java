package io.lacuna.fsm.convert;

import io.lacuna.bifurcan.*;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * The power-set construction, turning an NFA or ε-NFA into an equivalent DFA. Only subsets reachable from the
 * ε-closure of the start state are ever materialised, and the empty subset is left implicit, so the result may be
 * partial.
 */
public class SubsetConstructor {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetConstructor.class);

  private SubsetConstructor() {
  }

  /**
   * @return the smallest superset of {@code states} closed under ε-transitions
   */
  public static StateSet epsilonClosure(Automaton automaton, Iterable<State> states) {
    LinearSet<State> closure = new LinearSet<>();
    LinearList<State> worklist = new LinearList<>();
    for (State s : states) {
      if (!closure.contains(s)) {
        closure.add(s);
        worklist.addLast(s);
      }
    }

    while (worklist.size() > 0) {
      State s = worklist.popLast();
      for (Transition t : automaton.transitions(s, Symbols.EPSILON)) {
        if (!closure.contains(t.to())) {
          closure.add(t.to());
          worklist.addLast(t.to());
        }
      }
    }

    return StateSet.of(closure);
  }

  public static StateSet epsilonClosure(Automaton automaton, State state) {
    return epsilonClosure(automaton, LinearList.of(state));
  }

  /**
   * @return the states reachable from any member of {@code states} by one transition on {@code symbol}
   */
  public static LinearSet<State> move(Automaton automaton, StateSet states, String symbol) {
    LinearSet<State> result = new LinearSet<>();
    for (State s : states.states()) {
      automaton.transitions(s, symbol).forEach(t -> result.add(t.to()));
    }
    return result;
  }

  /**
   * @return a DFA accepting the same language as {@code nfa}, whose states are named after the NFA states they merge
   */
  public static Automaton determinize(Automaton nfa) {
    Kind kind = nfa.kind();
    if (kind != Kind.NFA && kind != Kind.ENFA && kind != Kind.DFA) {
      throw new IllegalArgumentException("cannot determinize a " + kind);
    }

    IList<String> alphabet = sorted(nfa.alphabet());
    AutomatonBuilder builder = new AutomatonBuilder(Kind.DFA).alphabet(alphabet);

    LinearMap<StateSet, String> cache = new LinearMap<>();
    LinearList<StateSet> queue = new LinearList<>();

    Function<StateSet, String> enqueue = states -> {
      String name = cache.get(states).orElse(null);
      if (name == null) {
        // distinct subsets can describe alike when NFA names contain commas
        name = builder.freshName(states.describe(nfa::name));
        cache.put(states, name);
        builder.state(name);
        if (states.containsAny(nfa.accepting())) {
          builder.accept(name);
        }
        queue.addLast(states);
      }
      return name;
    };

    builder.start(enqueue.apply(epsilonClosure(nfa, nfa.start())));

    while (queue.size() > 0) {
      StateSet states = queue.popFirst();
      String from = cache.get(states).get();

      for (String symbol : alphabet) {
        LinearSet<State> targets = move(nfa, states, symbol);
        if (targets.size() > 0) {
          builder.transition(from, symbol, enqueue.apply(epsilonClosure(nfa, targets)));
        }
      }
    }

    Automaton dfa = builder.build();
    LOG.debug("determinized {} states into {} states", nfa.stateCount(), dfa.stateCount());
    return dfa;
  }

  static IList<String> sorted(ISet<String> symbols) {
    LinearList<String> result = new LinearList<>();
    symbols.stream().sorted().forEach(result::addLast);
    return result;
  }
}
