package io.lacuna.fsm.convert;

import io.lacuna.bifurcan.LinearSet;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.lacuna.fsm.convert.SubsetConstructor.epsilonClosure;
import static io.lacuna.fsm.convert.SubsetConstructor.move;

/**
 * Removes ε-transitions from an ε-NFA while keeping its states: a state becomes accepting if its ε-closure contains
 * an accepting state, and {@code p --a--> r} is added for every {@code r} in the closure of the {@code a}-successors of
 * the closure of {@code p}.
 */
public class EpsilonEliminator {

  private static final Logger LOG = LoggerFactory.getLogger(EpsilonEliminator.class);

  private EpsilonEliminator() {
  }

  public static Automaton eliminate(Automaton enfa) {
    if (enfa.kind() != Kind.ENFA && enfa.kind() != Kind.NFA) {
      throw new IllegalArgumentException("expected an ε-NFA, got a " + enfa.kind());
    }

    AutomatonBuilder builder = new AutomatonBuilder(Kind.NFA)
            .alphabet(SubsetConstructor.sorted(enfa.alphabet()));
    enfa.states().forEach(s -> builder.state(enfa.name(s)));
    builder.start(enfa.name(enfa.start()));

    int edges = 0;
    for (State s : enfa.states()) {
      StateSet closure = epsilonClosure(enfa, s);
      if (closure.containsAny(enfa.accepting())) {
        builder.accept(enfa.name(s));
      }

      for (String symbol : SubsetConstructor.sorted(enfa.alphabet())) {
        LinearSet<State> targets = move(enfa, closure, symbol);
        if (targets.size() == 0) {
          continue;
        }
        for (State t : epsilonClosure(enfa, targets).states()) {
          builder.transition(enfa.name(s), symbol, enfa.name(t));
          edges++;
        }
      }
    }

    LOG.debug("eliminated ε-transitions, leaving {} transitions over {} states", edges, enfa.stateCount());
    return builder.build();
  }
}
