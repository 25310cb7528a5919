package io.lacuna.fsm.convert;

import io.lacuna.bifurcan.*;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Collapses equivalent states of a DFA by partition refinement. Starting from {accepting, non-accepting}, blocks are
 * split by the blocks their members move to on each symbol until no block splits. A missing transition counts as a
 * move into an implicit dead block.
 */
public class DfaMinimizer {

  private static final Logger LOG = LoggerFactory.getLogger(DfaMinimizer.class);

  private static final int DEAD = -1;

  private DfaMinimizer() {
  }

  /**
   * @return the minimal DFA for the language of {@code dfa}, with states named {@code q0, q1, ...} in breadth-first
   * order from the start state
   */
  public static Automaton minimize(Automaton dfa) {
    if (dfa.kind() != Kind.DFA) {
      throw new IllegalArgumentException("expected a DFA, got a " + dfa.kind());
    }

    IList<String> alphabet = SubsetConstructor.sorted(dfa.alphabet());
    IList<State> reachable = breadthFirst(dfa);
    IMap<State, Integer> blocks = equivalentStates(dfa, reachable, alphabet);

    LinearMap<Integer, State> members = new LinearMap<>();
    for (State s : reachable) {
      int block = blocks.get(s).get();
      if (!members.contains(block)) {
        members.put(block, s);
      }
    }

    // name the blocks in breadth-first order over the quotient, so an already minimal DFA keeps its layout
    int startBlock = blocks.get(dfa.start()).get();
    LinearList<Integer> order = LinearList.of(startBlock);
    LinearMap<Integer, String> names = new LinearMap<>();
    names.put(startBlock, "q0");
    for (int i = 0; i < order.size(); i++) {
      State rep = members.get(order.nth(i)).get();
      for (String symbol : alphabet) {
        dfa.next(rep, symbol).ifPresent(n -> {
          int block = blocks.get(n).get();
          if (!names.contains(block)) {
            names.put(block, "q" + names.size());
            order.addLast(block);
          }
        });
      }
    }

    AutomatonBuilder builder = new AutomatonBuilder(Kind.DFA).alphabet(alphabet);
    for (int block : order) {
      State rep = members.get(block).get();
      String name = names.get(block).get();
      builder.state(name);
      if (dfa.isAccepting(rep)) {
        builder.accept(name);
      }
      for (String symbol : alphabet) {
        Optional<State> next = dfa.next(rep, symbol);
        next.ifPresent(n -> builder.transition(name, symbol, names.get(blocks.get(n).get()).get()));
      }
    }
    builder.start("q0").total(dfa.isTotal());

    Automaton minimal = builder.build();
    LOG.debug("minimized {} reachable states into {} states", reachable.size(), minimal.stateCount());
    return minimal;
  }

  /**
   * @return the block index of every reachable state once refinement has reached its fixpoint
   */
  static IMap<State, Integer> equivalentStates(Automaton dfa, IList<State> reachable, IList<String> alphabet) {
    LinearMap<State, Integer> blocks = new LinearMap<>();
    reachable.forEach(s -> blocks.put(s, dfa.isAccepting(s) ? 0 : 1));
    long count = blocks.values().stream().distinct().count();

    for (int round = 1; ; round++) {
      // a state's signature is its own block followed by the block reached on each symbol
      LinearMap<String, LinearList<State>> groups = Utils.groupBy(reachable, s -> {
        StringBuilder sb = new StringBuilder().append(blocks.get(s).get());
        for (String symbol : alphabet) {
          sb.append(':').append(dfa.next(s, symbol).map(n -> blocks.get(n).get()).orElse(DEAD));
        }
        return sb.toString();
      });

      if (groups.size() == count) {
        LOG.trace("partition refinement stable after {} rounds with {} blocks", round, count);
        return blocks;
      }

      int block = 0;
      for (IEntry<String, LinearList<State>> e : groups) {
        for (State s : e.value()) {
          blocks.put(s, block);
        }
        block++;
      }
      count = groups.size();
    }
  }

  private static IList<State> breadthFirst(Automaton dfa) {
    LinearSet<State> visited = LinearSet.of(dfa.start());
    LinearList<State> order = new LinearList<>();
    LinearList<State> queue = LinearList.of(dfa.start());
    IList<String> alphabet = SubsetConstructor.sorted(dfa.alphabet());

    while (queue.size() > 0) {
      State s = queue.popFirst();
      order.addLast(s);
      for (String symbol : alphabet) {
        dfa.next(s, symbol).ifPresent(n -> {
          if (!visited.contains(n)) {
            visited.add(n);
            queue.addLast(n);
          }
        });
      }
    }

    return order;
  }
}
