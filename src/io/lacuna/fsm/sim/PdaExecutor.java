package io.lacuna.fsm.sim;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.fsm.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs a pushdown automaton by breadth-first exploration of its configurations. Every legal move from a
 * configuration becomes a new branch; branches that revisit a configuration already seen are dropped, and the whole
 * exploration is bounded by a maximum number of expanded configurations.
 */
class PdaExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(PdaExecutor.class);

  private final Automaton pda;
  private final long maxSteps;

  // a configuration on the worklist, linked to the one it was reached from
  private static final class Branch {
    final Configuration config;
    final Branch parent;

    Branch(Configuration config, Branch parent) {
      this.config = config;
      this.parent = parent;
    }

    IList<Configuration> path() {
      LinearList<Configuration> path = new LinearList<>();
      for (Branch b = this; b != null; b = b.parent) {
        path.addFirst(b.config);
      }
      return path;
    }
  }

  private static final class Key {
    final State state;
    final int position;
    final PdaStack stack;

    Key(Configuration c) {
      this.state = c.state();
      this.position = c.position();
      this.stack = c.stack();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Key)) {
        return false;
      }
      Key k = (Key) obj;
      return position == k.position && state.equals(k.state) && stack.equals(k.stack);
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, position, stack);
    }
  }

  PdaExecutor(Automaton pda, long maxSteps) {
    if (pda.kind() != Kind.PDA) {
      throw new IllegalArgumentException("expected a PDA, got a " + pda.kind());
    }
    this.pda = pda;
    this.maxSteps = maxSteps;
  }

  Configuration initial(IList<String> input) {
    return Configuration.initial(StateSet.of(pda.start()), input, PdaStack.of(pda.initialStackSymbol()));
  }

  boolean isAccepting(Configuration c) {
    if (!c.isInputExhausted()) {
      return false;
    }
    return pda.acceptance() == AcceptanceMode.EMPTY_STACK
            ? c.stack().isEmpty()
            : pda.isAccepting(c.state());
  }

  /**
   * @return every configuration reachable from {@code c} by one transition, in transition declaration order
   */
  IList<Configuration> successors(Configuration c) {
    LinearList<Configuration> result = new LinearList<>();
    for (Transition t : pda.transitions(c.state())) {
      apply(c, t).ifPresent(result::addLast);
    }
    return result;
  }

  private Optional<Configuration> apply(Configuration c, Transition t) {
    if (!t.isEpsilon() && (c.isInputExhausted() || !t.input().equals(c.nextSymbol()))) {
      return Optional.empty();
    }

    PdaStack stack = c.stack();
    if (!t.popsNothing()) {
      if (!stack.peek().map(t.pop()::equals).orElse(false)) {
        return Optional.empty();
      }
      stack = stack.pop();
    }
    stack = stack.pushAll(t.push());

    return Optional.of(new Configuration(
            StateSet.of(t.to()),
            c.input(),
            c.position() + (t.isEpsilon() ? 0 : 1),
            stack,
            c.outputs(),
            LinearList.of(t)));
  }

  /**
   * @throws StepLimitExceededException if more than {@code maxSteps} configurations are expanded before the
   * exploration either accepts or runs out of branches
   */
  SimulationResult run(IList<String> input) {
    LinearList<Branch> queue = LinearList.of(new Branch(initial(input), null));
    LinearSet<Key> visited = new LinearSet<>();
    Branch furthest = queue.nth(0);
    long steps = 0;

    while (queue.size() > 0) {
      Branch branch = queue.popFirst();
      if (visited.contains(new Key(branch.config))) {
        continue;
      }
      visited.add(new Key(branch.config));

      if (isAccepting(branch.config)) {
        LOG.debug("accepted after expanding {} configurations", steps);
        return new SimulationResult(Verdict.ACCEPT, branch.path(), steps);
      }

      if (++steps > maxSteps) {
        throw new StepLimitExceededException(maxSteps);
      }

      if (branch.config.position() > furthest.config.position()) {
        furthest = branch;
      }

      for (Configuration next : successors(branch.config)) {
        queue.addLast(new Branch(next, branch));
      }
    }

    LOG.debug("rejected after expanding {} configurations", steps);
    return new SimulationResult(Verdict.REJECT, furthest.path(), steps);
  }
}
