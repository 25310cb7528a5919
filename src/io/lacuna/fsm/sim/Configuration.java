package io.lacuna.fsm.sim;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.fsm.State;
import io.lacuna.fsm.StateSet;
import io.lacuna.fsm.Transition;

import java.util.Objects;

/**
 * An immutable snapshot of a run: the active states, how much of the input has been consumed, the stack for
 * pushdown automata, the outputs emitted so far by transducers, and the transitions taken by the step that produced
 * it. Every step returns a new configuration, so a snapshot can be replayed or inspected independently.
 */
public final class Configuration {

  private static final IList<Transition> NONE = new LinearList<Transition>().forked();
  private static final IList<String> NO_OUTPUT = new LinearList<String>().forked();

  private final StateSet states;
  private final IList<String> input;
  private final int position;
  private final PdaStack stack;
  private final IList<String> outputs;
  private final IList<Transition> taken;

  Configuration(StateSet states, IList<String> input, int position, PdaStack stack,
                IList<String> outputs, IList<Transition> taken) {
    this.states = states;
    this.input = input;
    this.position = position;
    this.stack = stack;
    this.outputs = outputs;
    this.taken = taken;
  }

  static Configuration initial(StateSet states, IList<String> input, PdaStack stack) {
    return new Configuration(states, input, 0, stack, NO_OUTPUT, NONE);
  }

  /**
   * @return the active states; a singleton for deterministic runs, and empty once a run is stuck
   */
  public StateSet states() {
    return states;
  }

  public ISet<State> activeStates() {
    return states.states();
  }

  /**
   * @return the single active state of a deterministic or pushdown configuration
   */
  public State state() {
    if (states.size() != 1) {
      throw new IllegalStateException("configuration has " + states.size() + " active states");
    }
    return states.states().iterator().next();
  }

  public boolean isStuck() {
    return states.isEmpty();
  }

  public IList<String> input() {
    return input;
  }

  public int position() {
    return position;
  }

  public IList<String> remaining() {
    LinearList<String> remaining = new LinearList<>();
    for (long i = position; i < input.size(); i++) {
      remaining.addLast(input.nth(i));
    }
    return remaining;
  }

  public boolean isInputExhausted() {
    return position >= input.size();
  }

  /**
   * @return the next input symbol
   * @throws IllegalStateException if the input is exhausted
   */
  public String nextSymbol() {
    if (isInputExhausted()) {
      throw new IllegalStateException("input exhausted");
    }
    return input.nth(position);
  }

  /**
   * @return the stack of a pushdown run, or {@code null} for other kinds
   */
  public PdaStack stack() {
    return stack;
  }

  public IList<String> outputs() {
    return outputs;
  }

  /**
   * @return the transitions followed by the step that produced this configuration, empty for an initial one
   */
  public IList<Transition> taken() {
    return taken;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Configuration)) {
      return false;
    }
    Configuration c = (Configuration) obj;
    return position == c.position
            && states.equals(c.states)
            && Objects.equals(stack, c.stack)
            && sameList(outputs, c.outputs)
            && sameList(input, c.input);
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, position, stack, outputs.size());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(").append(states).append(", ");
    IList<String> rest = remaining();
    if (rest.size() == 0) {
      sb.append("ε");
    } else {
      rest.forEach(sb::append);
    }
    if (stack != null) {
      sb.append(", ").append(stack);
    }
    return sb.append(")").toString();
  }

  private static boolean sameList(IList<String> a, IList<String> b) {
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
}
