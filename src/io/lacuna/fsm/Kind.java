package io.lacuna.fsm;

/**
 * The closed set of automaton variants. Every {@link Automaton} carries exactly one of these, and the algorithms
 * dispatch on it rather than on the automaton's class.
 */
public enum Kind {
  DFA,
  NFA,
  ENFA,
  PDA,
  MEALY,
  MOORE;

  public boolean isDeterministic() {
    return this == DFA || this == MEALY || this == MOORE;
  }

  public boolean isTransducer() {
    return this == MEALY || this == MOORE;
  }

  public boolean allowsEpsilon() {
    return this == ENFA || this == PDA;
  }
}
