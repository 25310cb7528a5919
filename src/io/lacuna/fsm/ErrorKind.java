package io.lacuna.fsm;

public enum ErrorKind {
  SYNTAX_ERROR,
  MALFORMED_AUTOMATON,
  NO_TRANSITION_DEFINED,
  STEP_LIMIT_EXCEEDED
}
