package io.lacuna.fsm;

/**
 * How a pushdown automaton decides acceptance once its input is exhausted.
 */
public enum AcceptanceMode {
  FINAL_STATE,
  EMPTY_STACK
}
