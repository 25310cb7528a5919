package io.lacuna.fsm.sim;

/**
 * The outcome of a run. Acceptors end in {@link #ACCEPT} or {@link #REJECT}; Mealy and Moore machines neither accept
 * nor reject, and end in {@link #TRANSDUCED}.
 */
public enum Verdict {
  ACCEPT,
  REJECT,
  TRANSDUCED
}
