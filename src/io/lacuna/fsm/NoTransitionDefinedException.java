package io.lacuna.fsm;

// Thrown when a run reaches a (state, symbol) pair that has no transition and the run cannot continue.
public class NoTransitionDefinedException extends AutomatonException {

  private final String state;
  private final String symbol;

  public NoTransitionDefinedException(String state, String symbol) {
    super(ErrorKind.NO_TRANSITION_DEFINED, "no transition defined from '" + state + "' on '" + symbol + "'");
    this.state = state;
    this.symbol = symbol;
  }

  public String state() {
    return state;
  }

  public String symbol() {
    return symbol;
  }
}
