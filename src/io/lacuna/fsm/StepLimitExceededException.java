package io.lacuna.fsm;

// Thrown when a nondeterministic exploration expands more configurations than it is allowed to.
public class StepLimitExceededException extends AutomatonException {

  private final long limit;

  public StepLimitExceededException(long limit) {
    super(ErrorKind.STEP_LIMIT_EXCEEDED, "exploration exceeded the limit of " + limit + " steps");
    this.limit = limit;
  }

  public long limit() {
    return limit;
  }
}
