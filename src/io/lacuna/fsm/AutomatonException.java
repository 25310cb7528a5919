package io.lacuna.fsm;

/**
 * Base of every recoverable failure raised by the engine. Each subclass carries a fixed {@link ErrorKind}, so callers
 * at a boundary can report the kind together with {@link #getMessage()}.
 */
public abstract class AutomatonException extends RuntimeException {

  private final ErrorKind kind;

  protected AutomatonException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected AutomatonException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
