package io.lacuna.fsm;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either the value of a successful operation or the {@link AutomatonException} that prevented it.
 */
public final class Result<T> {

  private final T value;
  private final AutomatonException error;

  private Result(T value, AutomatonException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Result<T> success(T value) {
    return new Result<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Result<T> failure(AutomatonException error) {
    return new Result<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @return the value
   * @throws AutomatonException the original error, if this is a failure
   */
  public T get() {
    if (error != null) {
      throw error;
    }
    return value;
  }

  public AutomatonException error() {
    if (error == null) {
      throw new IllegalStateException("not a failure");
    }
    return error;
  }

  public ErrorKind kind() {
    return error().kind();
  }

  public String message() {
    return error().getMessage();
  }

  public <U> Result<U> map(Function<T, U> f) {
    return error == null ? success(f.apply(value)) : failure(error);
  }

  @Override
  public String toString() {
    return error == null ? "success(" + value + ")" : "failure(" + error.kind() + ": " + error.getMessage() + ")";
  }
}
