package com.codeheadsystems.tessera.server.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an authentication step: either a value or an {@link AuthFailure}.
 * <p>
 * Ordinary failures (wrong code, expired session, rate limit) are returned, not thrown.
 *
 * @param <T> the success type
 */
public final class Outcome<T> {

  private final T value;
  private final AuthFailure failure;

  private Outcome(T value, AuthFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Outcome<T> failure(AuthFailure failure) {
    return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public static <T> Outcome<T> failure(ErrorCode code) {
    return failure(AuthFailure.of(code));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * The success value.
   *
   * @return the value
   * @throws IllegalStateException if this is a failure
   */
  public T value() {
    if (failure != null) {
      throw new IllegalStateException("Outcome is a failure: " + failure.code());
    }
    return value;
  }

  /**
   * The failure.
   *
   * @return the failure
   * @throws IllegalStateException if this is a success
   */
  public AuthFailure failure() {
    if (failure == null) {
      throw new IllegalStateException("Outcome is a success");
    }
    return failure;
  }

  /**
   * Transforms the value of a success; failures pass through.
   *
   * @param mapper the transformation
   * @param <R>    the new success type
   * @return the mapped outcome
   */
  public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
    if (failure != null) {
      return failure(failure);
    }
    return success(mapper.apply(value));
  }

  @Override
  public String toString() {
    return failure == null ? "Outcome.success" : "Outcome.failure(" + failure.code() + ")";
  }
}
