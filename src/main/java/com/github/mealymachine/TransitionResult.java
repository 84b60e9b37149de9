package com.github.mealymachine;

import java.util.Optional;

/**
 * This object encapsulates the result of applying a {@link TransitionComputation}: the payload the
 * target state will carry and the output emitted on this step, if any.
 * 
 * Both values are optional. A null payload means the target state carries no associated data; use
 * {@link #silent(Object)} when the step produces no output.
 */
public final class TransitionResult<P, O> {
  private final P payload;
  private final O output;

  private TransitionResult(final P payload, final O output) {
    this.payload = payload;
    this.output = output;
  }

  public static <P, O> TransitionResult<P, O> of(final P payload, final O output) {
    return new TransitionResult<>(payload, output);
  }

  public static <P, O> TransitionResult<P, O> silent(final P payload) {
    return new TransitionResult<>(payload, null);
  }

  public static <P, O> TransitionResult<P, O> output(final O output) {
    return new TransitionResult<>(null, output);
  }

  public Optional<P> getPayload() {
    return Optional.ofNullable(payload);
  }

  public Optional<O> getOutput() {
    return Optional.ofNullable(output);
  }

  P rawPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return "TransitionResult [payload=" + payload + ", output=" + output + "]";
  }
}
