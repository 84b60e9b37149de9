package com.github.mealymachine;

import java.util.Optional;

/**
 * Receives a synchronous notification for every fired transition, before the machine commits the
 * target state. At the time of the call {@link MealyMachine#getCurrentStateId()} still reports
 * {@code fromStateId}.
 */
@FunctionalInterface
public interface TransitionObserver<O> {

  void onTransition(final String fromStateId, final String toStateId, final Optional<O> output);
}
