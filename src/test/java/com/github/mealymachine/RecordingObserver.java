package com.github.mealymachine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Test observer that remembers every notification it receives.
 */
final class RecordingObserver<O> implements TransitionObserver<O> {
  final List<Notification<O>> notifications = new ArrayList<>();
  Optional<O> lastOutput = Optional.empty();

  @Override
  public void onTransition(final String fromStateId, final String toStateId,
      final Optional<O> output) {
    notifications.add(new Notification<>(fromStateId, toStateId, output));
    lastOutput = output;
  }

  void clear() {
    notifications.clear();
    lastOutput = Optional.empty();
  }

  static final class Notification<O> {
    final String fromStateId;
    final String toStateId;
    final Optional<O> output;

    Notification(final String fromStateId, final String toStateId, final Optional<O> output) {
      this.fromStateId = fromStateId;
      this.toStateId = toStateId;
      this.output = output;
    }
  }
}
