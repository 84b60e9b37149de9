package com.github.mealymachine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Holder of statistics for a machine. Counters are cumulative over the machine's lifetime, the
 * recent route only covers the current run.
 */
public final class MachineStatistics {
  private final String machineId;
  private final int routeCapacity;
  private final long startTstampMillis = System.currentTimeMillis();

  int totalStarts;
  long totalSteps;
  long firedTransitions;
  long unmatchedInputs;
  // used to track activity level of a machine
  long lastTouchTimeMillis;
  // bounded at routeCapacity, oldest first
  private final Deque<String> boundedStateRoute = new ArrayDeque<>();

  MachineStatistics(final String machineId, final int routeCapacity) {
    this.machineId = machineId;
    this.routeCapacity = routeCapacity;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTotalStarts() {
    return totalStarts;
  }

  public long getTotalSteps() {
    return totalSteps;
  }

  public long getFiredTransitions() {
    return firedTransitions;
  }

  public long getUnmatchedInputs() {
    return unmatchedInputs;
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  /**
   * The most recently occupied state ids of the current run, oldest first.
   */
  public List<String> getRecentRoute() {
    return Collections.unmodifiableList(new ArrayList<>(boundedStateRoute));
  }

  void touch() {
    lastTouchTimeMillis = System.currentTimeMillis();
  }

  void resetRoute(final String initialStateId) {
    boundedStateRoute.clear();
    recordVisit(initialStateId);
  }

  void recordVisit(final String stateId) {
    if (boundedStateRoute.size() == routeCapacity) {
      boundedStateRoute.removeFirst();
    }
    boundedStateRoute.addLast(stateId);
  }

  @Override
  public String toString() {
    return "MachineStatistics [machineId=" + machineId + ", startTstampMillis=" + startTstampMillis
        + ", totalStarts=" + totalStarts + ", totalSteps=" + totalSteps + ", firedTransitions="
        + firedTransitions + ", unmatchedInputs=" + unmatchedInputs + ", lastTouchTimeMillis="
        + lastTouchTimeMillis + ", recentRoute=" + boundedStateRoute + "]";
  }

}
