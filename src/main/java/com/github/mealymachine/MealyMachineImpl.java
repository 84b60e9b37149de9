package com.github.mealymachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.mealymachine.MealyMachineException.Code;

/**
 * A simple Mealy machine.
 * 
 * Notes for users:<br>
 * 1. this machine instance is NOT thread-safe, there is no internal locking<br>
 * 
 * 2. the stateTransitionTable is only ever appended to before start and read afterwards<br>
 * 
 * 3. the occupied state is a single immutable (id, payload) value that is replaced wholesale when
 * a transition fires. A step either fully commits or leaves it untouched<br>
 * 
 * 4. the observer is notified before the commit, so during the callback the machine still reports
 * the source state<br>
 */
public final class MealyMachineImpl<I, P, O> implements MealyMachine<I, P, O> {
  private static final Logger logger = LogManager.getLogger(MealyMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final MealyMachineConfiguration config;

  // registered state ids in registration order
  private final Set<String> stateIds = new LinkedHashSet<>();

  // K=sourceId, V=outgoing transitions in registration order. Every registered state has an entry.
  private final Map<String, List<Transition<I, P, O>>> stateTransitionTable = new HashMap<>();

  // null until started
  private State<P> currentState;

  private TransitionObserver<O> observer;

  private final MachineStatistics machineStats;

  public MealyMachineImpl() {
    this(MealyMachineConfiguration.defaults());
  }

  public MealyMachineImpl(final MealyMachineConfiguration config) {
    this.config = config == null ? MealyMachineConfiguration.defaults() : config;
    this.machineStats = new MachineStatistics(machineId, this.config.getRouteCapacity());
    logInfo(machineId, "Fired up mealy machine with " + this.config);
  }

  @Override
  public void registerState(final String stateId) throws MealyMachineException {
    machineNotRunning();
    validateStateId(stateId);
    if (stateIds.contains(stateId)) {
      throw new MealyMachineException(Code.DUPLICATE_STATE,
          "State id:" + stateId + " is already registered");
    }
    stateIds.add(stateId);
    stateTransitionTable.put(stateId, new ArrayList<>());
    logDebug(machineId, "Registered state " + stateId);
  }

  @Override
  public void registerTransition(final String sourceId, final String targetId,
      final TransitionCondition<I, P> condition, final TransitionComputation<I, P, O> computation)
      throws MealyMachineException {
    machineNotRunning();
    if (sourceId == null || !stateIds.contains(sourceId)) {
      throw new MealyMachineException(Code.UNKNOWN_STATE,
          "Transition source state id:" + sourceId + " is not registered");
    }
    validateStateId(targetId);
    if (config.getTargetValidation() == TargetValidation.EAGER && !stateIds.contains(targetId)) {
      throw new MealyMachineException(Code.UNKNOWN_TARGET_STATE,
          "Transition target state id:" + targetId + " is not registered");
    }
    final List<Transition<I, P, O>> outgoing = stateTransitionTable.get(sourceId);
    final Transition<I, P, O> transition =
        new Transition<>(sourceId, targetId, outgoing.size(), condition, computation);
    outgoing.add(transition);
    logDebug(machineId, "Registered transition " + transition.getId());
  }

  @Override
  public void start(final String initialStateId) throws MealyMachineException {
    start(initialStateId, null);
  }

  @Override
  public void start(final String initialStateId, final P initialPayload)
      throws MealyMachineException {
    if (initialStateId == null || !stateIds.contains(initialStateId)) {
      throw new MealyMachineException(Code.UNKNOWN_STATE,
          "Initial state id:" + initialStateId + " is not registered");
    }
    if (currentState != null) {
      logWarning(machineId, "Fresh start discards occupied " + currentState);
    }
    currentState = new State<>(initialStateId, initialPayload);
    machineStats.totalStarts++;
    machineStats.resetRoute(initialStateId);
    machineStats.touch();
    logInfo(machineId, "Started at " + currentState);
  }

  @Override
  public boolean step(final I input) throws MealyMachineException {
    machineRunning();
    machineStats.totalSteps++;
    machineStats.touch();

    final State<P> fromState = currentState;
    final Transition<I, P, O> transition = validTransition(fromState, input);
    if (transition == null) {
      machineStats.unmatchedInputs++;
      logDebug(machineId,
          String.format("No transition from %s matched input %s", fromState.getId(), input));
      return false;
    }

    final String targetId = transition.getTargetId();
    if (!stateIds.contains(targetId)) {
      logError(machineId, String.format("Transition %s leads to unregistered state %s",
          transition.getId(), targetId));
      throw new MealyMachineException(Code.UNKNOWN_TARGET_STATE, "Transition "
          + transition.getId() + " leads to unregistered state id:" + targetId);
    }

    final TransitionResult<P, O> result;
    try {
      result = transition.apply(fromState.rawPayload(), input);
    } catch (RuntimeException problem) {
      logError(machineId, "Computation of transition " + transition.getId() + " failed", problem);
      throw new MealyMachineException(Code.TRANSITION_FAILURE,
          "Computation of transition " + transition.getId() + " failed on input " + input,
          problem);
    }
    if (result == null) {
      throw new MealyMachineException(Code.INVALID_TRANSITION,
          "Computation of transition " + transition.getId() + " returned null");
    }

    final TransitionObserver<O> observer = this.observer;
    if (observer != null) {
      observer.onTransition(fromState.getId(), targetId, result.getOutput());
    }
    currentState = new State<>(targetId, result.rawPayload());

    machineStats.firedTransitions++;
    machineStats.recordVisit(targetId);
    logDebug(machineId, String.format("Fired %s on input %s with %s", transition.getId(), input,
        result));
    return true;
  }

  @Override
  public void setObserver(final TransitionObserver<O> observer) {
    this.observer = observer;
  }

  @Override
  public boolean isRunning() {
    return currentState != null;
  }

  @Override
  public Optional<String> getCurrentStateId() {
    return currentState == null ? Optional.empty() : Optional.of(currentState.getId());
  }

  @Override
  public Optional<P> getCurrentPayload() {
    return currentState == null ? Optional.empty() : currentState.getPayload();
  }

  @Override
  public Optional<State<P>> readCurrentState() {
    return Optional.ofNullable(currentState);
  }

  @Override
  public SortedSet<String> getStateIds() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(stateIds));
  }

  @Override
  public List<Transition<I, P, O>> getTransitions(final String sourceId) {
    final List<Transition<I, P, O>> outgoing = stateTransitionTable.get(sourceId);
    if (outgoing == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(outgoing));
  }

  @Override
  public String printStructure() {
    final StringBuilder builder = new StringBuilder("FSM structure:\n");
    for (final String stateId : getStateIds()) {
      builder.append("    ").append(stateId);
      if (currentState != null && currentState.getId().equals(stateId)) {
        builder.append(" [*]");
      }
      builder.append('\n');
      for (final Transition<I, P, O> transition : stateTransitionTable.get(stateId)) {
        builder.append("        => ").append(transition.getTargetId()).append('\n');
      }
    }
    return builder.append("====").toString();
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public MealyMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public MachineStatistics getStatistics() {
    return machineStats;
  }

  static String transitionId(final String sourceId, final String targetId, final int index) {
    return sourceId + "->" + targetId + "#" + index;
  }

  /**
   * Returns the unique transition whose condition holds for the given state and input, null if
   * there is none.
   */
  private Transition<I, P, O> validTransition(final State<P> fromState, final I input)
      throws MealyMachineException {
    final List<Transition<I, P, O>> outgoing = stateTransitionTable.get(fromState.getId());
    if (outgoing == null || outgoing.isEmpty()) {
      return null;
    }
    final List<Transition<I, P, O>> matching = new ArrayList<>(1);
    for (final Transition<I, P, O> transition : outgoing) {
      final boolean matches;
      try {
        matches = transition.matches(fromState.rawPayload(), input);
      } catch (RuntimeException problem) {
        logError(machineId, "Condition of transition " + transition.getId() + " failed", problem);
        throw new MealyMachineException(Code.TRANSITION_FAILURE,
            "Condition of transition " + transition.getId() + " failed on input " + input,
            problem);
      }
      if (matches) {
        matching.add(transition);
      }
    }
    if (matching.size() > 1) {
      final StringBuilder message = new StringBuilder("State id:").append(fromState.getId())
          .append(" has ").append(matching.size())
          .append(" transitions competing to apply on input ").append(input).append(':');
      for (final Transition<I, P, O> transition : matching) {
        message.append(' ').append(transition.getId());
      }
      logError(machineId, message.toString());
      throw new MealyMachineException(message.toString(), matching);
    }
    return matching.isEmpty() ? null : matching.get(0);
  }

  private void validateStateId(final String stateId) throws MealyMachineException {
    if (stateId == null || stateId.trim().isEmpty()
        || stateId.length() > config.getMaxStateIdLength()) {
      throw new MealyMachineException(Code.INVALID_STATE_ID, "State id:" + stateId
          + " cannot be blank or longer than " + config.getMaxStateIdLength() + " characters");
    }
  }

  private void machineRunning() throws MealyMachineException {
    if (currentState == null) {
      throw new MealyMachineException(Code.MACHINE_NOT_RUNNING,
          "Mealy machine id:" + machineId + " has not been started");
    }
  }

  private void machineNotRunning() throws MealyMachineException {
    if (currentState != null) {
      throw new MealyMachineException(Code.MACHINE_RUNNING,
          "Mealy machine id:" + machineId + " is already running");
    }
  }

  private static void logError(final String machineId, final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logError(final String machineId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

}
