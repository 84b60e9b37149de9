package com.github.mealymachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * A Mealy machine: a finite set of named states, guarded transitions between them and a single
 * occupied state that advances one input at a time, emitting an optional output on every fired
 * transition.
 * 
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this machine<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 * 
 * 1. this machine is NOT thread-safe. Confine an instance to one thread or serialize access to it
 * externally<br>
 * 
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * machines, just create as many as needed<br>
 * 
 * 3. the structure (states and transitions) can only be declared before {@link #start(String)}.
 * Once started, a machine stays running; calling start again is a fresh start from the given
 * state<br>
 * 
 * 4. for any occupied state and input at most one transition condition may be true. This is
 * verified on every {@link #step(Object)} since conditions are arbitrary predicates<br>
 * 
 * 5. every fired transition is reported to the observer, self-loops and payload-only changes
 * included. Inputs that match no transition are consumed silently<br>
 * 
 * @param <I> input type
 * @param <P> type of the payload associated with the occupied state
 * @param <O> output type
 */
public interface MealyMachine<I, P, O> {

  ///// Structure API, only valid before start /////
  /**
   * Register a new state with a unique id.
   */
  void registerState(final String stateId) throws MealyMachineException;

  /**
   * Append a transition to the source state's outgoing list. Conditions of the transitions leaving
   * one state must be mutually exclusive.
   */
  void registerTransition(final String sourceId, final String targetId,
      final TransitionCondition<I, P> condition, final TransitionComputation<I, P, O> computation)
      throws MealyMachineException;

  ///// Runtime API /////
  /**
   * Fresh start from the given registered state with no payload. Any previously occupied state is
   * discarded.
   */
  void start(final String initialStateId) throws MealyMachineException;

  /**
   * Fresh start from the given registered state carrying the given payload.
   */
  void start(final String initialStateId, final P initialPayload) throws MealyMachineException;

  /**
   * Process one input.
   * 
   * Returns true iff a transition fired. When nothing matched, the input is consumed and nothing
   * changes.
   */
  boolean step(final I input) throws MealyMachineException;

  /**
   * Set, replace or, with null, detach the observer notified of fired transitions.
   */
  void setObserver(final TransitionObserver<O> observer);

  boolean isRunning();

  Optional<String> getCurrentStateId();

  Optional<P> getCurrentPayload();

  Optional<State<P>> readCurrentState();

  ///// Introspection /////
  SortedSet<String> getStateIds();

  /**
   * Outgoing transitions of a state in registration order. Empty for unknown ids.
   */
  List<Transition<I, P, O>> getTransitions(final String sourceId);

  /**
   * Human readable dump of all states, their outgoing transition targets, with the occupied state
   * tagged. Has no side effects.
   */
  String printStructure();

  /**
   * Reports the id of this machine instance.
   */
  String getId();

  MealyMachineConfiguration getConfiguration();

  MachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build machines.
   */
  public final static class MealyMachineBuilder<I, P, O> {
    private MealyMachineConfiguration config;
    private TransitionObserver<O> observer;
    private final List<String> stateIds = new ArrayList<>();
    private final List<PendingTransition<I, P, O>> transitions = new ArrayList<>();

    public static <I, P, O> MealyMachineBuilder<I, P, O> newBuilder() {
      return new MealyMachineBuilder<>();
    }

    public MealyMachineBuilder<I, P, O> config(final MealyMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public MealyMachineBuilder<I, P, O> observer(final TransitionObserver<O> observer) {
      this.observer = observer;
      return this;
    }

    public MealyMachineBuilder<I, P, O> state(final String stateId) {
      this.stateIds.add(stateId);
      return this;
    }

    public MealyMachineBuilder<I, P, O> states(final String... stateIds) {
      Collections.addAll(this.stateIds, stateIds);
      return this;
    }

    public MealyMachineBuilder<I, P, O> transition(final String sourceId, final String targetId,
        final TransitionCondition<I, P> condition,
        final TransitionComputation<I, P, O> computation) {
      this.transitions.add(new PendingTransition<>(sourceId, targetId, condition, computation));
      return this;
    }

    /**
     * States are registered before transitions, each in declaration order.
     */
    public MealyMachine<I, P, O> build() throws MealyMachineException {
      final MealyMachineImpl<I, P, O> machine =
          new MealyMachineImpl<>(config == null ? MealyMachineConfiguration.defaults() : config);
      for (final String stateId : stateIds) {
        machine.registerState(stateId);
      }
      for (final PendingTransition<I, P, O> pending : transitions) {
        machine.registerTransition(pending.sourceId, pending.targetId, pending.condition,
            pending.computation);
      }
      machine.setObserver(observer);
      return machine;
    }

    private MealyMachineBuilder() {}

    private final static class PendingTransition<I, P, O> {
      private final String sourceId;
      private final String targetId;
      private final TransitionCondition<I, P> condition;
      private final TransitionComputation<I, P, O> computation;

      private PendingTransition(final String sourceId, final String targetId,
          final TransitionCondition<I, P> condition,
          final TransitionComputation<I, P, O> computation) {
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.condition = condition;
        this.computation = computation;
      }
    }
  }

}
