package com.github.mealymachine;

/**
 * One guarded edge of the machine graph. Transitions reference their states by id only; the
 * machine owns the canonical state set.
 */
public final class Transition<I, P, O> {
  private final String id;
  private final String sourceId;
  private final String targetId;
  private final TransitionCondition<I, P> condition;
  private final TransitionComputation<I, P, O> computation;

  Transition(final String sourceId, final String targetId, final int index,
      final TransitionCondition<I, P> condition, final TransitionComputation<I, P, O> computation)
      throws MealyMachineException {
    if (condition == null || computation == null) {
      throw new MealyMachineException(MealyMachineException.Code.INVALID_TRANSITION);
    }
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.condition = condition;
    this.computation = computation;
    this.id = MealyMachineImpl.transitionId(sourceId, targetId, index);
  }

  /**
   * Unique within its machine, of the form {@code source->target#index} where index is the
   * position in the source state's transition list.
   */
  public String getId() {
    return id;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  boolean matches(final P payload, final I input) {
    return condition.test(payload, input);
  }

  TransitionResult<P, O> apply(final P payload, final I input) {
    return computation.compute(payload, input);
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", sourceId=" + sourceId + ", targetId=" + targetId + "]";
  }
}
