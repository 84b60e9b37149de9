package com.github.mealymachine;

import java.util.Collections;
import java.util.List;

/**
 * Unified single exception that's thrown by this machine. The code enum encapsulates the various
 * error conditions. All of them are programming or configuration mistakes: callers are expected to
 * fix the machine definition, not to retry.
 */
public final class MealyMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final transient List<Transition<?, ?, ?>> competingTransitions;

  public MealyMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.competingTransitions = Collections.emptyList();
  }

  public MealyMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.competingTransitions = Collections.emptyList();
  }

  public MealyMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
    this.competingTransitions = Collections.emptyList();
  }

  MealyMachineException(final String message,
      final List<? extends Transition<?, ?, ?>> competingTransitions) {
    super(message);
    this.code = Code.NON_DETERMINISTIC_TRANSITIONS;
    this.competingTransitions = Collections.unmodifiableList(competingTransitions);
  }

  public Code getCode() {
    return code;
  }

  /**
   * Transitions whose conditions were simultaneously true. Only populated for
   * {@link Code#NON_DETERMINISTIC_TRANSITIONS}.
   */
  public List<Transition<?, ?, ?>> getCompetingTransitions() {
    return competingTransitions == null ? Collections.emptyList() : competingTransitions;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_ID("State id cannot be null, blank or longer than the configured maximum"),
    // 2.
    DUPLICATE_STATE("State id is already registered"),
    // 3.
    UNKNOWN_STATE("State id is not registered"),
    // 4.
    UNKNOWN_TARGET_STATE("Transition target state id is not registered"),
    // 5.
    INVALID_TRANSITION("Transition condition and computation cannot be null"),
    // 6.
    MACHINE_RUNNING("Machine structure cannot be modified once the machine has started"),
    // 7.
    MACHINE_NOT_RUNNING("Machine is not running and cannot process input"),
    // 8.
    NON_DETERMINISTIC_TRANSITIONS(
        "More than one transition matched the current state and input"),
    // 9.
    TRANSITION_FAILURE(
        "Transition condition or computation failed. Check exception cause for more details."),
    // 10.
    INVALID_MACHINE_CONFIG("Machine configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
