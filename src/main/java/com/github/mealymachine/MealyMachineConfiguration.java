package com.github.mealymachine;

/**
 * This class encapsulates all the configuration parameters for a MealyMachine. Use the
 * {@code MealyMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. targetValidation defaults to {@link TargetValidation#EAGER}. With
 * {@link TargetValidation#ON_FIRE} a transition to an unregistered state can be registered but the
 * step that selects it fails without touching the occupied state.<br>
 * 2. maxStateIdLength and routeCapacity fall back to their defaults when set to a non-positive
 * value.<br>
 */
public final class MealyMachineConfiguration {
  static final int defaultMaxStateIdLength = 64;
  static final int defaultRouteCapacity = 100;

  private final TargetValidation targetValidation;
  private final int maxStateIdLength;
  private final int routeCapacity;

  public static MealyMachineConfiguration defaults() {
    return new MealyMachineConfiguration(TargetValidation.EAGER, 0, 0);
  }

  public TargetValidation getTargetValidation() {
    return targetValidation;
  }

  public int getMaxStateIdLength() {
    return maxStateIdLength;
  }

  public int getRouteCapacity() {
    return routeCapacity;
  }

  public final static class MealyMachineConfigurationBuilder {
    private TargetValidation targetValidation = TargetValidation.EAGER;
    private int maxStateIdLength;
    private int routeCapacity;

    public static MealyMachineConfigurationBuilder newBuilder() {
      return new MealyMachineConfigurationBuilder();
    }

    public MealyMachineConfigurationBuilder targetValidation(
        final TargetValidation targetValidation) {
      this.targetValidation = targetValidation;
      return this;
    }

    public MealyMachineConfigurationBuilder maxStateIdLength(final int maxStateIdLength) {
      this.maxStateIdLength = maxStateIdLength;
      return this;
    }

    public MealyMachineConfigurationBuilder routeCapacity(final int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public MealyMachineConfiguration build() throws MealyMachineException {
      final MealyMachineConfiguration config =
          new MealyMachineConfiguration(targetValidation, maxStateIdLength, routeCapacity);
      config.validate();
      return config;
    }

    private MealyMachineConfigurationBuilder() {}
  }

  private void validate() throws MealyMachineException {
    StringBuilder messages = new StringBuilder();
    if (targetValidation == null) {
      messages.append("TargetValidation cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new MealyMachineException(MealyMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "MealyMachineConfiguration [targetValidation=" + targetValidation
        + ", maxStateIdLength=" + maxStateIdLength + ", routeCapacity=" + routeCapacity + "]";
  }

  private MealyMachineConfiguration(final TargetValidation targetValidation,
      final int maxStateIdLength, final int routeCapacity) {
    this.targetValidation = targetValidation;
    this.maxStateIdLength = maxStateIdLength <= 0 ? defaultMaxStateIdLength : maxStateIdLength;
    this.routeCapacity = routeCapacity <= 0 ? defaultRouteCapacity : routeCapacity;
  }

}
