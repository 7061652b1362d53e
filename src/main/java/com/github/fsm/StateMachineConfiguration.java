package com.github.fsm;

/**
 * This class encapsulates all the configuration parameters for the StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. maxRedirectHops of 0 (the default) leaves the redirect loop unbounded. A table whose entry
 * hooks redirect in a cycle will then spin forever inside setState(); that is a bug in the table,
 * not something the machine reports.<br>
 * 2. a positive maxRedirectHops turns such a cycle into a REDIRECT_LIMIT_EXCEEDED failure, thrown
 * before the new state is committed.<br>
 * 3. machineName only shows up in logs and toString().<br>
 */
public final class StateMachineConfiguration {
  final static int maxMachineNameLength = 40;
  final static String defaultMachineName = "fsm";

  private final int maxRedirectHops;
  private final String machineName;

  public int getMaxRedirectHops() {
    return maxRedirectHops;
  }

  public boolean isRedirectGuarded() {
    return maxRedirectHops > 0;
  }

  public String getMachineName() {
    return machineName;
  }

  /**
   * Unbounded redirects, default machine name.
   */
  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(0, defaultMachineName);
  }

  public final static class StateMachineConfigurationBuilder {
    private int maxRedirectHops;
    private String machineName = defaultMachineName;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder maxRedirectHops(final int maxRedirectHops) {
      this.maxRedirectHops = maxRedirectHops;
      return this;
    }

    public StateMachineConfigurationBuilder machineName(final String machineName) {
      this.machineName = machineName;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config = new StateMachineConfiguration(maxRedirectHops,
          machineName == null ? null : machineName.trim());
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (maxRedirectHops < 0) {
      messages.append("maxRedirectHops cannot be negative. ");
    }
    if (machineName == null || machineName.isEmpty()) {
      messages.append("machineName cannot be null or empty. ");
    } else if (machineName.length() > maxMachineNameLength) {
      messages.append("machineName cannot be longer than " + maxMachineNameLength
          + " characters. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [machineName=" + machineName + ", maxRedirectHops="
        + maxRedirectHops + "]";
  }

  private StateMachineConfiguration(final int maxRedirectHops, final String machineName) {
    this.maxRedirectHops = maxRedirectHops;
    this.machineName = machineName;
  }

}
