package com.github.fsm;

/**
 * Holder of running counters for one FSM. Nothing here is persisted and no history of visited
 * states is kept.
 */
public final class StateMachineStatistics {
  private final String stateMachineId;

  StateMachineStatistics(final String stateMachineId) {
    this.stateMachineId = stateMachineId;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  long totalTransitions;
  long totalRedirects;
  long transitionFailures;
  long lastTransitionMillis;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getMachineId() {
    return stateMachineId;
  }

  /**
   * setState() calls that committed a state, the one run while building the machine included.
   */
  public long getTotalTransitions() {
    return totalTransitions;
  }

  /**
   * Redirect hops followed across all transitions.
   */
  public long getTotalRedirects() {
    return totalRedirects;
  }

  /**
   * setState() calls that ended with an exception.
   */
  public long getTransitionFailures() {
    return transitionFailures;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [stateMachineId=" + stateMachineId + ", startTstampMillis="
        + startTstampMillis + ", totalTransitions=" + totalTransitions + ", totalRedirects="
        + totalRedirects + ", transitionFailures=" + transitionFailures
        + ", lastTransitionMillis=" + lastTransitionMillis + "]";
  }

}
