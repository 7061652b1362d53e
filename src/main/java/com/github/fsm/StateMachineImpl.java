package com.github.fsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * A simple Finite State Machine. See {@link StateMachine} for the notes on usage.
 * 
 * The only mutable field is {@link #currentState}. It is null only until the transition run by
 * the constructor commits, so callers never see it unset.
 */
public final class StateMachineImpl<S, P extends StateProperties<S>>
    implements StateMachine<S, P> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final String machineLabel;

  private final StateMachineConfiguration config;

  // fully hydrated at construction and never modified afterwards
  private final Map<S, P> stateTable;

  private final DefaultPropertiesFactory<S, P> defaultPropertiesFactory;

  // optional
  private final EnteredStateListener<S, P> enteredStateListener;

  private final StateMachineStatistics machineStats;

  private S currentState;

  StateMachineImpl(final StateMachineConfiguration config, final Map<S, P> stateTable,
      final S initialState, final DefaultPropertiesFactory<S, P> defaultPropertiesFactory,
      final EnteredStateListener<S, P> enteredStateListener) throws StateMachineException {
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "State machine configuration cannot be null");
    }
    this.config = config;
    this.machineLabel = config.getMachineName() + "/" + machineId;
    if (initialState == null) {
      throw new StateMachineException(Code.INVALID_STATE, "Initial state cannot be null");
    }
    if (defaultPropertiesFactory == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "Default properties factory cannot be null");
    }
    final Map<S, P> copiedTable = new LinkedHashMap<>();
    if (stateTable != null) {
      for (final Map.Entry<S, P> entry : stateTable.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          throw new StateMachineException(Code.INVALID_TABLE);
        }
        copiedTable.put(entry.getKey(), entry.getValue());
      }
    }
    this.stateTable = Collections.unmodifiableMap(copiedTable);
    this.defaultPropertiesFactory = defaultPropertiesFactory;
    this.enteredStateListener = enteredStateListener;
    this.machineStats = new StateMachineStatistics(machineId);

    logInfo(machineLabel, String.format("Firing up state machine with %d mapped states, %s",
        this.stateTable.size(), config));
    setState(initialState);
    logInfo(machineLabel, "Successfully fired up state machine in state " + currentState);
  }

  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public P getValues() {
    return get(currentState);
  }

  @Override
  public P get(final S state) {
    final P properties = stateTable.get(state);
    return properties != null ? properties : defaultPropertiesFactory.create(state);
  }

  @Override
  public void setState(final S nextState) throws StateMachineException {
    if (nextState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    boolean success = false;
    try {
      // the very first call, from the constructor, has nothing to exit
      final S previousState = currentState;
      if (previousState != null) {
        final ExitHook onExit = lookupProperties(previousState).getOnExit();
        if (onExit != null) {
          logDebug(machineLabel, "Running exit hook of " + previousState);
          onExit.onExit();
        }
      }

      S candidate = nextState;
      int redirectHops = 0;
      while (true) {
        final EntryHook<S> onEnter = lookupProperties(candidate).getOnEnter();
        if (onEnter == null) {
          break;
        }
        logDebug(machineLabel, "Running entry hook of " + candidate);
        final S redirect = onEnter.onEnter();
        if (redirect == null || redirect.equals(candidate)) {
          break;
        }
        if (config.isRedirectGuarded() && redirectHops >= config.getMaxRedirectHops()) {
          throw new StateMachineException(Code.REDIRECT_LIMIT_EXCEEDED,
              String.format("Transition to %s gave up at %s->%s after %d redirects", nextState,
                  candidate, redirect, redirectHops));
        }
        redirectHops++;
        machineStats.totalRedirects++;
        logDebug(machineLabel, String.format("Redirected %s->%s", candidate, redirect));
        candidate = redirect;
      }

      currentState = candidate;
      machineStats.totalTransitions++;
      machineStats.lastTransitionMillis = System.currentTimeMillis();
      logInfo(machineLabel,
          String.format("Successfully transitioned from %s->%s", previousState, candidate));

      if (enteredStateListener != null) {
        enteredStateListener.onEnteredState(candidate, get(candidate));
      }
      success = true;
    } finally {
      if (!success) {
        machineStats.transitionFailures++;
      }
    }
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "StateMachineImpl [machine=" + machineLabel + ", currentState=" + currentState
        + ", mappedStates=" + stateTable.keySet() + "]";
  }

  /**
   * Same as {@link #get(Object)} but refuses a null from the default properties factory, since the
   * machine needs the hooks of the state it is looking at.
   */
  private P lookupProperties(final S state) throws StateMachineException {
    final P properties = get(state);
    if (properties == null) {
      throw new StateMachineException(Code.INVALID_PROPERTIES,
          "Default properties factory returned null for state " + state);
    }
    return properties;
  }

  private static void logInfo(final String machineLabel, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineLabel).append("] ")
        .append(message).toString());
  }

  private static void logDebug(final String machineLabel, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineLabel).append("] ")
          .append(message).toString());
    }
  }

}
