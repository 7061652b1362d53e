package com.github.fsm;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple Finite State Machine. At each point in time the machine is in exactly one state out of
 * a closed set, and every state has a bundle of properties associated with it which the machine
 * exposes. The machine moves from state to state only as directed by its client.
 * 
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 * 
 * 1. this FSM instance is NOT thread-safe. It assumes single-threaded or otherwise serialized
 * access; if one instance is shared across threads, the caller must synchronize.<br>
 * 
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed. Each has its own current state.<br>
 * 
 * 3. a state's entry hook can act as the state's gatekeeper: it may redirect the machine into
 * another state and the machine is never observably in the rejected state. Redirects are followed
 * until a state accepts, and only then is the new state committed and the listener notified,
 * once.<br>
 * 
 * 4. hooks may call {@link #setState(Object)} on the same machine. Such nested calls run to
 * completion before the outer call resumes; nothing guards against this.<br>
 * 
 * 5. the machine never waits on anything. A hook that kicks off slow work must call setState()
 * again when that work completes, and must itself check that the machine has not moved on in the
 * meantime.<br>
 * 
 * 6. the state table and default properties factory belong to the caller and are only ever read
 * by the machine. To change the table, build a new machine.<br>
 */
public interface StateMachine<S, P extends StateProperties<S>> {

  /**
   * The state the machine is currently in. Always defined once the machine has been built.
   */
  S getCurrentState();

  /**
   * The properties belonging to the current state, same as {@code get(getCurrentState())}.
   */
  P getValues();

  /**
   * Look up the properties of any state, active or not. States missing from the table are
   * synthesised by the default properties factory on every call.
   */
  P get(final S state);

  /**
   * Direct the machine to transition to nextState: run the current state's exit hook, follow any
   * redirects requested by entry hooks, commit the final state and notify the listener.
   * 
   * Anything thrown by a hook or the listener is passed through untouched. If that happens before
   * the new state is committed, the current state is left as it was.
   */
  void setState(final S nextState) throws StateMachineException;

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM
   */
  StateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder<S, P extends StateProperties<S>> {
    private StateMachineConfiguration config;
    private final Map<S, P> stateTable = new LinkedHashMap<>();
    private S initialState;
    private DefaultPropertiesFactory<S, P> defaultPropertiesFactory;
    private EnteredStateListener<S, P> enteredStateListener;
    private boolean nullTableEntry;

    public static <S, P extends StateProperties<S>> StateMachineBuilder<S, P> newBuilder() {
      return new StateMachineBuilder<>();
    }

    public StateMachineBuilder<S, P> config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineBuilder<S, P> state(final S state, final P properties) {
      if (state == null || properties == null) {
        nullTableEntry = true;
      } else {
        this.stateTable.put(state, properties);
      }
      return this;
    }

    public StateMachineBuilder<S, P> table(final Map<S, P> stateTable) {
      if (stateTable != null) {
        for (Map.Entry<S, P> entry : stateTable.entrySet()) {
          state(entry.getKey(), entry.getValue());
        }
      }
      return this;
    }

    public StateMachineBuilder<S, P> initialState(final S initialState) {
      this.initialState = initialState;
      return this;
    }

    public StateMachineBuilder<S, P> defaultProperties(
        final DefaultPropertiesFactory<S, P> defaultPropertiesFactory) {
      this.defaultPropertiesFactory = defaultPropertiesFactory;
      return this;
    }

    public StateMachineBuilder<S, P> onEnteredState(
        final EnteredStateListener<S, P> enteredStateListener) {
      this.enteredStateListener = enteredStateListener;
      return this;
    }

    /**
     * Builds the machine and runs its first transition, into the initial state. No exit hook fires
     * for that first transition.
     */
    public StateMachine<S, P> build() throws StateMachineException {
      if (nullTableEntry) {
        throw new StateMachineException(StateMachineException.Code.INVALID_TABLE);
      }
      return new StateMachineImpl<>(
          config != null ? config : StateMachineConfiguration.defaults(), stateTable,
          initialState, defaultPropertiesFactory, enteredStateListener);
    }

    private StateMachineBuilder() {}
  }

}
