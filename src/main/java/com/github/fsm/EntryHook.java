package com.github.fsm;

/**
 * Gatekeeper for a state. Invoked every time the machine proposes to enter the owning state,
 * including self-transitions and proposals that arrive through a redirect.
 */
@FunctionalInterface
public interface EntryHook<S> {

  /**
   * Return null (or the proposed state itself) to accept the proposed state, or some other state to
   * redirect the machine there instead. A redirected-to state gets its own entry hook evaluated in
   * turn.
   */
  S onEnter() throws StateMachineException;

}
