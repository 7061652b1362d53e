package com.github.fsm;

/**
 * Notified once per completed {@link StateMachine#setState(Object)}, after the final state of the
 * redirect chain has been committed. Intermediate redirect hops are never reported.
 */
@FunctionalInterface
public interface EnteredStateListener<S, P extends StateProperties<S>> {

  void onEnteredState(final S state, final P properties) throws StateMachineException;

}
