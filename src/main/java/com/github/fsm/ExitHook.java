package com.github.fsm;

/**
 * Side-effect fired when the machine leaves the owning state.
 */
@FunctionalInterface
public interface ExitHook {

  void onExit() throws StateMachineException;

}
