package com.github.fsm;

/**
 * The minimal capability surface the {@link StateMachine} needs from the properties bundled with
 * every state. Everything else a properties object carries (labels, further callbacks, routing
 * info) is payload and is never looked at by the machine.
 * 
 * Both hooks are optional; a null hook is simply skipped.
 */
public interface StateProperties<S> {

  /**
   * Hook run when the machine is about to enter this state. It may redirect the machine elsewhere.
   */
  default EntryHook<S> getOnEnter() {
    return null;
  }

  /**
   * Hook run when the machine is about to leave this state.
   */
  default ExitHook getOnExit() {
    return null;
  }

}
