package com.github.fsm;

/**
 * Convenience base class for state properties. Extend it and add whatever payload fields the
 * application needs, passing the optional hooks up through the constructor.
 */
public class FsmProperties<S> implements StateProperties<S> {
  private final EntryHook<S> onEnter;
  private final ExitHook onExit;

  public FsmProperties() {
    this(null, null);
  }

  public FsmProperties(final EntryHook<S> onEnter, final ExitHook onExit) {
    this.onEnter = onEnter;
    this.onExit = onExit;
  }

  @Override
  public EntryHook<S> getOnEnter() {
    return onEnter;
  }

  @Override
  public ExitHook getOnExit() {
    return onExit;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [onEnter=" + (onEnter != null) + ", onExit="
        + (onExit != null) + "]";
  }
}
