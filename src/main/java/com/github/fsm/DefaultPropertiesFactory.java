package com.github.fsm;

/**
 * Synthesises properties for states that are missing from the machine table. Results are never
 * cached by the machine, so every lookup of an absent state calls the factory again.
 */
@FunctionalInterface
public interface DefaultPropertiesFactory<S, P extends StateProperties<S>> {

  P create(final S state);

}
