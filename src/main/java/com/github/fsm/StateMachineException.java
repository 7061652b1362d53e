package com.github.fsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate various error/exception conditions. Hooks may throw it too; the machine never
 * intercepts what a hook throws, it simply lets it out of {@link StateMachine#setState(Object)}.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE("Null state is invalid"),
    // 2.
    INVALID_TABLE("State table cannot contain null states or null properties"),
    // 3.
    INVALID_PROPERTIES("Default properties factory returned null properties"),
    // 4.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 5.
    REDIRECT_LIMIT_EXCEEDED(
        "Entry hooks redirected the machine more times than the configured maxRedirectHops"),
    // 6.
    UNKNOWN_FAILURE(
        "State machine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
