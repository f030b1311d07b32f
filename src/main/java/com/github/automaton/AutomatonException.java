package com.github.automaton;

/**
 * Unified single exception thrown while assembling an automaton. The code enum encapsulates the
 * various failure conditions so callers can branch on {@link #getCode()} rather than parsing
 * messages. All of these are construction-time failures: a successfully built automaton never
 * throws from its query methods.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_TRANSITION_FORMAT(
        "Transition entries must provide a (state, symbol) pair and a destination collection"),
    // 2.
    START_STATE_NOT_IN_STATES("Start state must be in the set of states"),
    // 3.
    ACCEPT_STATES_NOT_SUBSET("Accept states must be a subset of the set of states"),
    // 4.
    TRANSITION_STATE_INVALID("Transition is keyed by a state that is not in the set of states"),
    // 5.
    TRANSITION_SYMBOL_INVALID(
        "Transition is keyed by a symbol that is neither in the alphabet nor the empty string"),
    // 6.
    TRANSITION_DESTINATION_INVALID(
        "Transition leads to a destination that is not in the set of states"),
    // 7.
    NOT_DETERMINISTIC(
        "Automaton has empty string transitions, multiple destinations or missing transitions"),
    // 8.
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
