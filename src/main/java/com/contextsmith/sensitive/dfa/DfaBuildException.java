package com.contextsmith.sensitive.dfa;

/**
 * Thrown when an automaton cannot be built. No partially built automaton is
 * ever handed out once this has been thrown.
 */
public class DfaBuildException extends Exception {
  private static final long serialVersionUID = 1L;

  public DfaBuildException(String message) {
    super(message);
  }

  public DfaBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
