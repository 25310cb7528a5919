package io.lacuna.fsm;

/**
 * Thrown when an automaton definition violates a structural invariant: a dangling state or symbol reference, an
 * ambiguous deterministic transition, a missing start state, or a definition that could not be parsed at all.
 */
public class MalformedAutomatonException extends AutomatonException {

  public MalformedAutomatonException(String message) {
    super(ErrorKind.MALFORMED_AUTOMATON, message);
  }

  public MalformedAutomatonException(String message, Throwable cause) {
    super(ErrorKind.MALFORMED_AUTOMATON, message, cause);
  }
}
