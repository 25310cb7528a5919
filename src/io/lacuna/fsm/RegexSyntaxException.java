package io.lacuna.fsm;

/**
 * Thrown by the regular expression parser, with the 0-based offset of the offending character.
 */
public class RegexSyntaxException extends AutomatonException {

  private final int position;

  public RegexSyntaxException(String message, int position) {
    super(ErrorKind.SYNTAX_ERROR, message + " at position " + position);
    this.position = position;
  }

  public int position() {
    return position;
  }
}
