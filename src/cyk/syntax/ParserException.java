package cyk.syntax;

/**
 * Raised when a textual grammar description is malformed.
 */
public class ParserException extends Exception {

  private static final long serialVersionUID = 1L;

  public ParserException(String message) {
    super(message);
  }
  public ParserException(String message, Throwable cause) {
    super(message, cause);
  }

}
