package cyk.syntax;

/**
 * Raised when a grammar does not satisfy a precondition of the operation it
 * was handed to, e.g. a grammar given to the CYK parser that is not in
 * Chomsky normal form.
 */
public class InvalidGrammarException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidGrammarException(String message) {
    super(message);
  }

}
