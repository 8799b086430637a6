package railroad.parser;

/**
 * A syntax tree has a shape the parser never produces.
 *
 * <p>This signals a bug in whatever built the tree, not a problem with the
 * user's pattern, so it is unchecked and never recovered from.
 */
public class InvalidParsingException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 1906284770330186517L;

  public InvalidParsingException(String message) {
    super(message);
  }
}
