package railroad.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Character other than a digit or comma inside a {@code {...}} quantifier.
 */
public class RepetitionValueException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 6633401587312087731L;

  /**
   * Code point of the offending character.
   */
  public final int found;

  public RepetitionValueException(int found, String regex, int index) {
    super(
      "Expected number for repetition amount, received '" + Character.toString(found) + "'",
      regex,
      index
    );
    this.found = found;
  }
}
