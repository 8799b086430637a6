package railroad.parser;

import java.util.OptionalInt;
import java.util.regex.PatternSyntaxException;

/**
 * An expected character was not found at the cursor.
 *
 * <p>This is how unclosed groups, classes, quantifiers and group names are
 * reported: the parser expects the closing delimiter and finds something else
 * (or the end of the pattern) instead.
 */
public class UnexpectedCharacterException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -8170942712958231458L;

  /**
   * Character which was expected at the cursor.
   */
  public final char expected;

  /**
   * Code point found instead, or nothing if the pattern ended.
   */
  public final OptionalInt found;

  public UnexpectedCharacterException(char expected, OptionalInt found, String regex, int index) {
    super(describe(expected, found), regex, index);
    this.expected = expected;
    this.found = found;
  }

  private static String describe(char expected, OptionalInt found) {
    if (found.isPresent()) {
      return "Expected character '" + expected + "' but found '" + Character.toString(found.getAsInt()) + "'";
    } else {
      return "Expected character '" + expected + "' but reached the end of the pattern";
    }
  }
}
