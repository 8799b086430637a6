package railroad.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Character class range whose endpoints are not both digits, both lower case
 * letters or both upper case letters.
 */
public class CharacterRangeException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -2905713374518066149L;

  /**
   * Code point of the first endpoint of the range.
   */
  public final int first;

  /**
   * Code point of the last endpoint of the range.
   */
  public final int last;

  public CharacterRangeException(int first, int last, String regex, int index) {
    super(
      "Invalid character range [" + Character.toString(first) + "-" + Character.toString(last) + "]",
      regex,
      index
    );
    this.first = first;
    this.last = last;
  }
}
