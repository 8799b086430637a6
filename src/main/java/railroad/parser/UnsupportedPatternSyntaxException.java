package railroad.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs which are valid regular expressions
 * but cannot be drawn (lookarounds, back-references, inline flags).
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 4127608823169542203L;

  /**
   * (Capitalized) name of the unsupported feature category.
   */
  public final String unsupportedFeatureCategory;

  public UnsupportedPatternSyntaxException(
    String unsupportedFeatureCategory,
    String regex,
    int index
  ) {
    super(unsupportedFeatureCategory + " are not supported", regex, index);
    this.unsupportedFeatureCategory = unsupportedFeatureCategory;
  }
}
