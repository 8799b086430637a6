package railroad.parser;

import java.util.Map;

/**
 * Zero-width assertions.
 */
public enum AnchorType {
  /**
   * Beginning of line, {@code ^}
   */
  START("LINE START"),

  /**
   * End of line, {@code $}
   */
  END("LINE END"),

  /**
   * Word boundary, {@code \b}
   */
  WORD_BOUNDARY("WORD BOUNDARY"),

  /**
   * Non-word boundary, {@code \B}
   */
  NOT_WORD_BOUNDARY("NOT WORD BOUNDARY");

  /**
   * Mapping from the escaped character used to represent the anchor to the anchor.
   */
  public static final Map<Character, AnchorType> CHARACTERS = Map.of(
    'b', AnchorType.WORD_BOUNDARY,
    'B', AnchorType.NOT_WORD_BOUNDARY
  );

  private final String label;

  AnchorType(String label) {
    this.label = label;
  }

  /**
   * Label shown for the anchor in diagrams and descriptions.
   */
  public String label() {
    return label;
  }
}
