package railroad.parser;

import java.util.Map;

/**
 * Builtin character classes.
 *
 * <p>Every class except {@link #ANY} comes in a positive and a negated form,
 * written with a lower and upper case escape letter respectively.
 */
public enum MetaCharacter {
  /**
   * Word character, {@code \w}
   */
  WORD("Word", true),

  /**
   * Non-word character, {@code \W}
   */
  NON_WORD("Non-Word", false),

  /**
   * Digit character, {@code \d}
   */
  DIGIT("Digit", true),

  /**
   * Non-digit character, {@code \D}
   */
  NON_DIGIT("Non-Digit", false),

  /**
   * Whitespace character, {@code \s}
   */
  WHITESPACE("Whitespace", true),

  /**
   * Non-whitespace character, {@code \S}
   */
  NON_WHITESPACE("Non-Whitespace", false),

  /**
   * Any character, {@code .}
   */
  ANY("Any", true);

  /**
   * Mapping from the escaped character used to represent the class to the class.
   */
  public static final Map<Character, MetaCharacter> CHARACTERS = Map.of(
    'w', MetaCharacter.WORD,
    'W', MetaCharacter.NON_WORD,
    'd', MetaCharacter.DIGIT,
    'D', MetaCharacter.NON_DIGIT,
    's', MetaCharacter.WHITESPACE,
    'S', MetaCharacter.NON_WHITESPACE
  );

  private final String label;
  private final boolean positive;

  MetaCharacter(String label, boolean positive) {
    this.label = label;
    this.positive = positive;
  }

  /**
   * Label shown for the class in diagrams and descriptions.
   */
  public String label() {
    return label;
  }

  /**
   * Is this the positive (rather than the negated) form of the class?
   */
  public boolean isPositive() {
    return positive;
  }
}
