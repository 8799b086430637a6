package railroad.extract;

import java.util.List;

/**
 * How a programming language writes string literals.
 *
 * <p>Raw strings are described by pairs of delimiters: the raw string opened
 * by {@code rawStringStarts.get(i)} is closed by {@code rawStringEnds.get(i)}
 * and contains no escapes. A language without raw strings has both lists
 * empty.
 *
 * @param stringDelimiters delimiters opening and closing plain strings
 * @param escapeCharacter character escaping the next one inside plain strings
 * @param rawStringStarts delimiters opening raw strings
 * @param rawStringEnds delimiters closing raw strings
 */
public record StringFormat(
  List<String> stringDelimiters,
  char escapeCharacter,
  List<String> rawStringStarts,
  List<String> rawStringEnds
) {

  public StringFormat {
    if (stringDelimiters.isEmpty()) {
      throw new IllegalArgumentException("String format needs at least one delimiter");
    }
    if (rawStringStarts.size() != rawStringEnds.size()) {
      throw new IllegalArgumentException(
        "Raw string starts " + rawStringStarts + " don't pair up with ends " + rawStringEnds
      );
    }
    stringDelimiters = List.copyOf(stringDelimiters);
    rawStringStarts = List.copyOf(rawStringStarts);
    rawStringEnds = List.copyOf(rawStringEnds);
  }

  /**
   * Format of a language without raw strings.
   */
  public static StringFormat plain(char escapeCharacter, String... stringDelimiters) {
    return new StringFormat(List.of(stringDelimiters), escapeCharacter, List.of(), List.of());
  }
}
