package railroad.extract;

import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Finds the regular expression written in a string literal of a line of code.
 *
 * <p>The line is scanned left to right for literals, honouring escapes in
 * plain strings, so delimiters inside one literal never start another.
 */
public final class RegexExtractor {

  private static final Logger LOGGER = Logger.getLogger(RegexExtractor.class.getName());

  private final StringFormat format;

  // Indices of raw string starts, longest first so that `r#"` wins over `r"`
  private final List<Integer> rawOrder;

  public RegexExtractor(StringFormat format) {
    this.format = format;
    this.rawOrder = IntStream.range(0, format.rawStringStarts().size())
      .boxed()
      .sorted(Comparator.comparingInt((Integer i) -> format.rawStringStarts().get(i).length()).reversed())
      .toList();
  }

  public RegexExtractor(Language language) {
    this(language.format());
  }

  public StringFormat format() {
    return format;
  }

  /**
   * Location of a string literal in a line.
   *
   * @param start index of the opening delimiter
   * @param contentStart index of the first character inside the literal
   * @param contentEnd index of the closing delimiter
   * @param end index just past the closing delimiter
   * @param raw is this a raw string, without escapes?
   */
  private record Literal(int start, int contentStart, int contentEnd, int end, boolean raw) {
  }

  /**
   * Extract the contents of the string literal surrounding a column.
   *
   * <p>Escaped delimiters and doubled escape characters in plain strings are
   * collapsed; every other escape is left for the regular expression parser.
   *
   * @param line line of source code
   * @param column 0-based column of the cursor, anywhere inside the literal
   *   including its delimiters
   * @return regular expression written in the literal
   * @throws RegexExtractionException if the column isn't inside a literal
   */
  public String extract(String line, int column) {
    int index = 0;
    while (index < line.length() && index <= column) {
      final Literal literal = literalAt(line, index, column);
      if (literal == null) {
        index++;
        continue;
      }

      if (literal.start() <= column && column < literal.end()) {
        LOGGER.fine(() -> "Found literal at " + literal.start() + "-" + literal.end());
        final String content = line.substring(literal.contentStart(), literal.contentEnd());
        return literal.raw() ? content : unescape(content);
      }
      index = literal.end();
    }

    throw new RegexExtractionException("No string literal found", column);
  }

  /**
   * Strip the delimiters off a complete string literal.
   *
   * <p>Raw string delimiters are tried before plain ones, longest first. Text
   * which isn't delimited is returned unchanged.
   *
   * @param text string literal, including its delimiters
   * @return contents of the literal
   */
  public String stripDelimiters(String text) {
    for (int i : rawOrder) {
      final String start = format.rawStringStarts().get(i);
      final String end = format.rawStringEnds().get(i);
      if (text.length() >= start.length() + end.length()
          && text.startsWith(start)
          && text.endsWith(end)) {
        return text.substring(start.length(), text.length() - end.length());
      }
    }
    for (String delimiter : format.stringDelimiters()) {
      if (text.length() >= 2 * delimiter.length()
          && text.startsWith(delimiter)
          && text.endsWith(delimiter)) {
        return text.substring(delimiter.length(), text.length() - delimiter.length());
      }
    }
    return text;
  }

  /**
   * Literal opening at an index, or {@code null} if none opens there.
   */
  private Literal literalAt(String line, int index, int column) {
    if (index == 0 || !isIdentifierPart(line.charAt(index - 1))) {
      for (int i : rawOrder) {
        final String start = format.rawStringStarts().get(i);
        if (line.startsWith(start, index)) {
          final int contentStart = index + start.length();
          final String end = format.rawStringEnds().get(i);
          final int contentEnd = line.indexOf(end, contentStart);
          if (contentEnd < 0) {
            throw new RegexExtractionException("Unterminated raw string at " + index, column);
          }
          return new Literal(index, contentStart, contentEnd, contentEnd + end.length(), true);
        }
      }
    }

    for (String delimiter : format.stringDelimiters()) {
      if (line.startsWith(delimiter, index)) {
        final int contentStart = index + delimiter.length();
        int position = contentStart;
        while (position < line.length()) {
          if (line.charAt(position) == format.escapeCharacter()) {
            position += 2;
          } else if (line.startsWith(delimiter, position)) {
            return new Literal(index, contentStart, position, position + delimiter.length(), false);
          } else {
            position++;
          }
        }
        throw new RegexExtractionException("Unterminated string at " + index, column);
      }
    }

    return null;
  }

  private String unescape(String content) {
    final char escape = format.escapeCharacter();
    final var builder = new StringBuilder(content.length());
    int index = 0;
    while (index < content.length()) {
      final char c = content.charAt(index);
      if (c == escape && index + 1 < content.length()) {
        final int next = index + 1;
        if (content.charAt(next) == escape) {
          builder.append(escape);
          index += 2;
          continue;
        }
        final String delimiter = delimiterAt(content, next);
        if (delimiter != null) {
          builder.append(delimiter);
          index = next + delimiter.length();
          continue;
        }
      }
      builder.append(c);
      index++;
    }
    return builder.toString();
  }

  private String delimiterAt(String content, int index) {
    for (String delimiter : format.stringDelimiters()) {
      if (content.startsWith(delimiter, index)) {
        return delimiter;
      }
    }
    return null;
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
