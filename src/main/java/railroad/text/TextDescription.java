package railroad.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain English description of a regular expression, one step per line.
 *
 * @param lines description lines
 * @param highlights structural headers within the lines
 */
public record TextDescription(List<String> lines, List<Highlight> highlights) {

  /**
   * Number of spaces nested content is indented by.
   */
  public static final int INDENT = 4;

  public TextDescription(List<String> lines, List<Highlight> highlights) {
    this.lines = List.copyOf(lines);
    this.highlights = List.copyOf(highlights);
  }

  public static TextDescription empty() {
    return new TextDescription(List.of(), List.of());
  }

  /**
   * Single line without highlights.
   */
  public static TextDescription line(String text) {
    return new TextDescription(List.of(text), List.of());
  }

  /**
   * Single line highlighted in full.
   */
  public static TextDescription header(String text) {
    return new TextDescription(List.of(text), List.of(new Highlight(0, 0, text.length())));
  }

  /**
   * This description with every line pushed right.
   *
   * @param columns number of spaces to insert
   */
  public TextDescription indented(int columns) {
    final String indent = " ".repeat(columns);
    final var shiftedLines = new ArrayList<String>(lines.size());
    for (String line : lines) {
      shiftedLines.add(indent + line);
    }
    final var shiftedHighlights = new ArrayList<Highlight>(highlights.size());
    for (Highlight highlight : highlights) {
      shiftedHighlights.add(highlight.shifted(0, columns));
    }
    return new TextDescription(shiftedLines, shiftedHighlights);
  }

  /**
   * This description followed by another one.
   */
  public TextDescription followedBy(TextDescription next) {
    final var joinedLines = new ArrayList<String>(lines);
    joinedLines.addAll(next.lines);
    final var joinedHighlights = new ArrayList<Highlight>(highlights);
    for (Highlight highlight : next.highlights) {
      joinedHighlights.add(highlight.shifted(lines.size(), 0));
    }
    return new TextDescription(joinedLines, joinedHighlights);
  }

  /**
   * Lines joined by newlines.
   */
  public String text() {
    return String.join("\n", lines);
  }
}
