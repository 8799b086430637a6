package railroad.text;

/**
 * Span of a description line to emphasize.
 *
 * @param line 0-based index of the line
 * @param startColumn first highlighted column
 * @param endColumn column just past the highlight
 */
public record Highlight(int line, int startColumn, int endColumn) {

  Highlight shifted(int lines, int columns) {
    return new Highlight(line + lines, startColumn + columns, endColumn + columns);
  }
}
