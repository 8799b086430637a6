package railroad;

import java.util.List;

/**
 * Rendered railroad diagram.
 *
 * @param rows rows of the diagram, all {@code width} columns wide
 * @param width number of columns in every row
 * @param height number of rows
 */
public record Diagram(List<String> rows, int width, int height) {

  public Diagram(List<String> rows, int width, int height) {
    this.rows = List.copyOf(rows);
    this.width = width;
    this.height = height;
  }

  /**
   * Rows joined by newlines.
   */
  public String text() {
    return String.join("\n", rows);
  }
}
