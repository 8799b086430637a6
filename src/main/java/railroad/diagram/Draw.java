package railroad.diagram;

import java.util.List;

/**
 * Node of a railroad diagram which knows its own extent and how to draw itself.
 *
 * <p>Implementations must be consistent: {@link #draw()} returns exactly
 * {@link #height()} rows, each exactly {@link #width()} columns wide, and the
 * row at {@link #entryHeight()} is where the connecting rail enters on the
 * left and leaves on the right. That row always exists, so
 * {@code entryHeight() < height()}.
 */
public interface Draw {

  /**
   * The number of rows from this node's top to where the entering,
   * connecting rail is drawn.
   */
  int entryHeight();

  /**
   * This node's total height, in rows.
   */
  int height();

  /**
   * This node's total width, in columns.
   */
  int width();

  /**
   * Draw this node.
   *
   * @return {@link #height()} rows of {@link #width()} columns each
   */
  List<String> draw();

  /**
   * Number of columns text occupies, counting one per code point.
   *
   * @param text text to measure
   */
  static int displayWidth(String text) {
    return text.codePointCount(0, text.length());
  }

  /**
   * Repeat a glyph, with non-positive counts producing the empty string.
   *
   * @param glyph glyph to repeat
   * @param count number of repetitions
   */
  static String repeat(String glyph, int count) {
    return glyph.repeat(Math.max(0, count));
  }

  /**
   * The largest {@code entryHeight()} of some nodes.
   */
  static int maxEntryHeight(List<? extends Draw> nodes) {
    return nodes.stream().mapToInt(Draw::entryHeight).max().orElse(0);
  }

  /**
   * The largest {@code width()} of some nodes.
   */
  static int maxWidth(List<? extends Draw> nodes) {
    return nodes.stream().mapToInt(Draw::width).max().orElse(0);
  }

  /**
   * The sum of the {@code width()} of some nodes.
   */
  static int totalWidth(List<? extends Draw> nodes) {
    return nodes.stream().mapToInt(Draw::width).sum();
  }

  /**
   * The sum of the {@code height()} of some nodes.
   */
  static int totalHeight(List<? extends Draw> nodes) {
    return nodes.stream().mapToInt(Draw::height).sum();
  }
}
