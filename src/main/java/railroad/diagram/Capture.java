package railroad.diagram;

import java.util.ArrayList;
import java.util.List;

/**
 * A group, drawn as a dashed box labelled with its name or number.
 *
 * <pre>
 *   ╭╌╌╌ Group 1 ╌╌╌╮
 *   ┆ ┌──────────┐ ┆
 *   ┼─┤   Node   ├─┼
 *   ┆ └──────────┘ ┆
 *   ╰╌╌╌╌╌╌╌╌╌╌╌╌╌╌╯
 * </pre>
 *
 * The box is widened (and the node centered inside it) if the label doesn't
 * fit on the top edge.
 */
public final class Capture implements Draw {

  private final Draw inner;
  private final String name;

  /**
   * @param inner grouped node
   * @param name label shown on the top edge
   */
  public Capture(Draw inner, String name) {
    this.inner = inner;
    this.name = name;
  }

  public Draw inner() {
    return inner;
  }

  public String name() {
    return name;
  }

  private String label() {
    return " " + name + " ";
  }

  // Columns between the two corners of the box
  private int span() {
    return Math.max(inner.width() + 2, Draw.displayWidth(label()));
  }

  @Override
  public int entryHeight() {
    return inner.entryHeight() + 1;
  }

  @Override
  public int height() {
    return inner.height() + 2;
  }

  @Override
  public int width() {
    return span() + 2;
  }

  @Override
  public List<String> draw() {
    final int span = span();
    final int extra = span - inner.width() - 2;
    final int leftPad = extra / 2;
    final int rightPad = extra - leftPad;
    final var diagram = new ArrayList<String>();

    // Top edge, with the label centered on it
    final String label = label();
    final int labelPadding = span - Draw.displayWidth(label);
    final int labelLeft = labelPadding / 2;
    diagram.add(
      Glyphs.C_TL_RND + Draw.repeat(Glyphs.L_HORZ_D, labelLeft)
        + label
        + Draw.repeat(Glyphs.L_HORZ_D, labelPadding - labelLeft) + Glyphs.C_TR_RND
    );

    final int innerEntry = inner.entryHeight();
    final List<String> rows = inner.draw();
    for (int i = 0; i < rows.size(); i++) {
      final String row = rows.get(i);
      if (i == innerEntry) {
        diagram.add(
          Glyphs.CROSS + Draw.repeat(Glyphs.L_HORZ, 1 + leftPad)
            + row
            + Draw.repeat(Glyphs.L_HORZ, 1 + rightPad) + Glyphs.CROSS
        );
      } else {
        diagram.add(
          Glyphs.L_VERT_D + Draw.repeat(" ", 1 + leftPad)
            + row
            + Draw.repeat(" ", 1 + rightPad) + Glyphs.L_VERT_D
        );
      }
    }

    // Bottom edge
    diagram.add(Glyphs.C_BL_RND + Draw.repeat(Glyphs.L_HORZ_D, span) + Glyphs.C_BR_RND);

    return diagram;
  }

  @Override
  public String toString() {
    return "Capture[" + name + ", " + inner + "]";
  }
}
