package railroad.diagram;

import java.util.ArrayList;
import java.util.List;

/**
 * A node which may be skipped, with the bypass drawn above it.
 *
 * <pre>
 *   ╭──────────────╮
 *   │ ┌──────────┐ │
 *   ┴─┤ Optional ├─┴
 *     └──────────┘
 * </pre>
 */
public final class Optional implements Draw {

  private final Draw inner;

  public Optional(Draw inner) {
    this.inner = inner;
  }

  public Draw inner() {
    return inner;
  }

  @Override
  public int entryHeight() {
    return inner.entryHeight() + 1;
  }

  @Override
  public int height() {
    return inner.height() + 1;
  }

  @Override
  public int width() {
    return inner.width() + 4;
  }

  @Override
  public List<String> draw() {
    final var diagram = new ArrayList<String>();

    // Top loop
    diagram.add(Glyphs.C_TL_RND + Draw.repeat(Glyphs.L_HORZ, inner.width() + 2) + Glyphs.C_TR_RND);

    final int innerEntry = inner.entryHeight();
    final List<String> rows = inner.draw();
    for (int i = 0; i < rows.size(); i++) {
      final String row = rows.get(i);
      if (i == innerEntry) {
        diagram.add(Glyphs.J_UP + Glyphs.L_HORZ + row + Glyphs.L_HORZ + Glyphs.J_UP);
      } else if (i < innerEntry) {
        diagram.add(Glyphs.L_VERT + " " + row + " " + Glyphs.L_VERT);
      } else {
        diagram.add("  " + row + "  ");
      }
    }

    return diagram;
  }

  @Override
  public String toString() {
    return "Optional[" + inner + "]";
  }
}
