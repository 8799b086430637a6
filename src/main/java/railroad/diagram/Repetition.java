package railroad.diagram;

import java.util.ArrayList;
import java.util.List;
import railroad.parser.RepetitionType;

/**
 * A node matched a number of times, with a return loop underneath.
 *
 * <pre>
 *     ┌────────────┐
 *   ┬─┤ Repetition ├─┬
 *   │ └────────────┘ │
 *   ╰───── 2+ ───────╯
 * </pre>
 *
 * The loop is widened (and the node centered above it) if the description
 * of the count doesn't fit underneath the node.
 */
public final class Repetition implements Draw {

  private final Draw inner;
  private final RepetitionType repetition;
  private final String description;

  /**
   * @param inner repeated node
   * @param repetition count of repetitions, anything but zero-or-one
   */
  public Repetition(Draw inner, RepetitionType repetition) {
    this.inner = inner;
    this.repetition = repetition;
    this.description = repetition.accept(DESCRIPTION);
  }

  public Draw inner() {
    return inner;
  }

  public RepetitionType repetition() {
    return repetition;
  }

  /**
   * Description of the count shown on the bottom bar, such as {@code " 2-4 "}.
   */
  public String description() {
    return description;
  }

  // Columns between the two corners of the bottom bar
  private int barWidth() {
    return Math.max(inner.width() + 2, Draw.displayWidth(description));
  }

  @Override
  public int entryHeight() {
    return inner.entryHeight();
  }

  @Override
  public int height() {
    return inner.height() + 1;
  }

  @Override
  public int width() {
    return barWidth() + 2;
  }

  @Override
  public List<String> draw() {
    final int barWidth = barWidth();
    final int extra = barWidth - inner.width() - 2;
    final int leftPad = extra / 2;
    final int rightPad = extra - leftPad;
    final int entryHeight = entryHeight();

    final var diagram = new ArrayList<String>();
    final List<String> rows = inner.draw();
    for (int i = 0; i < rows.size(); i++) {
      final String row = rows.get(i);
      if (i == entryHeight) {
        diagram.add(
          Glyphs.J_DOWN + Draw.repeat(Glyphs.L_HORZ, 1 + leftPad)
            + row
            + Draw.repeat(Glyphs.L_HORZ, 1 + rightPad) + Glyphs.J_DOWN
        );
      } else if (i > entryHeight) {
        diagram.add(
          Glyphs.L_VERT + Draw.repeat(" ", 1 + leftPad)
            + row
            + Draw.repeat(" ", 1 + rightPad) + Glyphs.L_VERT
        );
      } else {
        diagram.add(Draw.repeat(" ", 2 + leftPad) + row + Draw.repeat(" ", 2 + rightPad));
      }
    }

    // Bottom loop, with the description centered on it
    final int padding = Math.max(0, barWidth - Draw.displayWidth(description));
    final int leftFill = padding / 2;
    diagram.add(
      Glyphs.C_BL_RND + Draw.repeat(Glyphs.L_HORZ, leftFill)
        + description
        + Draw.repeat(Glyphs.L_HORZ, padding - leftFill) + Glyphs.C_BR_RND
    );

    return diagram;
  }

  @Override
  public String toString() {
    return "Repetition[" + repetition + ", " + inner + "]";
  }

  private static final RepetitionType.Visitor<String> DESCRIPTION = new RepetitionType.Visitor<>() {
    @Override
    public String visitOrMore(RepetitionType.OrMore orMore) {
      return " " + orMore.min() + "+ ";
    }

    @Override
    public String visitZeroOrOne(RepetitionType.ZeroOrOne zeroOrOne) {
      throw new IllegalArgumentException("Zero-or-one repetitions are drawn as Optional");
    }

    @Override
    public String visitExactly(RepetitionType.Exactly exactly) {
      return " " + exactly.count() + " ";
    }

    @Override
    public String visitBetween(RepetitionType.Between between) {
      return " " + between.min() + "-" + between.max() + " ";
    }
  };
}
