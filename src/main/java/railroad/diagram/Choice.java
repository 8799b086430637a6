package railroad.diagram;

import java.util.ArrayList;
import java.util.List;

/**
 * A choice between nodes, stacked vertically.
 *
 * <pre>
 *     ┌───┐
 *   ╭─┤ A ├─╮
 *   ┤ └───┘ ├
 *   │ ┌───┐ │
 *   ╰─┤ B ├─╯
 *     └───┘
 * </pre>
 *
 * The rail enters at the middle row, {@code (height - 1) / 2}, kept between
 * the rails of the first and last branch. On every row exactly one pair of
 * connectors is drawn, checked in this order:
 *
 * <ol>
 *   <li>the entry row: {@code ┬} if it is the first branch's rail,
 *       {@code ┴} if it is the last branch's rail, {@code ┼} if it is
 *       another branch's rail and {@code ┤ ├} if no branch is entered there
 *   <li>the first branch's rail: top corners {@code ╭ ╮}
 *   <li>the last branch's rail: bottom corners {@code ╰ ╯}
 *   <li>another branch's rail: tees {@code ├ ┤}
 *   <li>between the first and last rails: vertical rails {@code │ │}
 *   <li>otherwise blank
 * </ol>
 */
public final class Choice implements Draw {

  private final List<Draw> branches;

  public Choice(List<? extends Draw> branches) {
    if (branches.isEmpty()) {
      throw new IllegalArgumentException("Choice needs at least one branch");
    }
    this.branches = List.copyOf(branches);
  }

  public List<Draw> branches() {
    return branches;
  }

  /**
   * Rows, counted from the top of the choice, where each branch's rail is.
   */
  private int[] railRows() {
    final int[] rails = new int[branches.size()];
    int offset = 0;
    for (int i = 0; i < rails.length; i++) {
      final Draw branch = branches.get(i);
      rails[i] = offset + branch.entryHeight();
      offset += branch.height();
    }
    return rails;
  }

  @Override
  public int entryHeight() {
    final int[] rails = railRows();
    final int midpoint = (height() - 1) / 2;
    return Math.min(Math.max(midpoint, rails[0]), rails[rails.length - 1]);
  }

  @Override
  public int height() {
    return Draw.totalHeight(branches);
  }

  @Override
  public int width() {
    return Draw.maxWidth(branches) + 4;
  }

  @Override
  public List<String> draw() {
    final int[] rails = railRows();
    final int firstRail = rails[0];
    final int lastRail = rails[rails.length - 1];
    final int entryHeight = entryHeight();
    final int width = Draw.maxWidth(branches);

    // Stack all choices vertically
    final var diagram = new ArrayList<String>();
    for (Draw branch : branches) {

      // Ensure all branches have the same width
      final int leftPad = (width - branch.width()) / 2;
      final int rightPad = width - branch.width() - leftPad;

      final List<String> rows = branch.draw();
      for (int n = 0; n < rows.size(); n++) {
        final int row = diagram.size();
        final boolean onRail = n == branch.entryHeight();
        final String fill = onRail ? Glyphs.L_HORZ : " ";

        final String left;
        final String right;
        if (row == entryHeight) {
          if (firstRail == lastRail) {
            left = Glyphs.L_HORZ;
            right = Glyphs.L_HORZ;
          } else if (row == firstRail) {
            left = Glyphs.J_DOWN;
            right = Glyphs.J_DOWN;
          } else if (row == lastRail) {
            left = Glyphs.J_UP;
            right = Glyphs.J_UP;
          } else if (onRail) {
            left = Glyphs.CROSS;
            right = Glyphs.CROSS;
          } else {
            left = Glyphs.J_LEFT;
            right = Glyphs.J_RIGHT;
          }
        } else if (row == firstRail) {
          left = Glyphs.C_TL_RND;
          right = Glyphs.C_TR_RND;
        } else if (row == lastRail) {
          left = Glyphs.C_BL_RND;
          right = Glyphs.C_BR_RND;
        } else if (onRail) {
          left = Glyphs.J_RIGHT;
          right = Glyphs.J_LEFT;
        } else if (firstRail < row && row < lastRail) {
          left = Glyphs.L_VERT;
          right = Glyphs.L_VERT;
        } else {
          left = " ";
          right = " ";
        }

        diagram.add(
          left + Draw.repeat(fill, 1 + leftPad)
            + rows.get(n)
            + Draw.repeat(fill, 1 + rightPad) + right
        );
      }
    }

    return diagram;
  }

  @Override
  public String toString() {
    return "Choice" + branches;
  }
}
