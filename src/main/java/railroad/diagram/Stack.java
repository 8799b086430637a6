package railroad.diagram;

import java.util.ArrayList;
import java.util.List;

/**
 * A character class: one box listing every member.
 *
 * <pre>
 *   One of:
 *   ┌─────┐
 *   │  A  │
 *   ┤ a-z ├
 *   │  _  │
 *   └─────┘
 * </pre>
 *
 * The rail enters at the vertically centered member.
 */
public final class Stack implements Draw {

  private final boolean negated;
  private final List<String> members;

  /**
   * @param negated does the class match everything but its members?
   * @param members printable labels of the members
   */
  public Stack(boolean negated, List<String> members) {
    if (members.isEmpty()) {
      throw new IllegalArgumentException("Stack needs at least one member");
    }
    this.negated = negated;
    this.members = List.copyOf(members);
  }

  public boolean negated() {
    return negated;
  }

  public List<String> members() {
    return members;
  }

  private String header() {
    return negated ? "None of:" : "One of:";
  }

  @Override
  public int entryHeight() {
    return 2 + (members.size() - 1) / 2;
  }

  @Override
  public int height() {
    return members.size() + 3;
  }

  @Override
  public int width() {
    final int widest = members.stream().mapToInt(Draw::displayWidth).max().getAsInt();
    return Math.max(widest + 4, Draw.displayWidth(header()));
  }

  @Override
  public List<String> draw() {
    final int width = width();
    final int entryHeight = entryHeight();
    final var diagram = new ArrayList<String>();

    // Description
    final String header = header();
    diagram.add(header + Draw.repeat(" ", width - Draw.displayWidth(header)));

    // Top row
    diagram.add(Glyphs.C_TL_SQR + Draw.repeat(Glyphs.L_HORZ, width - 2) + Glyphs.C_TR_SQR);

    // Members
    for (String member : members) {
      final int padding = width - 2 - Draw.displayWidth(member);
      final int leftPad = padding / 2;
      final boolean onRail = diagram.size() == entryHeight;
      diagram.add(
        (onRail ? Glyphs.J_LEFT : Glyphs.L_VERT)
          + Draw.repeat(" ", leftPad) + member + Draw.repeat(" ", padding - leftPad)
          + (onRail ? Glyphs.J_RIGHT : Glyphs.L_VERT)
      );
    }

    // Bottom row
    diagram.add(Glyphs.C_BL_SQR + Draw.repeat(Glyphs.L_HORZ, width - 2) + Glyphs.C_BR_SQR);

    return diagram;
  }

  @Override
  public String toString() {
    return "Stack[" + (negated ? "^" : "") + members + "]";
  }
}
