package railroad.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A horizontal sequence of railroad diagram nodes.
 *
 * <pre>
 *   ┌───┐  ┌───┐  ┌───┐
 *   ┤ A ├──┤ B ├──┤ C ├
 *   └───┘  └───┘  └───┘
 * </pre>
 *
 * Children are aligned on their entry rows. An empty sequence is a plain
 * stretch of rail.
 */
public final class Sequence implements Draw {

  private static final Logger LOGGER = Logger.getLogger(Sequence.class.getName());

  /**
   * Columns of rail between two neighbouring children.
   */
  static final int H_PADDING = 2;

  private final List<Draw> children;

  public Sequence(List<? extends Draw> children) {
    this.children = List.copyOf(children);
  }

  public List<Draw> children() {
    return children;
  }

  @Override
  public int entryHeight() {
    return Draw.maxEntryHeight(children);
  }

  @Override
  public int height() {
    if (children.isEmpty()) {
      return 1;
    }

    // Every child is shifted down so that its entry row lines up with the deepest one
    final int entryHeight = entryHeight();
    return children
      .stream()
      .mapToInt(child -> entryHeight - child.entryHeight() + child.height())
      .max()
      .getAsInt();
  }

  @Override
  public int width() {
    if (children.isEmpty()) {
      return H_PADDING;
    }
    return Draw.totalWidth(children) + H_PADDING * (children.size() - 1);
  }

  @Override
  public List<String> draw() {
    if (children.isEmpty()) {
      return List.of(Draw.repeat(Glyphs.L_HORZ, H_PADDING));
    }

    final var diagram = new ArrayList<String>();
    diagram.add("");
    int exitHeight = 0;

    for (int n = 0; n < children.size(); n++) {
      final Draw child = children.get(n);
      final var node = new ArrayList<String>(child.draw());

      // Ensure exit of previous node aligns with entry of new node
      final int entryHeight = child.entryHeight();
      if (exitHeight < entryHeight) {
        padTop(diagram, entryHeight - exitHeight);
        exitHeight = entryHeight;
      } else if (entryHeight < exitHeight) {
        padTop(node, exitHeight - entryHeight);
      }

      // Pad the shorter side at the bottom
      if (node.size() < diagram.size()) {
        padBottom(node, diagram.size() - node.size());
      } else if (diagram.size() < node.size()) {
        padBottom(diagram, node.size() - diagram.size());
      }

      // Connect to the previous node, then append the new one
      for (int i = 0; i < diagram.size(); i++) {
        final var row = new StringBuilder(diagram.get(i));
        if (n > 0) {
          row.append(Draw.repeat(i == exitHeight ? Glyphs.L_HORZ : " ", H_PADDING));
        }
        row.append(node.get(i));
        diagram.set(i, row.toString());
      }

      final int appended = n;
      LOGGER.finest(() -> "Appended child " + appended + " (" + child + "), now " + diagram.size() + " rows");
    }

    return diagram;
  }

  private static void padTop(List<String> rows, int count) {
    final String empty = Draw.repeat(" ", Draw.displayWidth(rows.get(0)));
    for (int i = 0; i < count; i++) {
      rows.add(0, empty);
    }
  }

  private static void padBottom(List<String> rows, int count) {
    final String empty = Draw.repeat(" ", Draw.displayWidth(rows.get(0)));
    for (int i = 0; i < count; i++) {
      rows.add(empty);
    }
  }

  @Override
  public String toString() {
    return "Sequence" + children;
  }
}
