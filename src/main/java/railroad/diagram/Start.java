package railroad.diagram;

import java.util.List;

/**
 * The start of a railroad diagram.
 *
 * <pre>
 *   START╟
 * </pre>
 */
public final class Start implements Draw {

  private static final String LABEL = "START";

  @Override
  public int entryHeight() {
    return 0;
  }

  @Override
  public int height() {
    return 1;
  }

  @Override
  public int width() {
    return LABEL.length() + 1;
  }

  @Override
  public List<String> draw() {
    return List.of(LABEL + Glyphs.START);
  }
}
