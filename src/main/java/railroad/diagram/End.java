package railroad.diagram;

import java.util.List;

/**
 * The end of a railroad diagram.
 *
 * <pre>
 *   ╢END
 * </pre>
 */
public final class End implements Draw {

  private static final String LABEL = "END";

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
    return List.of(Glyphs.END + LABEL);
  }
}
