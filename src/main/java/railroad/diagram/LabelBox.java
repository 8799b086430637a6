package railroad.diagram;

import java.util.List;

/**
 * Single row of text inside a box, with the rail passing through its middle.
 *
 * <pre>
 *   ┌──────┐
 *   ┤ text ├
 *   └──────┘
 * </pre>
 */
abstract class LabelBox implements Draw {

  /**
   * Glyphs making up a box.
   */
  enum Style {
    LIGHT(
      Glyphs.C_TL_SQR, Glyphs.C_TR_SQR, Glyphs.C_BL_SQR, Glyphs.C_BR_SQR,
      Glyphs.L_HORZ, Glyphs.J_LEFT, Glyphs.J_RIGHT
    ),
    HEAVY(
      Glyphs.C_TL_SQR_B, Glyphs.C_TR_SQR_B, Glyphs.C_BL_SQR_B, Glyphs.C_BR_SQR_B,
      Glyphs.L_HORZ_B, Glyphs.J_LEFT_B, Glyphs.J_RIGHT_B
    );

    final String topLeft;
    final String topRight;
    final String bottomLeft;
    final String bottomRight;
    final String horizontal;
    final String left;
    final String right;

    Style(
      String topLeft,
      String topRight,
      String bottomLeft,
      String bottomRight,
      String horizontal,
      String left,
      String right
    ) {
      this.topLeft = topLeft;
      this.topRight = topRight;
      this.bottomLeft = bottomLeft;
      this.bottomRight = bottomRight;
      this.horizontal = horizontal;
      this.left = left;
      this.right = right;
    }
  }

  private final String text;
  private final Style style;

  LabelBox(String text, Style style) {
    this.text = text;
    this.style = style;
  }

  /**
   * Text shown inside the box.
   */
  public String text() {
    return text;
  }

  @Override
  public int entryHeight() {
    return 1;
  }

  @Override
  public int height() {
    return 3;
  }

  @Override
  public int width() {
    return Draw.displayWidth(text) + 4;
  }

  @Override
  public List<String> draw() {
    final String border = Draw.repeat(style.horizontal, width() - 2);
    return List.of(
      style.topLeft + border + style.topRight,
      style.left + " " + text + " " + style.right,
      style.bottomLeft + border + style.bottomRight
    );
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + text + "]";
  }
}
