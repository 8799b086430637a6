package railroad.diagram;

/**
 * Box-drawing characters used to lay out diagrams.
 *
 * <p>Every glyph is a single code point occupying one column, which is what
 * the width computations of the {@link Draw} implementations rely on.
 */
public final class Glyphs {

  private Glyphs() { }

  // Start and end of diagram
  public static final String START = "╟";
  public static final String END = "╢";

  // Junctions
  public static final String CROSS = "┼";
  public static final String J_LEFT = "┤";
  public static final String J_RIGHT = "├";
  public static final String J_UP = "┴";
  public static final String J_DOWN = "┬";
  public static final String J_LEFT_B = "┨";
  public static final String J_RIGHT_B = "┠";

  // Box/path drawing
  public static final String L_HORZ = "─";
  public static final String L_HORZ_D = "╌";
  public static final String L_VERT = "│";
  public static final String L_VERT_D = "┆";
  public static final String L_HORZ_B = "━";
  public static final String C_TL_SQR = "┌";
  public static final String C_TR_SQR = "┐";
  public static final String C_BL_SQR = "└";
  public static final String C_BR_SQR = "┘";
  public static final String C_TL_SQR_B = "┏";
  public static final String C_TR_SQR_B = "┓";
  public static final String C_BL_SQR_B = "┗";
  public static final String C_BR_SQR_B = "┛";
  public static final String C_TL_RND = "╭";
  public static final String C_TR_RND = "╮";
  public static final String C_BL_RND = "╰";
  public static final String C_BR_RND = "╯";
}
