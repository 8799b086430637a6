package railroad.diagram;

/**
 * Literal text to be matched.
 *
 * <pre>
 *   ┌──────────┐
 *   ┤ Terminal ├
 *   └──────────┘
 * </pre>
 */
public final class Terminal extends LabelBox {

  /**
   * @param text printable text, one column per code point
   */
  public Terminal(String text) {
    super(text, Style.LIGHT);
  }
}
