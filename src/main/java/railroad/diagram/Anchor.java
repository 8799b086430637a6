package railroad.diagram;

/**
 * Zero-width assertion or builtin class, drawn heavier than a terminal.
 *
 * <pre>
 *   ┏━━━━━━━━┓
 *   ┨ Anchor ┠
 *   ┗━━━━━━━━┛
 * </pre>
 */
public final class Anchor extends LabelBox {

  /**
   * @param text label of the assertion or class
   */
  public Anchor(String text) {
    super(text, Style.HEAVY);
  }
}
