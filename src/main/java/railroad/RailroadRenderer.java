package railroad;

import java.util.logging.Logger;
import railroad.diagram.DiagramGenerator;
import railroad.diagram.Draw;
import railroad.parser.Regex;
import railroad.parser.RegexParser;
import railroad.text.TextDescription;
import railroad.text.TextRenderer;

/**
 * Entry points turning regular expressions into diagrams and descriptions.
 */
public final class RailroadRenderer {

  private static final Logger LOGGER = Logger.getLogger(RailroadRenderer.class.getName());

  private RailroadRenderer() { }

  /**
   * Lay out the diagram of a parsed regular expression.
   *
   * @param regex parsed regular expression
   * @return root of the diagram, wrapped in {@code START} and {@code END}
   */
  public static Draw generateDiagram(Regex regex) {
    return DiagramGenerator.generate(regex);
  }

  /**
   * Draw a laid out diagram.
   *
   * @param diagram root of the diagram
   * @return drawn rows with their dimensions
   */
  public static Diagram renderDiagram(Draw diagram) {
    final var rendered = new Diagram(diagram.draw(), diagram.width(), diagram.height());
    LOGGER.fine(() -> "Rendered diagram of " + rendered.width() + "x" + rendered.height());
    return rendered;
  }

  /**
   * Parse and draw a regular expression.
   *
   * @param pattern regular expression, using {@code \} to escape
   * @return drawn rows with their dimensions
   * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
   *   or can't be drawn
   */
  public static Diagram renderDiagram(String pattern) {
    return renderDiagram(generateDiagram(RegexParser.parse(pattern)));
  }

  /**
   * Describe a parsed regular expression in words.
   *
   * @param regex parsed regular expression
   * @return description lines and their highlights
   */
  public static TextDescription renderText(Regex regex) {
    return TextRenderer.render(regex);
  }

  /**
   * Parse and describe a regular expression.
   *
   * @param pattern regular expression, using {@code \} to escape
   * @return description lines and their highlights
   * @throws java.util.regex.PatternSyntaxException if the pattern is invalid
   *   or can't be described
   */
  public static TextDescription renderText(String pattern) {
    return renderText(RegexParser.parse(pattern));
  }
}
