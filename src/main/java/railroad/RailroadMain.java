package railroad;

import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;
import railroad.extract.Language;
import railroad.extract.RegexExtractionException;
import railroad.extract.RegexExtractor;
import railroad.extract.UnsupportedLanguageException;
import railroad.parser.Regex;
import railroad.parser.RegexParser;

/**
 * Draws or describes the regular expression under a cursor.
 *
 * <pre>
 *   RailroadMain &lt;diagram|text&gt; &lt;file-name&gt; &lt;column&gt; &lt;line&gt;
 * </pre>
 *
 * The file name only selects the language, the line is the source line the
 * cursor is on and the column is the 0-based cursor position within it.
 */
public final class RailroadMain {

  private static final Logger LOGGER = Logger.getLogger(RailroadMain.class.getName());

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = "Usage: RailroadMain <diagram|text> <file-name> <column> <line>";

  private RailroadMain() { }

  public static void main(String[] args) throws IOException {
    RailroadLogging.configure();
    RailroadLogging.redirectToStream(System.err);
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Run the command line.
   *
   * @param args command line arguments
   * @param out where the diagram or description goes
   * @param err where errors are reported
   * @return exit status
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length != 4) {
      err.println(USAGE);
      return EXIT_USAGE;
    }

    final String mode = args[0];
    if (!mode.equals("diagram") && !mode.equals("text")) {
      err.println("Unknown mode '" + mode + "'");
      err.println(USAGE);
      return EXIT_USAGE;
    }

    final int column;
    try {
      column = Integer.parseInt(args[2]);
    } catch (NumberFormatException e) {
      err.println("Column must be a number, got '" + args[2] + "'");
      err.println(USAGE);
      return EXIT_USAGE;
    }

    try {
      final Language language = Language.fromFileName(args[1]);
      final String pattern = new RegexExtractor(language).extract(args[3], column);
      LOGGER.info(() -> "Extracted " + language + " regex '" + pattern + "'");

      final Regex regex = RegexParser.parse(pattern, language.format().escapeCharacter());
      if (mode.equals("diagram")) {
        RailroadRenderer.renderDiagram(RailroadRenderer.generateDiagram(regex)).rows().forEach(out::println);
      } else {
        RailroadRenderer.renderText(regex).lines().forEach(out::println);
      }
      return EXIT_OK;
    } catch (UnsupportedLanguageException | RegexExtractionException | PatternSyntaxException e) {
      LOGGER.log(Level.SEVERE, "Failed to render " + mode, e);
      err.println(e.getMessage());
      return EXIT_FAILURE;
    }
  }
}
