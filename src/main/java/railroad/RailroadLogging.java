package railroad;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Logging setup for the command line.
 *
 * <p>Defaults come from {@code logging.properties} on the class path. The
 * level of the {@code railroad} loggers can be overridden with the
 * {@value #LEVEL_PROPERTY} system property.
 */
public final class RailroadLogging {

  /**
   * System property holding a {@link Level} name.
   */
  public static final String LEVEL_PROPERTY = "railroad.logLevel";

  // Held strongly so a configured level isn't lost when the logger is collected
  private static final Logger PROJECT_LOGGER = Logger.getLogger("railroad");

  private RailroadLogging() { }

  public static void initFormat() {
    System.setProperty(
      "java.util.logging.SimpleFormatter.format",
      "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$s %3$s] %5$s%6$s%n"
    );
  }

  /**
   * Read the bundled configuration and apply the level override, if any.
   *
   * @throws IllegalArgumentException if the level override isn't a level
   */
  public static void configure() throws IOException {
    initFormat();
    try (InputStream config = RailroadLogging.class.getResourceAsStream("/logging.properties")) {
      if (config != null) {
        LogManager.getLogManager().readConfiguration(config);
      }
    }

    final String level = System.getProperty(LEVEL_PROPERTY);
    if (level != null) {
      setLevel(Level.parse(level));
    }
  }

  /**
   * Send every log record to a stream, replacing the existing handlers.
   *
   * @param os stream to write to, typically standard error
   */
  public static void redirectToStream(OutputStream os) {
    final Logger rootLogger = Logger.getLogger("");
    final Handler handler = new StreamHandler(os, new SimpleFormatter()) {
      @Override
      public synchronized void publish(LogRecord record) {
        super.publish(record);
        flush();
      }
    };
    handler.setLevel(Level.ALL);
    for (Handler existing : rootLogger.getHandlers()) {
      rootLogger.removeHandler(existing);
    }
    rootLogger.addHandler(handler);
  }

  /**
   * Set the level of every logger in the project, {@code null} to inherit it.
   */
  public static void setLevel(Level level) {
    PROJECT_LOGGER.setLevel(level);
  }
}
