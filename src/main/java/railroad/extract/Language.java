package railroad.extract;

import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Languages whose string literals regular expressions can be extracted from.
 */
public enum Language {
  PYTHON(
    "py",
    new StringFormat(List.of("\"", "'"), '\\', List.of("r\"", "r'"), List.of("\"", "'"))
  ),
  RUST(
    "rs",
    new StringFormat(List.of("\""), '\\', List.of("r#\"", "r\""), List.of("\"#", "\""))
  ),
  JAVASCRIPT("js", StringFormat.plain('\\', "\"", "'", "/")),
  JAVA("java", StringFormat.plain('\\', "\""));

  private static final Logger LOGGER = Logger.getLogger(Language.class.getName());

  private final String extension;
  private final StringFormat format;

  Language(String extension, StringFormat format) {
    this.extension = extension;
    this.format = format;
  }

  /**
   * File extension, without the leading dot.
   */
  public String extension() {
    return extension;
  }

  public StringFormat format() {
    return format;
  }

  /**
   * Find the language of a source file from its extension.
   *
   * @param fileName name or path of the file
   * @return language of the file
   * @throws UnsupportedLanguageException if the extension is missing or unknown
   */
  public static Language fromFileName(String fileName) {
    final int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot < Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'))) {
      throw new UnsupportedLanguageException(fileName, "");
    }

    final String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (Language language : values()) {
      if (language.extension.equals(extension)) {
        LOGGER.fine(() -> "Found file extension '." + extension + "' of " + language);
        return language;
      }
    }
    throw new UnsupportedLanguageException(fileName, extension);
  }
}
