package railroad.extract;

/**
 * The language of a source file isn't known, so its string literals can't be
 * found.
 */
public class UnsupportedLanguageException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -3071654822318864021L;

  /**
   * Extension of the file, empty if it has none.
   */
  public final String extension;

  public UnsupportedLanguageException(String fileName, String extension) {
    super(
      extension.isEmpty()
        ? "File extension not found: " + fileName
        : "File extension ." + extension + " not supported"
    );
    this.extension = extension;
  }
}
