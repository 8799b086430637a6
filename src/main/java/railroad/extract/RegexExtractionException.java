package railroad.extract;

/**
 * No regular expression could be extracted from a line of source code.
 */
public class RegexExtractionException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = 8220513466195017248L;

  /**
   * Column the extraction was attempted at.
   */
  public final int column;

  public RegexExtractionException(String message, int column) {
    super(message + " (column " + column + ")");
    this.column = column;
  }
}
