package railroad.parser;

/**
 * Display labels for the members of a character class.
 *
 * <p>Ranges render as {@code a-z}, builtin classes by name ({@code Digit},
 * {@code Non-Word}) and single characters as themselves. Classes can't be
 * nested, so asking for the label of an {@code Any} or {@code Not} is an
 * error.
 */
public final class CharacterLabels implements CharacterTypeVisitor<String> {

  public static final CharacterLabels INSTANCE = new CharacterLabels();

  private CharacterLabels() { }

  /**
   * Label of one class member.
   *
   * @param member range, character or builtin class inside a class
   * @return label to display
   */
  public static String label(CharacterType member) {
    return member.accept(INSTANCE);
  }

  /**
   * Make text safe to lay out on a single row.
   *
   * <p>Control characters are replaced by their usual escapes so that every
   * code point occupies exactly one column.
   *
   * @param text raw text
   * @return printable text
   */
  public static String printable(String text) {
    final var builder = new StringBuilder(text.length());
    text.codePoints().forEach(cp -> {
      switch (cp) {
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        case '\r':
          builder.append("\\r");
          break;
        case '\f':
          builder.append("\\f");
          break;
        default:
          if (Character.isISOControl(cp)) {
            builder.append(String.format("\\x%02x", cp));
          } else {
            builder.appendCodePoint(cp);
          }
      }
    });
    return builder.toString();
  }

  @Override
  public String visitAny(CharacterType.Any any) {
    throw new InvalidParsingException("Character class nested inside a class: " + any);
  }

  @Override
  public String visitNot(CharacterType.Not not) {
    throw new InvalidParsingException("Character class nested inside a class: " + not);
  }

  @Override
  public String visitBetween(CharacterType.Between between) {
    return printable(Character.toString(between.first()))
      + "-"
      + printable(Character.toString(between.last()));
  }

  @Override
  public String visitTerminal(CharacterType.Terminal terminal) {
    return printable(Character.toString(terminal.character()));
  }

  @Override
  public String visitMeta(CharacterType.Meta meta) {
    return meta.meta().label();
  }
}
