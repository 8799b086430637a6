package railroad.parser;

import java.util.ArrayList;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for the subset of regular expressions that can be drawn.
 *
 * This is a predictive recursive descent parser: there is a single cursor
 * into the input which only ever moves forward, and every decision is made
 * by looking at most two characters ahead. Supported syntax:
 *
 * <ul>
 *   <li>alternation {@code a|b}, grouping {@code (a)}, {@code (?:a)},
 *       {@code (?<name>a)}
 *   <li>quantifiers {@code *}, {@code +}, {@code ?}, {@code {n}},
 *       {@code {n,}}, {@code {n,m}}
 *   <li>classes {@code [a-z0-9_]}, {@code [^\s]}
 *   <li>builtin classes {@code .}, {@code \d}, {@code \w}, {@code \s} and
 *       their negations
 *   <li>anchors {@code ^}, {@code $}, {@code \b}, {@code \B}
 * </ul>
 *
 * Every opening parenthesis produces a {@link Regex.Capture}, numbered in the
 * order the parentheses are opened.
 */
public final class RegexParser {

  private static final Logger LOGGER = Logger.getLogger(RegexParser.class.getName());

  /**
   * Escape character of regular expressions written without any host language.
   */
  public static final char DEFAULT_ESCAPE = '\\';

  // Characters which end a run of literal characters
  private static final String SPECIAL_CHARACTERS = "()[]+*$|^{}?.";

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private final char escapeCharacter;
  private int position = 0;
  private int groupCount = 0;

  /**
   * Parse a regular expression pattern written with backslash escapes.
   *
   * @param input regular expression pattern
   * @return parsed regular expression
   */
  public static Regex parse(String input) throws PatternSyntaxException {
    return parse(input, DEFAULT_ESCAPE);
  }

  /**
   * Parse a regular expression pattern.
   *
   * @param input regular expression pattern
   * @param escapeCharacter escape character of the language the pattern was written in
   * @return parsed regular expression
   */
  public static Regex parse(String input, char escapeCharacter) throws PatternSyntaxException {
    final var parser = new RegexParser(input, escapeCharacter);
    final Regex parsed = parser.parseAlternation();

    // Only an unbalanced `)` stops an alternation before the end
    if (parser.position < parser.length) {
      throw parser.error("Unmatched closing parenthesis");
    }

    LOGGER.fine(() -> "Parsed /" + input + "/ into " + parsed);
    return parsed;
  }

  private RegexParser(String input, char escapeCharacter) {
    this.input = input;
    this.length = input.length();
    this.escapeCharacter = escapeCharacter;
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(String unsupported) {
    return new UnsupportedPatternSyntaxException(unsupported, input, position);
  }

  /**
   * Peek the next code point in the input without advancing the position.
   *
   * @return next code point or else -1 if there is none
   */
  int peekChar() {
    return position < length ? input.codePointAt(position) : -1;
  }

  /**
   * Peek the code point after the next one without advancing the position.
   *
   * @return code point after the next one or else -1 if there is none
   */
  int peekSecondChar() {
    if (position >= length) {
      return -1;
    }
    final int second = position + Character.charCount(input.codePointAt(position));
    return second < length ? input.codePointAt(second) : -1;
  }

  /**
   * Skip over the next code point.
   */
  void skipChar() {
    position += Character.charCount(input.codePointAt(position));
  }

  /**
   * Get the next code point from the input advancing the position.
   *
   * @return next code point
   */
  int nextChar() {
    final int codePoint = input.codePointAt(position);
    position += Character.charCount(codePoint);
    return codePoint;
  }

  /**
   * Skip over the escape character and the code point it escapes.
   *
   * @param escaped code point following the escape character
   */
  private void skipEscape(int escaped) {
    position += 1 + Character.charCount(escaped);
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Advance past the next character, which must be the expected one.
   *
   * @param expected character which must be at the cursor
   */
  void consume(char expected) throws UnexpectedCharacterException {
    final int found = peekChar();
    if (found != expected) {
      throw new UnexpectedCharacterException(
        expected,
        found == -1 ? OptionalInt.empty() : OptionalInt.of(found),
        input,
        position
      );
    }
    position++;
  }

  /**
   * Parse an alternation.
   */
  private Regex parseAlternation() throws PatternSyntaxException {
    final Regex first = parseElement();
    if (peekChar() != '|') {
      return first;
    }

    final var branches = new ArrayList<Regex>();
    branches.add(first);
    while (nextCharIf('|')) {
      branches.add(parseElement());
    }
    return new Regex.Alternation(branches);
  }

  /**
   * Parse a concatenation, up to the end of the enclosing group or branch.
   */
  private Regex parseElement() throws PatternSyntaxException {
    final var items = new ArrayList<Regex>();

    // Keep parsing until a lower priority construct is encountered
    int c;
    while ((c = peekChar()) != -1 && c != ')' && c != '|') {
      items.add(parseRepetition());
    }
    return new Regex.Element(items);
  }

  /**
   * Parse a group and its optional quantifier.
   *
   * Called on non-empty input.
   */
  private Regex parseRepetition() throws PatternSyntaxException {
    final Regex group = parseGroup();

    final RepetitionType type;
    switch (peekChar()) {
      case '*':
        skipChar();
        type = new RepetitionType.OrMore(0);
        break;

      case '+':
        skipChar();
        type = new RepetitionType.OrMore(1);
        break;

      case '?':
        skipChar();
        type = new RepetitionType.ZeroOrOne();
        break;

      case '{':
        type = parseQuantifier();
        break;

      default:
        return group;
    }

    // `?` suffix makes the quantifier lazy, which doesn't change the diagram
    if (nextCharIf('?')) {
      LOGGER.finer(() -> "Ignoring lazy modifier at " + (position - 1) + " of /" + input + "/");
    } else if (peekChar() == '+') {
      throw unsupported("Possessive quantifiers");
    }

    return new Regex.Repetition(type, group);
  }

  /**
   * Parse a {@code {...}} quantifier.
   */
  private RepetitionType parseQuantifier() throws PatternSyntaxException {
    consume('{');

    // Parse the first count, stopping at a comma
    int atLeast = 0;
    boolean comma = false;
    int c;
    while ((c = peekChar()) != -1 && c != '}') {
      if (c == ',') {
        skipChar();
        comma = true;
        break;
      }
      atLeast = accumulateDigit(atLeast);
    }

    // Parse the optional second count
    OptionalInt atMost = OptionalInt.empty();
    if (comma) {
      while ((c = peekChar()) != -1 && c != '}') {
        atMost = OptionalInt.of(accumulateDigit(atMost.orElse(0)));
      }
    }

    consume('}');

    if (atMost.isPresent()) {
      return new RepetitionType.Between(atLeast, atMost.getAsInt());
    } else if (comma) {
      return new RepetitionType.OrMore(atLeast);
    } else {
      return new RepetitionType.Exactly(atLeast);
    }
  }

  /**
   * Consume one decimal digit, appending it to a running value.
   *
   * @param value number accumulated so far
   * @return {@code value * 10 + digit}
   */
  private int accumulateDigit(int value) throws PatternSyntaxException {
    final int c = input.codePointAt(position);
    if (c < '0' || c > '9') {
      throw new RepetitionValueException(c, input, position);
    }

    final long next = 10L * value + (c - '0');
    if (next > Integer.MAX_VALUE) {
      throw error("Decimal integer overflowed");
    }
    skipChar();
    return (int) next;
  }

  /**
   * Parse a group.
   *
   * Called on non-empty input.
   */
  private Regex parseGroup() throws PatternSyntaxException {
    final int c = peekChar();
    switch (c) {
      case '(':
        return parseCapture();

      case '[':
        return parseCharacterClass();

      case '^':
        skipChar();
        return new Regex.Anchor(AnchorType.START);

      case '$':
        skipChar();
        return new Regex.Anchor(AnchorType.END);

      case '.':
        skipChar();
        return new Regex.CharacterMatch(new CharacterType.Meta(MetaCharacter.ANY));

      case '*':
      case '+':
      case '?':
      case '{':
        throw error("Dangling meta character '" + Character.toString(c) + "'");

      default:
        break;
    }

    if (c == escapeCharacter) {
      final int escaped = peekSecondChar();
      if (escaped == -1) {
        throw error("Pattern may not end with escape character");
      }

      final MetaCharacter meta = metaCharacter(escaped);
      if (meta != null) {
        skipEscape(escaped);
        return new Regex.CharacterMatch(new CharacterType.Meta(meta));
      }

      final AnchorType anchor = anchor(escaped);
      if (anchor != null) {
        skipEscape(escaped);
        return new Regex.Anchor(anchor);
      }

      if (escaped >= '1' && escaped <= '9' || escaped == 'k') {
        throw unsupported("Backreferences");
      }
    }

    return parseLiteralRun();
  }

  /**
   * Parse a parenthesized group.
   */
  private Regex parseCapture() throws PatternSyntaxException {
    consume('(');
    final int groupIndex = ++groupCount;

    Optional<String> name = Optional.empty();
    if (nextCharIf('?')) {
      switch (peekChar()) {
        case ':':
          skipChar();
          break;

        case '<':
          skipChar();
          if (peekChar() == '=' || peekChar() == '!') {
            throw unsupported("Lookbehind groups");
          }
          name = Optional.of(parseGroupName());
          break;

        case '=':
        case '!':
          throw unsupported("Lookahead groups");

        default:
          throw unsupported("Inline flags");
      }
    }

    // Parse the group body and ensure that it is closed
    final Regex inner = parseAlternation();
    consume(')');

    return new Regex.Capture(name, groupIndex, inner);
  }

  /**
   * Parse the name of a named group, up to and including the closing {@code >}.
   */
  private String parseGroupName() throws PatternSyntaxException {
    final int start = position;
    int c;
    while ((c = peekChar()) != -1 && c != '>') {
      skipChar();
    }
    final String name = input.substring(start, position);
    consume('>');

    if (name.isEmpty()) {
      throw error("Group name may not be empty");
    }
    return name;
  }

  /**
   * Parse a bracket-delimited character class.
   */
  private Regex parseCharacterClass() throws PatternSyntaxException {
    consume('[');
    final boolean negated = nextCharIf('^');

    final var members = new ArrayList<CharacterType>();
    int c;
    while ((c = peekChar()) != -1 && c != ']') {
      members.add(parseClassMember());
    }
    if (c == ']' && members.isEmpty()) {
      throw error("Character class may not be empty");
    }
    consume(']');

    return new Regex.CharacterMatch(
      negated ? new CharacterType.Not(members) : new CharacterType.Any(members)
    );
  }

  /**
   * Parse one member of a character class: a character, a range or a builtin class.
   *
   * Called on non-empty input.
   */
  private CharacterType parseClassMember() throws PatternSyntaxException {
    final int start = position;

    final int first;
    if (peekChar() == escapeCharacter) {
      final int escaped = peekSecondChar();
      if (escaped == -1) {
        throw error("Pattern may not end with escape character");
      }
      skipEscape(escaped);

      final MetaCharacter meta = metaCharacter(escaped);
      if (meta != null) {
        return new CharacterType.Meta(meta);
      }
      first = unescape(escaped);
    } else {
      first = nextChar();
    }

    // A `-` right before the closing bracket is a literal
    final int second = peekSecondChar();
    if (peekChar() != '-' || second == -1 || second == ']') {
      return new CharacterType.Terminal(first);
    }
    skipChar();

    final int last;
    if (peekChar() == escapeCharacter) {
      final int escaped = peekSecondChar();
      if (escaped == -1) {
        throw error("Pattern may not end with escape character");
      }
      if (metaCharacter(escaped) != null) {
        throw error("Cannot end class range with character class");
      }
      skipEscape(escaped);
      last = unescape(escaped);
    } else {
      last = nextChar();
    }

    if (rangeClass(first) == 0 || rangeClass(first) != rangeClass(last)) {
      throw new CharacterRangeException(first, last, input, start);
    }
    return new CharacterType.Between(first, last);
  }

  /**
   * Which kind of character can be a range endpoint.
   *
   * @return {@code '0'}, {@code 'a'} or {@code 'A'} for digits, lower case and
   *   upper case ASCII letters, otherwise {@code 0}
   */
  private static char rangeClass(int c) {
    if (c >= '0' && c <= '9') {
      return '0';
    } else if (c >= 'a' && c <= 'z') {
      return 'a';
    } else if (c >= 'A' && c <= 'Z') {
      return 'A';
    } else {
      return 0;
    }
  }

  /**
   * Parse literal characters up to the next special character.
   *
   * Called on non-empty input. The first character is always taken, so a
   * stray {@code ]} or {@code }} is a literal.
   */
  private Regex parseLiteralRun() throws PatternSyntaxException {
    final var text = new StringBuilder();

    int c;
    while ((c = peekChar()) != -1) {
      final boolean first = text.length() == 0;
      if (!first && SPECIAL_CHARACTERS.indexOf(c) >= 0) {
        break;
      }

      // Width of the next literal in the input, and the literal itself
      final int width;
      final int literal;
      if (c == escapeCharacter) {
        final int escaped = peekSecondChar();
        if (escaped == -1) {
          throw error("Pattern may not end with escape character");
        }
        if (isMetaEscape(escaped)) {
          break;
        }
        width = 1 + Character.charCount(escaped);
        literal = unescape(escaped);
      } else {
        width = Character.charCount(c);
        literal = c;
      }

      // A quantifier only applies to the last character, so leave it for the next run
      if (!first && position + width < length && isQuantifier(input.codePointAt(position + width))) {
        break;
      }

      position += width;
      text.appendCodePoint(literal);
    }

    return new Regex.Terminal(text.toString());
  }

  private static boolean isQuantifier(int c) {
    return c == '*' || c == '+' || c == '?' || c == '{';
  }

  private static boolean isMetaEscape(int c) {
    return metaCharacter(c) != null
      || anchor(c) != null
      || (c >= '1' && c <= '9')
      || c == 'k';
  }

  /**
   * Builtin class written as an escape, such as {@code \d}.
   *
   * @param escaped code point following the escape character
   * @return builtin class or else {@code null}
   */
  private static MetaCharacter metaCharacter(int escaped) {
    return escaped < 128 ? MetaCharacter.CHARACTERS.get((char) escaped) : null;
  }

  /**
   * Anchor written as an escape, such as {@code \b}.
   *
   * @param escaped code point following the escape character
   * @return anchor or else {@code null}
   */
  private static AnchorType anchor(int escaped) {
    return escaped < 128 ? AnchorType.CHARACTERS.get((char) escaped) : null;
  }

  /**
   * Character denoted by an escape sequence.
   *
   * @param escaped code point following the escape character
   * @return the control character for {@code n}, {@code t}, {@code r},
   *   {@code f}, otherwise the escaped character itself
   */
  private static int unescape(int escaped) {
    switch (escaped) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      case 'f':
        return '\f';
      default:
        return escaped;
    }
  }
}
