package railroad.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class RegexParserTest {

  private static Regex element(Regex... items) {
    return new Regex.Element(List.of(items));
  }

  private static Regex terminal(String text) {
    return new Regex.Terminal(text);
  }

  private static Regex characters(CharacterType type) {
    return new Regex.CharacterMatch(type);
  }

  @Nested
  public class Literals {

    @Test
    public void runOfCharacters() {
      assertEquals(element(terminal("abc")), RegexParser.parse("abc"));
    }

    @Test
    public void emptyPattern() {
      assertEquals(element(), RegexParser.parse(""));
    }

    @Test
    public void quantifierOnlyTakesLastCharacter() {
      assertEquals(
        element(terminal("ab"), new Regex.Repetition(new RepetitionType.OrMore(0), terminal("c"))),
        RegexParser.parse("abc*")
      );
    }

    @Test
    public void escapedSpecialCharacters() {
      assertEquals(element(terminal("a.b(")), RegexParser.parse("a\\.b\\("));
    }

    @Test
    public void controlEscapes() {
      assertEquals(element(terminal("a\nb\t")), RegexParser.parse("a\\nb\\t"));
    }

    @Test
    public void strayClosingBracketIsLiteral() {
      assertEquals(element(terminal("a"), terminal("]")), RegexParser.parse("a]"));
    }

    @Test
    public void customEscapeCharacter() {
      assertEquals(
        element(terminal("a"), characters(new CharacterType.Meta(MetaCharacter.DIGIT))),
        RegexParser.parse("a%d", '%')
      );
      assertEquals(element(terminal("a\\d")), RegexParser.parse("a\\d", '%'));
    }

    @Test
    public void supplementaryCharacterIsQuantifiedWhole() {
      assertEquals(
        element(new Regex.Repetition(new RepetitionType.OrMore(1), terminal("😀"))),
        RegexParser.parse("😀+")
      );
      assertEquals(
        element(terminal("a😀"), new Regex.Repetition(new RepetitionType.OrMore(0), terminal("b"))),
        RegexParser.parse("a😀b*")
      );
    }

    @Test
    public void escapedSupplementaryCharacterIsLiteral() {
      // U+10064 truncated to a UTF-16 unit would read as `d`
      assertEquals(element(terminal("\uD800\uDC64")), RegexParser.parse("\\\uD800\uDC64"));
    }

    @Test
    public void deterministic() {
      final String pattern = "^(?:a|b)?[^aoeu_0-9]+(?<x>c{2,3})$";
      assertEquals(RegexParser.parse(pattern), RegexParser.parse(pattern));
    }
  }

  @Nested
  public class Alternations {

    @Test
    public void twoBranches() {
      assertEquals(
        new Regex.Alternation(List.of(element(terminal("a")), element(terminal("b")))),
        RegexParser.parse("a|b")
      );
    }

    @Test
    public void emptyBranch() {
      assertEquals(
        new Regex.Alternation(List.of(element(terminal("a")), element(), element(terminal("b")))),
        RegexParser.parse("a||b")
      );
    }

    @Test
    public void needsTwoBranches() {
      assertThrows(IllegalArgumentException.class, () -> new Regex.Alternation(List.of(element())));
    }
  }

  @Nested
  public class Repetitions {

    private RepetitionType repetitionOf(String pattern) {
      final var parsed = (Regex.Element) RegexParser.parse(pattern);
      assertEquals(1, parsed.items().size());
      return assertInstanceOf(Regex.Repetition.class, parsed.items().get(0)).type();
    }

    @Test
    public void shorthands() {
      assertEquals(new RepetitionType.OrMore(0), repetitionOf("a*"));
      assertEquals(new RepetitionType.OrMore(1), repetitionOf("a+"));
      assertEquals(new RepetitionType.ZeroOrOne(), repetitionOf("a?"));
    }

    @Test
    public void braces() {
      assertEquals(new RepetitionType.Exactly(8), repetitionOf("a{8}"));
      assertEquals(new RepetitionType.OrMore(5), repetitionOf("a{5,}"));
      assertEquals(new RepetitionType.Between(1, 10), repetitionOf("a{1,10}"));
    }

    @Test
    public void lazyModifierIsIgnored() {
      assertEquals(new RepetitionType.OrMore(0), repetitionOf("a*?"));
      assertEquals(new RepetitionType.Between(2, 3), repetitionOf("a{2,3}?"));
    }

    @Test
    public void invalidCount() {
      final var error = assertThrows(RepetitionValueException.class, () -> RegexParser.parse("a{1,x}"));
      assertEquals('x', error.found);
      assertEquals(4, error.getIndex());
    }

    @Test
    public void unclosedBraces() {
      final var error = assertThrows(UnexpectedCharacterException.class, () -> RegexParser.parse("a{1"));
      assertEquals('}', error.expected);
      assertEquals(OptionalInt.empty(), error.found);
    }

    @Test
    public void overflowingCount() {
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("a{99999999999}"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "*a", "a|+b", "(?:?)", "{2}" })
    public void danglingQuantifier(String pattern) {
      final var error = assertThrows(PatternSyntaxException.class, () -> RegexParser.parse(pattern));
      assertEquals("Dangling meta character '" + error.getPattern().charAt(error.getIndex()) + "'", error.getDescription());
    }
  }

  @Nested
  public class Classes {

    @Test
    public void ranges() {
      assertEquals(
        element(characters(new CharacterType.Any(List.of(
          new CharacterType.Between('a', 'z'),
          new CharacterType.Between('0', '9')
        )))),
        RegexParser.parse("[a-z0-9]")
      );
    }

    @Test
    public void negated() {
      assertEquals(
        element(characters(new CharacterType.Not(List.of(new CharacterType.Between('a', 'z'))))),
        RegexParser.parse("[^a-z]")
      );
    }

    @Test
    public void trailingDashIsLiteral() {
      assertEquals(
        element(characters(new CharacterType.Any(List.of(
          new CharacterType.Terminal('a'),
          new CharacterType.Terminal('-')
        )))),
        RegexParser.parse("[a-]")
      );
    }

    @Test
    public void metaCharactersInsideClass() {
      assertEquals(
        element(characters(new CharacterType.Not(List.of(
          new CharacterType.Meta(MetaCharacter.WHITESPACE),
          new CharacterType.Terminal(']')
        )))),
        RegexParser.parse("[^\\s\\]]")
      );
    }

    @Test
    public void bareMetaCharacters() {
      assertEquals(
        element(
          characters(new CharacterType.Meta(MetaCharacter.ANY)),
          characters(new CharacterType.Meta(MetaCharacter.NON_WORD))
        ),
        RegexParser.parse(".\\W")
      );
    }

    @Test
    public void supplementaryCharacterIsOneMember() {
      assertEquals(
        element(characters(new CharacterType.Any(List.of(new CharacterType.Terminal(0x1F600))))),
        RegexParser.parse("[😀]")
      );
      assertEquals(
        element(characters(new CharacterType.Not(List.of(
          new CharacterType.Terminal(0x1F600),
          new CharacterType.Terminal('-')
        )))),
        RegexParser.parse("[^\\😀-]")
      );
      assertEquals("😀", CharacterLabels.label(new CharacterType.Terminal(0x1F600)));
    }

    @Test
    public void reversedRangeIsKept() {
      assertEquals(
        element(characters(new CharacterType.Any(List.of(new CharacterType.Between('z', 'a'))))),
        RegexParser.parse("[z-a]")
      );
    }

    @ParameterizedTest
    @ValueSource(strings = { "[a-9]", "[0-Z]", "[!-~]" })
    public void mismatchedRange(String pattern) {
      final var error = assertThrows(CharacterRangeException.class, () -> RegexParser.parse(pattern));
      assertEquals(pattern.charAt(1), error.first);
      assertEquals(pattern.charAt(3), error.last);
      assertEquals(1, error.getIndex());
    }

    @Test
    public void emptyClass() {
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("[]"));
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("[^]"));
    }

    @Test
    public void unclosedClass() {
      final var error = assertThrows(UnexpectedCharacterException.class, () -> RegexParser.parse("[ab"));
      assertEquals(']', error.expected);
    }

    @Test
    public void emailAddress() {
      final var parsed = (Regex.Element) RegexParser.parse("^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,4}$");
      assertEquals(7, parsed.items().size());
      assertEquals(new Regex.Anchor(AnchorType.START), parsed.items().get(0));
      assertEquals(terminal("@"), parsed.items().get(2));
      assertEquals(terminal("."), parsed.items().get(4));
      assertEquals(new Regex.Anchor(AnchorType.END), parsed.items().get(6));

      final var user = assertInstanceOf(Regex.Repetition.class, parsed.items().get(1));
      final var members = assertInstanceOf(Regex.CharacterMatch.class, user.inner()).type();
      assertEquals(7, assertInstanceOf(CharacterType.Any.class, members).members().size());
    }
  }

  @Nested
  public class Groups {

    @Test
    public void named() {
      assertEquals(
        element(new Regex.Capture(Optional.of("name"), 1, element(terminal("a")))),
        RegexParser.parse("(?<name>a)")
      );
    }

    @Test
    public void nonCapturing() {
      assertEquals(
        element(new Regex.Capture(Optional.empty(), 1, element(terminal("a")))),
        RegexParser.parse("(?:a)")
      );
    }

    @Test
    public void numberedInOpeningOrder() {
      final var outer = new Regex.Capture(
        Optional.empty(),
        1,
        element(terminal("a"), new Regex.Capture(Optional.empty(), 2, element(terminal("b"))))
      );
      final var last = new Regex.Capture(Optional.empty(), 3, element(terminal("c")));
      assertEquals(element(outer, last), RegexParser.parse("(a(b))(c)"));
    }

    @Test
    public void alternationInsideGroup() {
      final var parsed = (Regex.Element) RegexParser.parse("a(b|c|d)e");
      final var group = assertInstanceOf(Regex.Capture.class, parsed.items().get(1));
      assertEquals(3, assertInstanceOf(Regex.Alternation.class, group.inner()).branches().size());
    }

    @Test
    public void unmatchedOpening() {
      final var error = assertThrows(UnexpectedCharacterException.class, () -> RegexParser.parse("(a"));
      assertEquals(')', error.expected);
      assertFalse(error.found.isPresent());
    }

    @Test
    public void unmatchedClosing() {
      final var error = assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("a)b"));
      assertEquals("Unmatched closing parenthesis", error.getDescription());
      assertEquals(1, error.getIndex());
    }

    @Test
    public void emptyName() {
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("(?<>a)"));
    }
  }

  @Nested
  public class Anchors {

    @Test
    public void lineAnchors() {
      assertEquals(
        element(new Regex.Anchor(AnchorType.START), terminal("a"), new Regex.Anchor(AnchorType.END)),
        RegexParser.parse("^a$")
      );
    }

    @Test
    public void wordBoundaries() {
      assertEquals(
        element(
          new Regex.Anchor(AnchorType.WORD_BOUNDARY),
          terminal("a"),
          new Regex.Anchor(AnchorType.NOT_WORD_BOUNDARY)
        ),
        RegexParser.parse("\\ba\\B")
      );
    }
  }

  @Nested
  public class Unsupported {

    @ParameterizedTest
    @ValueSource(strings = { "(?=a)", "(?!a)", "(?<=a)", "(?<!a)", "(?i)a", "(a)\\1", "a*+" })
    public void rejected(String pattern) {
      assertThrows(UnsupportedPatternSyntaxException.class, () -> RegexParser.parse(pattern));
    }

    @Test
    public void category() {
      final var error = assertThrows(UnsupportedPatternSyntaxException.class, () -> RegexParser.parse("(?=a)"));
      assertEquals("Lookahead groups", error.unsupportedFeatureCategory);
    }

    @Test
    public void trailingEscape() {
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("a\\"));
      assertThrows(PatternSyntaxException.class, () -> RegexParser.parse("[a\\"));
    }
  }
}
