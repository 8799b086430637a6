package railroad.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import railroad.parser.CharacterType;
import railroad.parser.InvalidParsingException;
import railroad.parser.Regex;
import railroad.parser.RegexParser;

public class DiagramGeneratorTest {

  private static List<Draw> topLevel(String pattern) {
    final var root = assertInstanceOf(Sequence.class, DiagramGenerator.generate(RegexParser.parse(pattern)));
    final List<Draw> children = root.children();
    assertInstanceOf(Start.class, children.get(0));
    assertInstanceOf(End.class, children.get(children.size() - 1));
    return children.subList(1, children.size() - 1);
  }

  @Test
  public void rootElementIsSpliced() {
    final List<Draw> nodes = topLevel("^ab$");
    assertEquals(3, nodes.size());
    assertEquals("LINE START", assertInstanceOf(Anchor.class, nodes.get(0)).text());
    assertEquals("ab", assertInstanceOf(Terminal.class, nodes.get(1)).text());
    assertEquals("LINE END", assertInstanceOf(Anchor.class, nodes.get(2)).text());
  }

  @Test
  public void emptyPattern() {
    assertEquals(List.of("START╟──╢END"), DiagramGenerator.generate(RegexParser.parse("")).draw());
  }

  @Test
  public void alternation() {
    final var choice = assertInstanceOf(Choice.class, topLevel("a|b").get(0));
    assertEquals(2, choice.branches().size());
    assertInstanceOf(Sequence.class, choice.branches().get(0));
  }

  @Test
  public void repetitions() {
    final List<Draw> nodes = topLevel("a?b{2,4}");
    assertInstanceOf(Optional.class, nodes.get(0));
    assertEquals(" 2-4 ", assertInstanceOf(Repetition.class, nodes.get(1)).description());
  }

  @Test
  public void characterClasses() {
    final List<Draw> nodes = topLevel("[^aoeu_0-9]\\d");
    final var stack = assertInstanceOf(Stack.class, nodes.get(0));
    assertTrue(stack.negated());
    assertEquals(List.of("a", "o", "e", "u", "_", "0-9"), stack.members());
    assertEquals("Digit", assertInstanceOf(Anchor.class, nodes.get(1)).text());
  }

  @Test
  public void groupNames() {
    final List<Draw> nodes = topLevel("(a)(?<word>b)");
    assertEquals("Group 1", assertInstanceOf(Capture.class, nodes.get(0)).name());
    assertEquals("word", assertInstanceOf(Capture.class, nodes.get(1)).name());
  }

  @Test
  public void controlCharactersAreEscaped() {
    assertEquals("a\\tb", assertInstanceOf(Terminal.class, topLevel("a\\tb").get(0)).text());
  }

  @Test
  public void supplementaryCharactersTakeOneColumn() {
    final var repetition = assertInstanceOf(Repetition.class, topLevel("😀+").get(0));
    final var terminal = assertInstanceOf(Terminal.class, repetition.inner());
    assertEquals("😀", terminal.text());
    assertEquals(5, terminal.width());
    assertEquals(List.of("  ┌───┐  ", "┬─┤ 😀 ├─┬", "│ └───┘ │", "╰─ 1+ ──╯"), repetition.draw());
  }

  @Test
  public void rangeOutsideClassIsInvalid() {
    final Regex invalid = new Regex.CharacterMatch(new CharacterType.Between('a', 'z'));
    assertThrows(InvalidParsingException.class, () -> DiagramGenerator.generate(invalid));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "",
    "a",
    "^(?:a|b)?",
    "[^aoeu_0-9]",
    "a(b|c|d)e",
    "a(b|cd{2}|e|f)g",
    "one(two){5}three",
    "^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,4}$",
    "(a|(b|c)+|)*x",
    "((((a))))",
    "a{100,20000}",
    "\\bfoo\\B|[\\s\\S]|.",
  })
  public void drawsConsistently(String pattern) {
    assertConsistent(DiagramGenerator.generate(RegexParser.parse(pattern)));
  }

  private static void assertConsistent(Draw node) {
    final List<String> rows = node.draw();
    assertEquals(node.height(), rows.size(), () -> "height of " + node);
    assertTrue(node.entryHeight() < node.height(), () -> "entry height of " + node);
    for (String row : rows) {
      assertEquals(node.width(), Draw.displayWidth(row), () -> "width of '" + row + "' in " + node);
    }
  }
}
