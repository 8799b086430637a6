package railroad.text;

import java.util.ArrayList;
import java.util.logging.Logger;
import railroad.parser.CharacterLabels;
import railroad.parser.CharacterType;
import railroad.parser.CharacterTypeVisitor;
import railroad.parser.InvalidParsingException;
import railroad.parser.Regex;
import railroad.parser.RegexVisitor;
import railroad.parser.RepetitionType;

/**
 * Describes a regular expression in words.
 *
 * <p>Repetitions, classes and groups produce a highlighted header followed by
 * their indented content:
 *
 * <pre>
 *   'ab'
 *   BETWEEN 2 AND 4:
 *       MATCH:
 *           a-z, 0-9
 *   OR
 *   'c'
 * </pre>
 */
public final class TextRenderer implements RegexVisitor<TextDescription> {

  private static final Logger LOGGER = Logger.getLogger(TextRenderer.class.getName());

  public static final TextRenderer INSTANCE = new TextRenderer();

  private TextRenderer() { }

  /**
   * Describe a whole regular expression.
   *
   * @param regex parsed regular expression
   * @return description
   */
  public static TextDescription render(Regex regex) {
    final TextDescription description = regex.accept(INSTANCE);
    LOGGER.fine(() -> "Rendered " + description.lines().size() + " lines of description");
    return description;
  }

  @Override
  public TextDescription visitElement(Regex.Element element) {
    if (element.items().isEmpty()) {
      return TextDescription.line("NOTHING");
    }
    TextDescription description = TextDescription.empty();
    for (Regex item : element.items()) {
      description = description.followedBy(item.accept(this));
    }
    return description;
  }

  @Override
  public TextDescription visitRepetition(Regex.Repetition repetition) {
    final String header = repetition.type().accept(HEADER);
    return nested(header, repetition.inner().accept(this));
  }

  @Override
  public TextDescription visitAlternation(Regex.Alternation alternation) {
    TextDescription description = alternation.branches().get(0).accept(this);
    for (Regex branch : alternation.branches().subList(1, alternation.branches().size())) {
      description = description
        .followedBy(TextDescription.header("OR"))
        .followedBy(branch.accept(this));
    }
    return description;
  }

  @Override
  public TextDescription visitCharacter(Regex.CharacterMatch character) {
    return character.type().accept(CHARACTER);
  }

  @Override
  public TextDescription visitAnchor(Regex.Anchor anchor) {
    return TextDescription.line(anchor.type().label());
  }

  @Override
  public TextDescription visitTerminal(Regex.Terminal terminal) {
    return TextDescription.line("'" + CharacterLabels.printable(terminal.text()) + "'");
  }

  @Override
  public TextDescription visitCapture(Regex.Capture capture) {
    final String name = capture.name().orElse(Integer.toString(capture.groupIndex()));
    return nested("GROUP " + name + ":", capture.inner().accept(this));
  }

  private static TextDescription nested(String header, TextDescription content) {
    return TextDescription.header(header).followedBy(content.indented(TextDescription.INDENT));
  }

  private static TextDescription members(String header, Iterable<CharacterType> members) {
    final var labels = new ArrayList<String>();
    for (CharacterType member : members) {
      labels.add(CharacterLabels.label(member));
    }
    return nested(header, TextDescription.line(String.join(", ", labels)));
  }

  private static final RepetitionType.Visitor<String> HEADER = new RepetitionType.Visitor<>() {
    @Override
    public String visitOrMore(RepetitionType.OrMore orMore) {
      return orMore.min() + " OR MORE:";
    }

    @Override
    public String visitZeroOrOne(RepetitionType.ZeroOrOne zeroOrOne) {
      return "OPTIONALLY:";
    }

    @Override
    public String visitExactly(RepetitionType.Exactly exactly) {
      return "EXACTLY " + exactly.count() + ":";
    }

    @Override
    public String visitBetween(RepetitionType.Between between) {
      return "BETWEEN " + between.min() + " AND " + between.max() + ":";
    }
  };

  private static final CharacterTypeVisitor<TextDescription> CHARACTER = new CharacterTypeVisitor<>() {
    @Override
    public TextDescription visitAny(CharacterType.Any any) {
      return members("MATCH:", any.members());
    }

    @Override
    public TextDescription visitNot(CharacterType.Not not) {
      return members("DON'T MATCH:", not.members());
    }

    @Override
    public TextDescription visitBetween(CharacterType.Between between) {
      throw new InvalidParsingException("Character range outside of a class: " + between);
    }

    @Override
    public TextDescription visitTerminal(CharacterType.Terminal terminal) {
      throw new InvalidParsingException("Class member outside of a class: " + terminal);
    }

    @Override
    public TextDescription visitMeta(CharacterType.Meta meta) {
      return TextDescription.line(meta.meta().label());
    }
  };
}
