package railroad.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import railroad.parser.CharacterLabels;
import railroad.parser.CharacterType;
import railroad.parser.CharacterTypeVisitor;
import railroad.parser.InvalidParsingException;
import railroad.parser.Regex;
import railroad.parser.RegexVisitor;
import railroad.parser.RepetitionType;

/**
 * Maps a regular expression syntax tree onto railroad diagram nodes.
 */
public final class DiagramGenerator implements RegexVisitor<Draw> {

  private static final Logger LOGGER = Logger.getLogger(DiagramGenerator.class.getName());

  public static final DiagramGenerator INSTANCE = new DiagramGenerator();

  private DiagramGenerator() { }

  /**
   * Build the complete diagram for a regular expression, from {@code START}
   * to {@code END}.
   *
   * <p>The items of a top-level concatenation are laid out directly between
   * the two caps rather than in a nested sequence.
   *
   * @param regex parsed regular expression
   * @return diagram
   */
  public static Draw generate(Regex regex) {
    final var children = new ArrayList<Draw>();
    children.add(new Start());
    if (regex instanceof Regex.Element element) {
      for (Regex item : element.items()) {
        children.add(item.accept(INSTANCE));
      }
    } else {
      children.add(regex.accept(INSTANCE));
    }
    children.add(new End());

    final var diagram = new Sequence(children);
    LOGGER.fine(() -> "Generated diagram " + diagram);
    return diagram;
  }

  @Override
  public Draw visitElement(Regex.Element element) {
    final var children = new ArrayList<Draw>(element.items().size());
    for (Regex item : element.items()) {
      children.add(item.accept(this));
    }
    return new Sequence(children);
  }

  @Override
  public Draw visitRepetition(Regex.Repetition repetition) {
    final Draw inner = repetition.inner().accept(this);
    if (repetition.type() instanceof RepetitionType.ZeroOrOne) {
      return new Optional(inner);
    }
    return new Repetition(inner, repetition.type());
  }

  @Override
  public Draw visitAlternation(Regex.Alternation alternation) {
    final var branches = new ArrayList<Draw>(alternation.branches().size());
    for (Regex branch : alternation.branches()) {
      branches.add(branch.accept(this));
    }
    return new Choice(branches);
  }

  @Override
  public Draw visitCharacter(Regex.CharacterMatch character) {
    return character.type().accept(CHARACTER);
  }

  @Override
  public Draw visitAnchor(Regex.Anchor anchor) {
    return new Anchor(anchor.type().label());
  }

  @Override
  public Draw visitTerminal(Regex.Terminal terminal) {
    return new Terminal(CharacterLabels.printable(terminal.text()));
  }

  @Override
  public Draw visitCapture(Regex.Capture capture) {
    final String name = capture.name().orElse("Group " + capture.groupIndex());
    return new Capture(capture.inner().accept(this), name);
  }

  private static List<String> labels(List<CharacterType> members) {
    final var labels = new ArrayList<String>(members.size());
    for (CharacterType member : members) {
      labels.add(CharacterLabels.label(member));
    }
    return labels;
  }

  private static final CharacterTypeVisitor<Draw> CHARACTER = new CharacterTypeVisitor<>() {
    @Override
    public Draw visitAny(CharacterType.Any any) {
      return new Stack(false, labels(any.members()));
    }

    @Override
    public Draw visitNot(CharacterType.Not not) {
      return new Stack(true, labels(not.members()));
    }

    @Override
    public Draw visitBetween(CharacterType.Between between) {
      throw new InvalidParsingException("Character range outside of a class: " + between);
    }

    @Override
    public Draw visitTerminal(CharacterType.Terminal terminal) {
      throw new InvalidParsingException("Class member outside of a class: " + terminal);
    }

    @Override
    public Draw visitMeta(CharacterType.Meta meta) {
      return new Anchor(meta.meta().label());
    }
  };
}
