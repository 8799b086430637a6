package railroad.parser;

import java.util.List;
import java.util.Optional;

/**
 * Node of the regular expression syntax tree.
 *
 * <p>Trees are immutable and strictly owned: lists are copied on
 * construction and no node is ever shared between two parents. Consumers
 * traverse the tree with a {@link RegexVisitor}, so adding a new variant
 * means every consumer has to handle it.
 */
public interface Regex {

  /**
   * Dispatch to the visitor method matching this node.
   *
   * @param visitor visitor to dispatch to
   * @return whatever the visitor produced for this node
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * Patterns matched one after another.
   *
   * @param items patterns in the order they are matched
   */
  record Element(List<Regex> items) implements Regex {

    public Element(List<Regex> items) {
      this.items = List.copyOf(items);
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitElement(this);
    }
  }

  /**
   * Pattern matched a number of times.
   *
   * @param type how many times the pattern may be matched
   * @param inner repeated pattern
   */
  record Repetition(RepetitionType type, Regex inner) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitRepetition(this);
    }
  }

  /**
   * Choice between two or more patterns.
   *
   * @param branches alternatives, in source order
   */
  record Alternation(List<Regex> branches) implements Regex {

    public Alternation(List<Regex> branches) {
      if (branches.size() < 2) {
        throw new IllegalArgumentException(
          "Alternation needs at least two branches, got " + branches.size()
        );
      }
      this.branches = List.copyOf(branches);
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitAlternation(this);
    }
  }

  /**
   * Single character matched against a character class.
   *
   * <p>Only {@link CharacterType.Any}, {@link CharacterType.Not} and
   * {@link CharacterType.Meta} are valid payloads here; ranges and single
   * characters only ever appear nested inside a class.
   *
   * @param type class the character must belong to
   */
  record CharacterMatch(CharacterType type) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitCharacter(this);
    }
  }

  /**
   * Zero-width assertion.
   *
   * @param type position being asserted
   */
  record Anchor(AnchorType type) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitAnchor(this);
    }
  }

  /**
   * Run of literal characters.
   *
   * @param text characters matched verbatim
   */
  record Terminal(String text) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitTerminal(this);
    }
  }

  /**
   * Parenthesized group.
   *
   * @param name name given with {@code (?<name>...)}, if any
   * @param groupIndex 1-based index in order of opening parentheses
   * @param inner grouped pattern
   */
  record Capture(Optional<String> name, int groupIndex, Regex inner) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitCapture(this);
    }
  }
}
