package railroad.parser;

import java.util.List;

/**
 * Set of characters a single input character is matched against.
 */
public interface CharacterType {

  /**
   * Dispatch to the visitor method matching this character type.
   *
   * @param visitor visitor to dispatch to
   * @return whatever the visitor produced for this character type
   */
  <R> R accept(CharacterTypeVisitor<R> visitor);

  /**
   * Any of the members, written {@code [...]}.
   *
   * @param members ranges, characters and meta characters of the class
   */
  record Any(List<CharacterType> members) implements CharacterType {

    public Any(List<CharacterType> members) {
      this.members = List.copyOf(members);
    }

    @Override
    public <R> R accept(CharacterTypeVisitor<R> visitor) {
      return visitor.visitAny(this);
    }
  }

  /**
   * None of the members, written {@code [^...]}.
   *
   * @param members ranges, characters and meta characters excluded
   */
  record Not(List<CharacterType> members) implements CharacterType {

    public Not(List<CharacterType> members) {
      this.members = List.copyOf(members);
    }

    @Override
    public <R> R accept(CharacterTypeVisitor<R> visitor) {
      return visitor.visitNot(this);
    }
  }

  /**
   * Inclusive range of characters, written {@code a-z}.
   *
   * <p>Only the endpoints' classes are checked (both digits, both lower case
   * or both upper case), not their order.
   *
   * @param first code point of the first character of the range
   * @param last code point of the last character of the range
   */
  record Between(int first, int last) implements CharacterType {

    @Override
    public <R> R accept(CharacterTypeVisitor<R> visitor) {
      return visitor.visitBetween(this);
    }
  }

  /**
   * Single literal character.
   *
   * @param character code point of the literal character
   */
  record Terminal(int character) implements CharacterType {

    @Override
    public <R> R accept(CharacterTypeVisitor<R> visitor) {
      return visitor.visitTerminal(this);
    }
  }

  /**
   * Builtin class such as {@code \d} or {@code .}.
   *
   * @param meta builtin class
   */
  record Meta(MetaCharacter meta) implements CharacterType {

    @Override
    public <R> R accept(CharacterTypeVisitor<R> visitor) {
      return visitor.visitMeta(this);
    }
  }
}
