package railroad.parser;

/**
 * Traversal of the character class AST.
 *
 * @param <C> output from visiting a character type
 */
public interface CharacterTypeVisitor<C> {

  /**
   * Matches any of the class members.
   *
   * @param any class holding the members
   */
  C visitAny(CharacterType.Any any);

  /**
   * Matches everything except the class members.
   *
   * @param not negated class holding the members
   */
  C visitNot(CharacterType.Not not);

  /**
   * Matches a range of characters.
   *
   * @param between range with its two endpoints
   */
  C visitBetween(CharacterType.Between between);

  /**
   * Matches a single character.
   *
   * @param terminal the literal character
   */
  C visitTerminal(CharacterType.Terminal terminal);

  /**
   * Matches a builtin class.
   *
   * @param meta the builtin class
   */
  C visitMeta(CharacterType.Meta meta);
}
