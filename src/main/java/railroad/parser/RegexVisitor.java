package railroad.parser;

/**
 * Traversal of the regular expression syntax tree.
 *
 * <p>Unlike a bottom-up visitor, each method receives the node itself and
 * decides whether (and in what order) to recurse into its children.
 *
 * @param <R> output from visiting a node
 */
public interface RegexVisitor<R> {

  /**
   * Concatenation of patterns.
   *
   * @param element node holding the concatenated patterns
   */
  R visitElement(Regex.Element element);

  /**
   * Pattern matched a bounded or unbounded number of times.
   *
   * @param repetition node holding the repetition type and the pattern
   */
  R visitRepetition(Regex.Repetition repetition);

  /**
   * Choice between patterns.
   *
   * @param alternation node holding at least two branches
   */
  R visitAlternation(Regex.Alternation alternation);

  /**
   * Character matched against a class or a meta character.
   *
   * @param character node holding the character type
   */
  R visitCharacter(Regex.CharacterMatch character);

  /**
   * Zero-width assertion.
   *
   * @param anchor node holding the anchor type
   */
  R visitAnchor(Regex.Anchor anchor);

  /**
   * Literal text.
   *
   * @param terminal node holding the text
   */
  R visitTerminal(Regex.Terminal terminal);

  /**
   * Parenthesized group.
   *
   * @param capture node holding the group name, index and pattern
   */
  R visitCapture(Regex.Capture capture);
}
