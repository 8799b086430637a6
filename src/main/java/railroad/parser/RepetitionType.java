package railroad.parser;

/**
 * How many times a repeated pattern may be matched.
 */
public interface RepetitionType {

  <R> R accept(Visitor<R> visitor);

  /**
   * At least {@code min} times: {@code *}, {@code +} and {@code {n,}}.
   */
  record OrMore(int min) implements RepetitionType {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOrMore(this);
    }
  }

  /**
   * Zero or one time: {@code ?}.
   */
  record ZeroOrOne() implements RepetitionType {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitZeroOrOne(this);
    }
  }

  /**
   * Exactly {@code count} times: {@code {n}}.
   */
  record Exactly(int count) implements RepetitionType {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExactly(this);
    }
  }

  /**
   * Between {@code min} and {@code max} times, both inclusive: {@code {n,m}}.
   */
  record Between(int min, int max) implements RepetitionType {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBetween(this);
    }
  }

  /**
   * Traversal over the repetition kinds.
   *
   * @param <R> output from visiting a repetition type
   */
  interface Visitor<R> {

    R visitOrMore(OrMore orMore);

    R visitZeroOrOne(ZeroOrOne zeroOrOne);

    R visitExactly(Exactly exactly);

    R visitBetween(Between between);
  }
}
