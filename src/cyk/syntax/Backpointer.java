package cyk.syntax;

import java.io.Serializable;

/**
 * The recorded justification for a nonterminal covering a chart cell:
 * either a matched token or a binary split.
 */
public abstract class Backpointer implements Serializable {

  private static final long serialVersionUID = 1L;

  private Backpointer() {}

  public abstract boolean isLexical();

  /** A -&gt; token */
  public static final class Lexical extends Backpointer {

    private static final long serialVersionUID = 1L;

    private final String token;

    public Lexical(String token) {
      this.token = token;
    }

    public String getToken() {
      return token;
    }

    public boolean isLexical() {
      return true;
    }

    public boolean equals(Object o) {
      return (o instanceof Lexical) && token.equals(((Lexical)o).token);
    }

    public int hashCode() {
      return token.hashCode();
    }

    public String toString() {
      return "terminal(" + token + ")";
    }
  }

  /** A -&gt; B C where B covers the first <code>split</code> tokens of the span */
  public static final class Split extends Backpointer {

    private static final long serialVersionUID = 1L;

    private final int split;
    private final String left;
    private final String right;

    public Split(int split, String left, String right) {
      this.split = split;
      this.left = left;
      this.right = right;
    }

    public int getSplit() {
      return split;
    }

    public String getLeft() {
      return left;
    }

    public String getRight() {
      return right;
    }

    public boolean isLexical() {
      return false;
    }

    public boolean equals(Object o) {
      if (!(o instanceof Split))
        return false;
      Split that = (Split)o;
      return split == that.split && left.equals(that.left) && right.equals(that.right);
    }

    public int hashCode() {
      return 29 * (29 * split + left.hashCode()) + right.hashCode();
    }

    public String toString() {
      return "split(" + split + ", " + left + ", " + right + ")";
    }
  }

}
