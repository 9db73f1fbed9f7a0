package cyk.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Binary derivation tree of a CNF grammar. A node is either a {@link Leaf}
 * (nonterminal over a single token) or an {@link Internal} node
 * (nonterminal over two subtrees).
 *
 */
public abstract class ParseTree implements Serializable {

  private static final long serialVersionUID = 1L;

  public interface Visitor<R> {
    R visitLeaf(Leaf leaf);
    R visitInternal(Internal node);
  }

  private final String label;

  private ParseTree(String label) {
    if (label == null)
      throw new NullPointerException("Tree label may not be null");
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public abstract boolean isLeaf();

  public abstract List<ParseTree> getChildren();

  public abstract <R> R accept(Visitor<R> visitor);

  /** The tokens under this node, left to right */
  public List<String> getYield() {
    List<String> yield = new ArrayList<String>();
    appendYield(this, yield);
    return yield;
  }

  private static void appendYield(ParseTree tree, List<String> yield) {
    if (tree.isLeaf()) {
      yield.add(((Leaf)tree).getToken());
    } else {
      Internal node = (Internal)tree;
      appendYield(node.getLeft(), yield);
      appendYield(node.getRight(), yield);
    }
  }

  public int depth() {
    if (isLeaf())
      return 1;
    Internal node = (Internal)this;
    return 1 + Math.max(node.getLeft().depth(), node.getRight().depth());
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    toStringBuilder(sb);
    return sb.toString();
  }

  protected abstract void toStringBuilder(StringBuilder sb);

  public static final class Leaf extends ParseTree {

    private static final long serialVersionUID = 1L;

    private final String token;

    public Leaf(String label, String token) {
      super(label);
      if (token == null)
        throw new NullPointerException("Leaf token may not be null");
      this.token = token;
    }

    public String getToken() {
      return token;
    }

    public boolean isLeaf() {
      return true;
    }

    public List<ParseTree> getChildren() {
      return Collections.emptyList();
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLeaf(this);
    }

    public boolean equals(Object o) {
      if (!(o instanceof Leaf))
        return false;
      Leaf that = (Leaf)o;
      return getLabel().equals(that.getLabel()) && token.equals(that.token);
    }

    public int hashCode() {
      return getLabel().hashCode() * 31 + token.hashCode();
    }

    protected void toStringBuilder(StringBuilder sb) {
      sb.append('(').append(getLabel()).append(' ').append(token).append(')');
    }
  }

  public static final class Internal extends ParseTree {

    private static final long serialVersionUID = 1L;

    private final ParseTree left;
    private final ParseTree right;

    public Internal(String label, ParseTree left, ParseTree right) {
      super(label);
      if (left == null || right == null)
        throw new NullPointerException("Internal node children may not be null");
      this.left = left;
      this.right = right;
    }

    public ParseTree getLeft() {
      return left;
    }

    public ParseTree getRight() {
      return right;
    }

    public boolean isLeaf() {
      return false;
    }

    public List<ParseTree> getChildren() {
      return Collections.unmodifiableList(Arrays.asList(left, right));
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInternal(this);
    }

    public boolean equals(Object o) {
      if (!(o instanceof Internal))
        return false;
      Internal that = (Internal)o;
      return getLabel().equals(that.getLabel()) && left.equals(that.left) &&
          right.equals(that.right);
    }

    public int hashCode() {
      return (getLabel().hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
    }

    protected void toStringBuilder(StringBuilder sb) {
      sb.append('(').append(getLabel()).append(' ');
      left.toStringBuilder(sb);
      sb.append(' ');
      right.toStringBuilder(sb);
      sb.append(')');
    }
  }

}
