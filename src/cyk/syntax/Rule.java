package cyk.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A single production HEAD -&gt; BODY. The body may be empty (an
 * epsilon production).
 *
 */
public class Rule implements Serializable {

  private static final long serialVersionUID = 4902245258139401162L;

  public Rule(String lhs, List<String> rhs) {
    if (lhs == null)
      throw new NullPointerException("Rule head may not be null");
    if (rhs == null)
      throw new NullPointerException("Rule body may not be null");
    _lhs = lhs;
    _rhs = Collections.unmodifiableList(new ArrayList<String>(rhs));
  }
  public Rule(String lhs, String... rhs) {
    this(lhs, Arrays.asList(rhs));
  }
  public String lhs() {
    return _lhs;
  }
  public List<String> rhs() {
    return _rhs;
  }
  public int arity() {
    return _rhs.size();
  }
  public boolean isEpsilon() {
    return _rhs.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (! (o instanceof Rule))
      return false;
    Rule that = (Rule)o;
    return this._lhs.equals(that._lhs) &&
        this._rhs.equals(that._rhs);
  }

  @Override
  public int hashCode() {
    final int prime = 97;
    int result = 1;
    result = prime * result + _lhs.hashCode();
    for (String c : _rhs) {
      result = prime * result + c.hashCode();
    }
    return result;
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(_lhs);
    sb.append(" ->");
    if (_rhs.isEmpty())
      sb.append(" ").append(Grammar.EPSILON);
    for (String r : _rhs) {
      sb.append(" ");
      sb.append(r);
    }
    return sb.toString();
  }

  private final String _lhs;
  private final List<String> _rhs;
}
