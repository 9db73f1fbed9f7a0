package cyk.syntax;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.javatuples.Triplet;

/**
 * Outcome of one CYK run: the verdict together with the chart and the
 * backpointers it was derived from. Owned by the caller.
 *
 */
public class ParseResult {

  ParseResult(boolean accepted, List<String> tokens, String start,
      BitRecChart chart, SymbolTable nts,
      Map<Triplet<Integer,Integer,String>,Backpointer> back) {
    _accepted = accepted;
    _tokens = Collections.unmodifiableList(new ArrayList<String>(tokens));
    _start = start;
    _chart = chart;
    _nts = nts;
    _back = Collections.unmodifiableMap(back);
  }

  public boolean accepted() {
    return _accepted;
  }
  public List<String> tokens() {
    return _tokens;
  }
  public String start() {
    return _start;
  }
  public BitRecChart chart() {
    return _chart;
  }
  public Map<Triplet<Integer,Integer,String>,Backpointer> backpointers() {
    return _back;
  }

  /** Names of the nonterminals deriving tokens <code>start .. start+length-1</code> */
  public Set<String> symbols(int start, int length) {
    Set<String> result = new LinkedHashSet<String>();
    BitSet cell = _chart.cell(start, length);
    for (int A = cell.nextSetBit(0); A >= 0; A = cell.nextSetBit(A+1))
      result.add(_nts.lookup(A));
    return result;
  }

  /**
   * Reconstructs the recorded derivation of the whole input.
   * @return null if the input was not accepted, or is empty
   */
  public ParseTree tree() {
    if (!_accepted)
      return null;
    return Parser.buildParse(_back, _tokens.size(), _start);
  }

  public double fillrate() {
    return _chart.fillrate();
  }

  private final boolean _accepted;
  private final List<String> _tokens;
  private final String _start;
  private final BitRecChart _chart;
  private final SymbolTable _nts;
  private final Map<Triplet<Integer,Integer,String>,Backpointer> _back;
}
