package cyk.syntax;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.javatuples.Pair;
import org.javatuples.Triplet;

import cyk.util.CollectionUtils;

/**
 * CYK recognizer for grammars in Chomsky normal form.
 * <p>
 * The chart is filled bottom-up: span 1 from the lexical productions, then
 * every longer span from all split points of the two shorter spans that
 * compose it. For each (start, length, nonterminal) only the first
 * derivation found is kept as backpointer; nonterminals are numbered in
 * head order of the grammar and both cells of a split are scanned in
 * ascending id order, so the choice is deterministic for a given grammar.
 *
 */
public class Parser {

  private static final Logger LOGGER = Logger.getLogger("Parser");

  /**
   * @throws InvalidGrammarException if <code>g</code> is not in CNF
   */
  public Parser(Grammar g) {
    Rule bad = g.firstNonCnfRule();
    if (bad != null)
      throw new InvalidGrammarException("The grammar must be in Chomsky normal form to be parsed with CYK, offending rule: " + bad);
    _g = g;
    for (String head : g.heads())
      _nts.register(head);
    for (String nt : g.nts())
      _nts.register(nt);
    indexRules();
  }

  public static ParseResult parse(Grammar g, List<String> tokens) {
    return new Parser(g).parse(tokens);
  }

  /** Builds the inverse indices terminal -&gt; heads and (B,C) -&gt; heads */
  private void indexRules() {
    for (Rule r : _g.rules()) {
      if (r.arity() == 1) {
        CollectionUtils.addToValueSet(_unary, r.rhs().get(0), r.lhs());
      } else if (r.arity() == 2) {
        CollectionUtils.addToValueSet(_binary, Pair.with(r.rhs().get(0), r.rhs().get(1)), r.lhs());
      } else if (r.lhs().equals(_g.Start())) {
        _acceptsEmpty = true;
      }
    }
  }

  public ParseResult parse(List<String> tokens) {
    int n = tokens.size();
    Map<Triplet<Integer,Integer,String>,Backpointer> back =
        new LinkedHashMap<Triplet<Integer,Integer,String>,Backpointer>();
    BitRecChart chart = new BitRecChart(n, _nts.size() - 1);
    if (n == 0) {
      LOGGER.fine("Empty input, accepted: " + _acceptsEmpty);
      return new ParseResult(_acceptsEmpty, tokens, _g.Start(), chart, _nts, back);
    }
    lexparse(tokens, chart, back);
    recognize(chart, back);
    boolean accepted = chart.recognized(_nts.lookup(_g.Start()));
    if (LOGGER.isLoggable(Level.FINE))
      LOGGER.fine(n + " tokens, chart filling rate " + chart.fillrate() + ", accepted: " + accepted);
    return new ParseResult(accepted, tokens, _g.Start(), chart, _nts, back);
  }

  /** fills the span-1 cells from the lexical productions */
  private void lexparse(List<String> tokens, BitRecChart chart,
      Map<Triplet<Integer,Integer,String>,Backpointer> back) {
    for (int i = 0; i < tokens.size(); i ++) {
      String token = tokens.get(i);
      for (String head : CollectionUtils.getValueSet(_unary, token)) {
        if (chart.set(i, 1, _nts.lookup(head)))
          back.put(Triplet.with(i, 1, head), new Backpointer.Lexical(token));
      }
    }
  }

  private void recognize(BitRecChart chart,
      Map<Triplet<Integer,Integer,String>,Backpointer> back) {
    int n = chart.maxpos();
    for (int span = 2; span <= n; span ++) {
      for (int i = 0; i + span <= n; i ++) {
        for (int split = 1; split < span; split ++) {
          BitSet left = chart.cell(i, split);
          BitSet right = chart.cell(i + split, span - split);
          if (left.isEmpty() || right.isEmpty())
            continue;
          for (int b = left.nextSetBit(0); b >= 0; b = left.nextSetBit(b+1)) {
            String B = _nts.lookup(b);
            for (int c = right.nextSetBit(0); c >= 0; c = right.nextSetBit(c+1)) {
              String C = _nts.lookup(c);
              Set<String> heads = CollectionUtils.getValueSet(_binary, Pair.with(B, C));
              for (String A : heads) {
                if (chart.set(i, span, _nts.lookup(A)))
                  back.put(Triplet.with(i, span, A), new Backpointer.Split(split, B, C));
              }
            }
          }
        }
      }
    }
  }

  /**
   * Walks the backpointers from <code>(0, length, start)</code> down to the
   * tokens.
   * @return null if no derivation of the whole input was recorded
   */
  public static ParseTree buildParse(Map<Triplet<Integer,Integer,String>,Backpointer> back,
      int length, String start) {
    if (!back.containsKey(Triplet.with(0, length, start)))
      return null;
    return buildParse(back, 0, length, start);
  }

  private static ParseTree buildParse(Map<Triplet<Integer,Integer,String>,Backpointer> back,
      int start, int length, String A) {
    Backpointer bp = back.get(Triplet.with(start, length, A));
    if (bp == null)
      throw new IllegalStateException("No backpointer for " + A + " over (" + start + ", " + length + ")");
    if (bp.isLexical())
      return new ParseTree.Leaf(A, ((Backpointer.Lexical)bp).getToken());
    Backpointer.Split s = (Backpointer.Split)bp;
    ParseTree lc = buildParse(back, start, s.getSplit(), s.getLeft());
    ParseTree rc = buildParse(back, start + s.getSplit(), length - s.getSplit(), s.getRight());
    return new ParseTree.Internal(A, lc, rc);
  }

  /** Whitespace tokenization, optionally lower-casing every token */
  public static List<String> tokenize(String sentence, boolean lowercase) {
    List<String> tokenized = new ArrayList<String>();
    String trimmed = sentence.trim();
    if (trimmed.isEmpty())
      return tokenized;
    for (String tok : trimmed.split("\\s+"))
      tokenized.add(lowercase ? tok.toLowerCase(Locale.ROOT) : tok);
    return tokenized;
  }

  private final Grammar _g;
  private final SymbolTable _nts = new SymbolTable();
  /** terminal -> heads A with A -> terminal */
  private final Map<String,Set<String>> _unary = new HashMap<String,Set<String>>();
  /** (B, C) -> heads A with A -> B C */
  private final Map<Pair<String,String>,Set<String>> _binary = new HashMap<Pair<String,String>,Set<String>>();
  private boolean _acceptsEmpty = false;

}
