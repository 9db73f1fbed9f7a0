package cyk.syntax;

import java.io.IOException;
import java.io.Serializable;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

import cyk.util.CollectionUtils;
import cyk.util.StringUtils;

/**
 * Context-Free Grammar.
 * <p>
 * A grammar is the aggregate of a nonterminal set, a terminal set, a start
 * symbol and a mapping from each head to the set of its production bodies.
 * Bodies are ordered symbol lists compared structurally; the empty list is
 * an epsilon production. All sets keep insertion order so that every
 * transformation over a grammar is deterministic.
 * <p>
 * No validation happens here: the reader and the transformations are
 * responsible for the grammar invariants. Instances are treated as values,
 * every transformation works on its own {@link #copy()}.
 *
 */
public class Grammar implements Serializable {

  private static final long serialVersionUID = 3779488872217828209L;

  /** Printed form of the empty body */
  public static final String EPSILON = "ε";

  public Grammar() {

  }

  public Grammar(Collection<String> nts, Collection<String> ts, String start) {
    for (String nt : nts)
      registerNT(nt);
    for (String t : ts)
      registerT(t);
    registerS(start);
  }

  /** Deep copy, no production set is shared with <code>other</code> */
  public Grammar(Grammar other) {
    _nts.addAll(other._nts);
    _ts.addAll(other._ts);
    _start = other._start;
    for (Map.Entry<String,Set<List<String>>> e : other._productions.entrySet())
      _productions.put(e.getKey(), new LinkedHashSet<List<String>>(e.getValue()));
  }

  public Grammar copy() {
    return new Grammar(this);
  }

  /** Set of nonterminals */
  private final Set<String> _nts = new LinkedHashSet<String>();
  /** Set of terminals */
  private final Set<String> _ts = new LinkedHashSet<String>();
  /** Production bodies indexed by their head */
  private final Map<String,Set<List<String>>> _productions = new LinkedHashMap<String,Set<List<String>>>();
  private String _start = null;

  public boolean registerNT(String nt) {
    if (nt == null)
      throw new NullPointerException("Nonterminal may not be null");
    return _nts.add(nt);
  }
  public boolean registerT(String t) {
    if (t == null)
      throw new NullPointerException("Terminal may not be null");
    return _ts.add(t);
  }
  /** Designates the start symbol, registering it as a nonterminal if new */
  public void registerS(String s) {
    registerNT(s);
    _start = s;
  }

  /**
   * Makes <code>head</code> a key of the production mapping, with no bodies
   * if it had none, and registers it as a nonterminal.
   */
  public void registerHead(String head) {
    registerNT(head);
    if (!_productions.containsKey(head))
      _productions.put(head, new LinkedHashSet<List<String>>());
  }

  /**
   * Inserts <code>body</code> into the body set of <code>head</code>.
   * The head is registered as a nonterminal if it is new.
   * @return false if the production was already present
   */
  public boolean addProduction(String head, List<String> body) {
    if (body == null)
      throw new NullPointerException("Production body may not be null");
    registerHead(head);
    List<String> copy = Collections.unmodifiableList(new ArrayList<String>(body));
    return _productions.get(head).add(copy);
  }
  public boolean addProduction(String head, String... body) {
    return addProduction(head, Arrays.asList(body));
  }
  public boolean addProduction(Rule r) {
    return addProduction(r.lhs(), r.rhs());
  }

  public Set<String> nts() {
    return Collections.unmodifiableSet(_nts);
  }
  public Set<String> ts() {
    return Collections.unmodifiableSet(_ts);
  }
  public String Start() {
    return _start;
  }
  public Set<String> heads() {
    return Collections.unmodifiableSet(_productions.keySet());
  }
  public boolean hasProductions(String head) {
    return _productions.containsKey(head);
  }
  /** Bodies of <code>head</code>, empty if it has no productions */
  public Set<List<String>> productions(String head) {
    Set<List<String>> bodies = _productions.get(head);
    if (bodies == null)
      return Collections.emptySet();
    return Collections.unmodifiableSet(bodies);
  }
  public boolean isNonterminal(String s) {
    return _nts.contains(s);
  }
  public boolean isTerminal(String s) {
    return _ts.contains(s);
  }

  /** All productions flattened into rules, in head and body insertion order */
  public Vector<Rule> rules() {
    Vector<Rule> rules = new Vector<Rule>();
    for (Map.Entry<String,Set<List<String>>> e : _productions.entrySet())
      for (List<String> body : e.getValue())
        rules.add(new Rule(e.getKey(), body));
    return rules;
  }

  /** Number of productions */
  public int size() {
    int n = 0;
    for (Set<List<String>> bodies : _productions.values())
      n += bodies.size();
    return n;
  }

  /**
   * Chomsky normal form predicate: every body is two nonterminals, a single
   * terminal, or empty on the start symbol only.
   */
  public boolean isCnf() {
    return firstNonCnfRule() == null;
  }

  /** The first production violating CNF, or null if there is none */
  public Rule firstNonCnfRule() {
    for (Map.Entry<String,Set<List<String>>> e : _productions.entrySet()) {
      String head = e.getKey();
      for (List<String> body : e.getValue()) {
        boolean ok;
        switch (body.size()) {
        case 0:
          ok = head.equals(_start);
          break;
        case 1:
          ok = _ts.contains(body.get(0));
          break;
        case 2:
          ok = _nts.contains(body.get(0)) && _nts.contains(body.get(1));
          break;
        default:
          ok = false;
        }
        if (!ok)
          return new Rule(head, body);
      }
    }
    return null;
  }

  /**
   * Textual form of the grammar, in the format read by {@link GrammarReader}.
   * Symbols, heads and bodies are sorted so that equal grammars print
   * identically.
   */
  public List<String> toLines() {
    List<String> lines = new ArrayList<String>();
    lines.add("Variables: " + StringUtils.join(CollectionUtils.sort(_nts), ", "));
    lines.add("Terminals: " + StringUtils.join(CollectionUtils.sort(_ts), ", "));
    lines.add("Start: " + _start);
    lines.add("Rules:");
    for (String head : CollectionUtils.sort(_productions.keySet())) {
      List<String> alternatives = new ArrayList<String>();
      List<List<String>> bodies = CollectionUtils.sort(_productions.get(head),
          CollectionUtils.<String>lengthFirstComparator());
      for (List<String> body : bodies) {
        if (body.isEmpty())
          alternatives.add(EPSILON);
        else
          alternatives.add(StringUtils.join(body, " "));
      }
      lines.add("  " + head + " -> " + StringUtils.join(alternatives, " | "));
    }
    return lines;
  }

  public void dumpGrammar(Writer w) throws IOException {
    for (String line : toLines()) {
      w.write(line);
      w.write("\n");
    }
    w.flush();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Grammar))
      return false;
    Grammar that = (Grammar)o;
    return _nts.equals(that._nts) && _ts.equals(that._ts) &&
        (_start == null ? that._start == null : _start.equals(that._start)) &&
        _productions.equals(that._productions);
  }

  @Override
  public int hashCode() {
    int result = _nts.hashCode();
    result = 31 * result + _ts.hashCode();
    result = 31 * result + (_start == null ? 0 : _start.hashCode());
    result = 31 * result + _productions.hashCode();
    return result;
  }

  public String toString() {
    return StringUtils.join(toLines(), "\n");
  }

}
