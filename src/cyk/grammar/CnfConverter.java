package cyk.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import cyk.syntax.Grammar;
import cyk.syntax.Rule;
import cyk.util.StringUtils;

/** Conversion of an arbitrary CFG into Chomsky normal form.
 * <p>
 * Six stages run in a fixed order, each one relying on what the previous
 * ones established:
 * <ol>
 * <li>{@link StartSymbolIsolator} - new start symbol S0 -&gt; S</li>
 * <li>{@link UselessSymbolRemover} - drop unproductive and unreachable symbols</li>
 * <li>{@link EpsilonRemover} - drop A -&gt; ε, except on the start symbol</li>
 * <li>{@link UnitRuleRemover} - drop A -&gt; B</li>
 * <li>{@link Preterminalizer} - terminals in long bodies get their own T_x -&gt; x</li>
 * <li>{@link Binarizer} - A -&gt; B C D becomes A -&gt; B X1, X1 -&gt; C D</li>
 * </ol>
 *
 */
public class CnfConverter {

  private static final Logger LOGGER = Logger.getLogger("CnfConverter");

  public CnfConverter() {

  }

  /** The stages in the order they have to run */
  public static List<GrammarTransformer> pipeline() {
    return Arrays.<GrammarTransformer>asList(
        new StartSymbolIsolator(),
        new UselessSymbolRemover(),
        new EpsilonRemover(),
        new UnitRuleRemover(),
        new Preterminalizer(),
        new Binarizer());
  }

  public static Grammar convert(Grammar grammar) {
    Grammar g = grammar.copy();
    if (LOGGER.isLoggable(Level.FINE))
      LOGGER.fine("Input grammar: " + g.size() + " rules, " + g.nts().size() + " nonterminals");
    for (GrammarTransformer stage : pipeline()) {
      g = stage.transformGrammar(g);
      if (LOGGER.isLoggable(Level.FINE))
        LOGGER.fine(stage.getClass().getSimpleName() + ": " + g.size() + " rules, " +
            g.nts().size() + " nonterminals");
    }
    return g;
  }

  /** Introduces a fresh start symbol S0 -&gt; S that no body refers to */
  public static class StartSymbolIsolator implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Grammar out = g.copy();
      String original = out.Start();
      String start = FreshSymbols.fresh(out, "S0");
      out.registerS(start);
      out.addProduction(start, original);
      return out;
    }
  }

  /**
   * Keeps the productions whose head is productive and reachable from the
   * start symbol and whose body only uses terminals and such heads.
   * The start symbol always stays a head, possibly without bodies.
   */
  public static class UselessSymbolRemover implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Set<String> productive = productive(g);

      Map<String,List<List<String>>> filtered = new LinkedHashMap<String,List<List<String>>>();
      for (String head : g.heads()) {
        if (!productive.contains(head))
          continue;
        List<List<String>> bodies = new ArrayList<List<String>>();
        for (List<String> body : g.productions(head)) {
          if (allIn(body, g.ts(), productive))
            bodies.add(body);
        }
        if (!bodies.isEmpty())
          filtered.put(head, bodies);
      }

      Set<String> reachable = new LinkedHashSet<String>();
      Deque<String> frontier = new ArrayDeque<String>();
      reachable.add(g.Start());
      frontier.push(g.Start());
      while (!frontier.isEmpty()) {
        String current = frontier.pop();
        List<List<String>> bodies = filtered.get(current);
        if (bodies == null)
          continue;
        for (List<String> body : bodies) {
          for (String s : body) {
            if (filtered.containsKey(s) && reachable.add(s))
              frontier.push(s);
          }
        }
      }

      Grammar out = new Grammar();
      out.registerS(g.Start());
      out.registerHead(g.Start());
      for (Map.Entry<String,List<List<String>>> e : filtered.entrySet()) {
        if (!reachable.contains(e.getKey()))
          continue;
        for (List<String> body : e.getValue())
          out.addProduction(e.getKey(), body);
      }
      registerUsedTerminals(out);
      return out;
    }

    /**
     * Nonterminals deriving some terminal string. Each production keeps a
     * count of body symbols not yet known to be productive; a head becomes
     * productive when one of its counts drops to zero.
     */
    public static Set<String> productive(Grammar g) {
      Set<String> productive = new LinkedHashSet<String>();
      Map<Rule,Integer> pending = new HashMap<Rule,Integer>();
      Map<String,List<Rule>> occurrences = new HashMap<String,List<Rule>>();
      Deque<String> queue = new ArrayDeque<String>();
      for (Rule r : g.rules()) {
        int count = 0;
        for (String s : r.rhs()) {
          if (g.isTerminal(s))
            continue;
          count ++;
          List<Rule> occ = occurrences.get(s);
          if (occ == null) {
            occ = new ArrayList<Rule>();
            occurrences.put(s, occ);
          }
          occ.add(r);
        }
        if (count == 0) {
          if (productive.add(r.lhs()))
            queue.add(r.lhs());
        } else {
          pending.put(r, count);
        }
      }
      while (!queue.isEmpty()) {
        String s = queue.poll();
        List<Rule> occ = occurrences.get(s);
        if (occ == null)
          continue;
        for (Rule r : occ) {
          int left = pending.get(r) - 1;
          pending.put(r, left);
          if (left == 0 && productive.add(r.lhs()))
            queue.add(r.lhs());
        }
      }
      return productive;
    }

    private static boolean allIn(List<String> body, Set<String> ts, Set<String> nts) {
      for (String s : body) {
        if (!ts.contains(s) && !nts.contains(s))
          return false;
      }
      return true;
    }
  }

  /**
   * Removes epsilon productions. Every body is expanded into all variants
   * with any subset of its nullable symbols deleted; an empty variant
   * survives only on the start symbol.
   * <p>
   * Subsets are enumerated with a <code>long</code> mask, so a body may hold
   * at most 62 nullable occurrences. Longer ones are rejected with an
   * {@link IllegalArgumentException}.
   */
  public static class EpsilonRemover implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Set<String> nullable = nullable(g);
      String start = g.Start();
      Grammar out = new Grammar();
      out.registerS(start);
      for (String head : g.heads())
        out.registerHead(head);

      for (Rule r : g.rules()) {
        if (r.isEpsilon())
          continue;
        List<String> body = r.rhs();
        List<Integer> positions = new ArrayList<Integer>();
        for (int i = 0; i < body.size(); i ++) {
          if (nullable.contains(body.get(i)))
            positions.add(i);
        }
        int k = positions.size();
        if (k >= 63)
          throw new IllegalArgumentException("Too many nullable symbols in " + r);
        for (long mask = 0; mask < (1L << k); mask ++) {
          Set<Integer> skip = new LinkedHashSet<Integer>();
          for (int p = 0; p < k; p ++) {
            if (((mask >> p) & 1L) != 0)
              skip.add(positions.get(p));
          }
          List<String> variant = new ArrayList<String>(body.size() - skip.size());
          for (int i = 0; i < body.size(); i ++) {
            if (!skip.contains(i))
              variant.add(body.get(i));
          }
          if (!variant.isEmpty())
            out.addProduction(r.lhs(), variant);
          else if (r.lhs().equals(start))
            out.addProduction(start, variant);
        }
      }
      if (nullable.contains(start))
        out.addProduction(start);
      registerUsedTerminals(out);
      return out;
    }

    /**
     * Nonterminals deriving the empty string: heads with an empty body, or
     * with a body made of nullable symbols only. Bodies containing a
     * terminal never qualify.
     */
    public static Set<String> nullable(Grammar g) {
      Set<String> nullable = new LinkedHashSet<String>();
      Map<Rule,Integer> pending = new HashMap<Rule,Integer>();
      Map<String,List<Rule>> occurrences = new HashMap<String,List<Rule>>();
      Deque<String> queue = new ArrayDeque<String>();
      for (Rule r : g.rules()) {
        boolean candidate = true;
        for (String s : r.rhs()) {
          if (g.isTerminal(s)) {
            candidate = false;
            break;
          }
        }
        if (!candidate)
          continue;
        if (r.isEpsilon()) {
          if (nullable.add(r.lhs()))
            queue.add(r.lhs());
          continue;
        }
        pending.put(r, r.arity());
        for (String s : r.rhs()) {
          List<Rule> occ = occurrences.get(s);
          if (occ == null) {
            occ = new ArrayList<Rule>();
            occurrences.put(s, occ);
          }
          occ.add(r);
        }
      }
      while (!queue.isEmpty()) {
        String s = queue.poll();
        List<Rule> occ = occurrences.get(s);
        if (occ == null)
          continue;
        for (Rule r : occ) {
          int left = pending.get(r) - 1;
          pending.put(r, left);
          if (left == 0 && nullable.add(r.lhs()))
            queue.add(r.lhs());
        }
      }
      return nullable;
    }
  }

  /**
   * Replaces the bodies of every head by the non-unit bodies of all heads
   * in its unit closure (itself included).
   */
  public static class UnitRuleRemover implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Grammar out = new Grammar();
      out.registerS(g.Start());
      for (String head : g.heads())
        out.registerHead(head);
      for (String head : g.heads()) {
        for (String target : unitClosure(g, head)) {
          for (List<String> body : g.productions(target)) {
            if (!isUnit(g, body))
              out.addProduction(head, body);
          }
        }
      }
      registerUsedTerminals(out);
      return out;
    }

    /** Heads reachable from <code>head</code> through unit productions, <code>head</code> first */
    public static Set<String> unitClosure(Grammar g, String head) {
      Set<String> reachable = new LinkedHashSet<String>();
      Deque<String> stack = new ArrayDeque<String>();
      reachable.add(head);
      stack.push(head);
      while (!stack.isEmpty()) {
        String current = stack.pop();
        for (List<String> body : g.productions(current)) {
          if (isUnit(g, body) && reachable.add(body.get(0)))
            stack.push(body.get(0));
        }
      }
      return reachable;
    }

    static boolean isUnit(Grammar g, List<String> body) {
      return body.size() == 1 && g.hasProductions(body.get(0));
    }
  }

  /**
   * Replaces every terminal inside a body of length &gt; 1 by a dedicated
   * nonterminal T_&lt;slug&gt; with the single production T_&lt;slug&gt; -&gt; terminal.
   * The same nonterminal is reused for all occurrences of a terminal.
   */
  public static class Preterminalizer implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Grammar out = skeleton(g);
      Map<String,String> pts = new LinkedHashMap<String,String>();
      for (Rule r : g.rules()) {
        if (r.arity() <= 1) {
          out.addProduction(r);
          continue;
        }
        List<String> replaced = new ArrayList<String>(r.arity());
        for (String s : r.rhs()) {
          if (!g.isTerminal(s)) {
            replaced.add(s);
            continue;
          }
          String pt = pts.get(s);
          if (pt == null) {
            pt = FreshSymbols.fresh(out, "T_" + StringUtils.slug(s));
            out.addProduction(pt, s);
            pts.put(s, pt);
          }
          replaced.add(pt);
        }
        out.addProduction(r.lhs(), replaced);
      }
      return out;
    }
  }

  /** Splits bodies longer than two into chains over fresh X1, X2, ... */
  public static class Binarizer implements GrammarTransformer {
    public Grammar transformGrammar(Grammar g) {
      Grammar out = skeleton(g);
      FreshSymbols.Counter counter = new FreshSymbols.Counter("X");
      for (Rule r : g.rules()) {
        if (r.arity() <= 2) {
          out.addProduction(r);
          continue;
        }
        List<String> body = r.rhs();
        String current = r.lhs();
        String left = body.get(0);
        for (int j = 1; j < body.size() - 1; j ++) {
          String x = counter.next(out);
          out.registerHead(x);
          out.addProduction(current, left, x);
          left = body.get(j);
          current = x;
        }
        out.addProduction(current, left, body.get(body.size() - 1));
      }
      return out;
    }
  }

  /** Same symbols, start and heads as <code>g</code>, but no bodies */
  private static Grammar skeleton(Grammar g) {
    Grammar out = new Grammar();
    out.registerS(g.Start());
    for (String nt : g.nts())
      out.registerNT(nt);
    for (String t : g.ts())
      out.registerT(t);
    for (String head : g.heads())
      out.registerHead(head);
    return out;
  }

  /** Registers every body symbol that is not a head as terminal */
  private static void registerUsedTerminals(Grammar g) {
    for (Rule r : g.rules()) {
      for (String s : r.rhs()) {
        if (!g.hasProductions(s))
          g.registerT(s);
      }
    }
  }

}
