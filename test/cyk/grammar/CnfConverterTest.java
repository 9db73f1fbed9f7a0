package cyk.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import cyk.syntax.Grammar;
import cyk.syntax.GrammarReader;
import cyk.syntax.ParseResult;
import cyk.syntax.ParseTree;
import cyk.syntax.Parser;
import cyk.syntax.Rule;

class CnfConverterTest {

  interface Language {
    boolean contains(List<String> tokens);
  }

  static final Language ANBN = new Language() {
    public boolean contains(List<String> tokens) {
      int n = tokens.size();
      if (n % 2 != 0)
        return false;
      for (int i = 0; i < n; i ++) {
        if (!tokens.get(i).equals(i < n / 2 ? "a" : "b"))
          return false;
      }
      return true;
    }
  };

  static final Language BALANCED = new Language() {
    public boolean contains(List<String> tokens) {
      int depth = 0;
      for (String t : tokens) {
        depth += t.equals("(") ? 1 : -1;
        if (depth < 0)
          return false;
      }
      return depth == 0;
    }
  };

  static Grammar anbn() {
    Grammar g = new Grammar(Collections.singletonList("S"), Arrays.asList("a", "b"), "S");
    g.addProduction("S", "a", "S", "b");
    g.addProduction("S");
    return g;
  }

  static Grammar balanced() {
    Grammar g = new Grammar(Collections.singletonList("S"), Arrays.asList("(", ")"), "S");
    g.addProduction("S", "(", "S", ")", "S");
    g.addProduction("S");
    return g;
  }

  static List<List<String>> allStrings(List<String> alphabet, int maxlen) {
    List<List<String>> result = new ArrayList<List<String>>();
    List<List<String>> layer = new ArrayList<List<String>>();
    layer.add(Collections.<String>emptyList());
    result.addAll(layer);
    for (int len = 1; len <= maxlen; len ++) {
      List<List<String>> next = new ArrayList<List<String>>();
      for (List<String> prefix : layer) {
        for (String symbol : alphabet) {
          List<String> s = new ArrayList<String>(prefix);
          s.add(symbol);
          next.add(s);
        }
      }
      result.addAll(next);
      layer = next;
    }
    return result;
  }

  static void assertDecides(Grammar cnf, Language language, List<String> alphabet, int maxlen) {
    Parser parser = new Parser(cnf);
    for (List<String> tokens : allStrings(alphabet, maxlen)) {
      ParseResult result = parser.parse(tokens);
      assertEquals(language.contains(tokens), result.accepted(), tokens.toString());
      if (result.accepted() && !tokens.isEmpty()) {
        assertEquals(tokens, result.tree().getYield());
        assertConforms(cnf, result.tree());
      }
    }
  }

  static void assertConforms(Grammar g, ParseTree tree) {
    List<String> body = new ArrayList<String>();
    if (tree.isLeaf()) {
      body.add(((ParseTree.Leaf)tree).getToken());
    } else {
      for (ParseTree child : tree.getChildren()) {
        body.add(child.getLabel());
        assertConforms(g, child);
      }
    }
    assertTrue(g.productions(tree.getLabel()).contains(body), tree.getLabel() + " -> " + body);
  }

  /** Start symbol not on any right-hand side, ε only on the start symbol */
  static void assertCnf(Grammar g) {
    assertTrue(g.isCnf(), String.valueOf(g.firstNonCnfRule()));
    for (Rule r : g.rules()) {
      assertFalse(r.rhs().contains(g.Start()), r.toString());
      if (r.isEpsilon())
        assertEquals(g.Start(), r.lhs());
    }
  }

  @Test
  void startSymbolIsolation() {
    Grammar g = new CnfConverter.StartSymbolIsolator().transformGrammar(anbn());
    assertEquals("S0", g.Start());
    assertEquals(Collections.singleton(Collections.singletonList("S")), g.productions("S0"));
    assertEquals(2, g.productions("S").size());
  }

  @Test
  void freshStartAvoidsTakenNames() {
    Grammar g = new Grammar(Arrays.asList("S", "S0"), Arrays.asList("a", "S01"), "S");
    g.addProduction("S", "S0", "S01");
    g.addProduction("S0", "a");
    Grammar out = new CnfConverter.StartSymbolIsolator().transformGrammar(g);
    assertEquals("S02", out.Start());
  }

  @Test
  void uselessSymbols() {
    Grammar g = new Grammar(Arrays.asList("S", "A", "B", "C"), Arrays.asList("a", "b", "c"), "S");
    g.addProduction("S", "A", "B");
    g.addProduction("S", "a");
    g.addProduction("A", "a");
    g.addProduction("B", "B", "b");
    g.addProduction("C", "c");

    assertEquals(new HashSet<String>(Arrays.asList("S", "A", "C")),
        CnfConverter.UselessSymbolRemover.productive(g));

    Grammar out = new CnfConverter.UselessSymbolRemover().transformGrammar(g);
    assertEquals(Collections.singleton("S"), out.heads());
    assertEquals(Collections.singleton(Collections.singletonList("a")), out.productions("S"));
    assertEquals(Collections.singleton("a"), out.ts());
  }

  @Test
  void emptyLanguage() {
    Grammar g = new Grammar(Collections.singletonList("S"), Collections.singletonList("a"), "S");
    g.addProduction("S", "S", "a");
    Grammar cnf = CnfConverter.convert(g);
    assertCnf(cnf);
    assertEquals(0, cnf.size());
    assertTrue(cnf.heads().contains(cnf.Start()));
    assertDecides(cnf, new Language() {
      public boolean contains(List<String> tokens) {
        return false;
      }
    }, Collections.singletonList("a"), 4);
  }

  @Test
  void nullableSymbols() {
    Grammar g = new Grammar(Arrays.asList("S", "A", "B", "C"), Arrays.asList("a", "b"), "S");
    g.addProduction("S", "A", "B");
    g.addProduction("A", "a");
    g.addProduction("A");
    g.addProduction("B", "b");
    g.addProduction("B");
    g.addProduction("C", "a", "A");
    assertEquals(new HashSet<String>(Arrays.asList("S", "A", "B")),
        CnfConverter.EpsilonRemover.nullable(g));

    Grammar out = new CnfConverter.EpsilonRemover().transformGrammar(g);
    assertEquals(new HashSet<List<String>>(Arrays.asList(
        Arrays.asList("A", "B"), Arrays.asList("A"), Arrays.asList("B"),
        Collections.<String>emptyList())), out.productions("S"));
    assertEquals(Collections.singleton(Arrays.asList("a")), out.productions("A"));
    assertEquals(new HashSet<List<String>>(Arrays.asList(Arrays.asList("a", "A"), Arrays.asList("a"))),
        out.productions("C"));
  }

  @Test
  void unitCycles() {
    Grammar g = new Grammar(Arrays.asList("S", "A", "B"), Arrays.asList("a", "b"), "S");
    g.addProduction("S", "A");
    g.addProduction("A", "B");
    g.addProduction("A", "a");
    g.addProduction("B", "A");
    g.addProduction("B", "b");
    assertEquals(new HashSet<String>(Arrays.asList("S", "A", "B")),
        CnfConverter.UnitRuleRemover.unitClosure(g, "S"));

    Grammar out = new CnfConverter.UnitRuleRemover().transformGrammar(g);
    HashSet<List<String>> ab = new HashSet<List<String>>(Arrays.asList(Arrays.asList("a"), Arrays.asList("b")));
    assertEquals(ab, out.productions("S"));
    assertEquals(ab, out.productions("A"));
    assertEquals(ab, out.productions("B"));
  }

  @Test
  void terminalsInLongBodiesGetPreterminals() {
    Grammar g = new Grammar(Arrays.asList("E", "T_a"), Arrays.asList("a", "+", "(", ")"), "E");
    g.addProduction("E", "E", "+", "E");
    g.addProduction("E", "(", "E", ")");
    g.addProduction("E", "a", "E");
    g.addProduction("E", "a");
    g.addProduction("T_a", "a");

    Grammar out = new CnfConverter.Preterminalizer().transformGrammar(g);
    assertTrue(out.productions("E").contains(Arrays.asList("E", "T__", "E")));
    assertTrue(out.productions("E").contains(Arrays.asList("T__1", "E", "T__2")));
    assertTrue(out.productions("E").contains(Arrays.asList("T_a1", "E")));
    assertTrue(out.productions("E").contains(Arrays.asList("a")));
    assertEquals(Collections.singleton(Arrays.asList("+")), out.productions("T__"));
    assertEquals(Collections.singleton(Arrays.asList("(")), out.productions("T__1"));
    assertEquals(Collections.singleton(Arrays.asList("a")), out.productions("T_a1"));
  }

  @Test
  void longBodiesAreChained() {
    Grammar g = new Grammar(Arrays.asList("S", "A", "B", "C", "D", "X1"), Arrays.asList("a"), "S");
    g.addProduction("S", "A", "B", "C", "D");
    g.addProduction("S", "A", "B", "C");
    for (String nt : Arrays.asList("A", "B", "C", "D", "X1"))
      g.addProduction(nt, "a");

    Grammar out = new CnfConverter.Binarizer().transformGrammar(g);
    assertEquals(new HashSet<List<String>>(Arrays.asList(Arrays.asList("A", "X2"), Arrays.asList("A", "X4"))),
        out.productions("S"));
    assertEquals(Collections.singleton(Arrays.asList("B", "X3")), out.productions("X2"));
    assertEquals(Collections.singleton(Arrays.asList("C", "D")), out.productions("X3"));
    assertEquals(Collections.singleton(Arrays.asList("B", "C")), out.productions("X4"));
    assertEquals(Collections.singleton(Arrays.asList("a")), out.productions("X1"));
  }

  @Test
  void anbnPipeline() {
    Grammar cnf = CnfConverter.convert(anbn());
    assertCnf(cnf);
    assertEquals("S0", cnf.Start());
    assertDecides(cnf, ANBN, Arrays.asList("a", "b"), 8);
  }

  @Test
  void balancedParenthesesPipeline() {
    Grammar cnf = CnfConverter.convert(balanced());
    assertCnf(cnf);
    assertDecides(cnf, BALANCED, Arrays.asList("(", ")"), 8);
  }

  @Test
  void arithmeticExpressions() throws Exception {
    Grammar g = GrammarReader.parseGrammar(
        "Variables: E, T, F\n" +
        "Terminals: +, *, (, ), id\n" +
        "Start: E\n" +
        "Rules:\n" +
        "E -> E + T | T\n" +
        "T -> T * F | F\n" +
        "F -> ( E ) | id\n");
    Grammar cnf = CnfConverter.convert(g);
    assertCnf(cnf);
    Parser parser = new Parser(cnf);
    List<String> tokens = Parser.tokenize("id + id * ( id + id )", false);
    ParseResult result = parser.parse(tokens);
    assertTrue(result.accepted());
    assertEquals(tokens, result.tree().getYield());
    assertConforms(cnf, result.tree());
    assertEquals(cnf.Start(), result.tree().getLabel());

    assertTrue(parser.parse(Arrays.asList("id")).accepted());
    assertFalse(parser.parse(Arrays.asList("id", "+")).accepted());
    assertFalse(parser.parse(Arrays.asList("(", "id")).accepted());
    assertFalse(parser.parse(Collections.<String>emptyList()).accepted());
  }

  @Test
  void conversionIsIdempotentOnTheLanguage() {
    Grammar once = CnfConverter.convert(balanced());
    Grammar twice = CnfConverter.convert(once);
    assertCnf(twice);
    assertDecides(twice, BALANCED, Arrays.asList("(", ")"), 6);
  }

  @Test
  void inputIsLeftUntouched() {
    Grammar g = balanced();
    Grammar before = g.copy();
    CnfConverter.convert(g);
    assertEquals(before, g);
  }

  @Test
  void cnfInputKeepsItsShape() {
    Grammar g = new Grammar(Arrays.asList("S", "N", "V"), Arrays.asList("dog", "barks"), "S");
    g.addProduction("S", "N", "V");
    g.addProduction("N", "dog");
    g.addProduction("V", "barks");
    Grammar cnf = CnfConverter.convert(g);
    assertCnf(cnf);
    ParseTree tree = Parser.parse(cnf, Arrays.asList("dog", "barks")).tree();
    assertEquals(new ParseTree.Internal("S0",
        new ParseTree.Leaf("N", "dog"), new ParseTree.Leaf("V", "barks")), tree);
  }

  @Test
  void tooManyNullableOccurrencesAreRejected() {
    Grammar g = new Grammar(Arrays.asList("S", "A"), Collections.singletonList("a"), "S");
    g.addProduction("A", "a");
    g.addProduction("A");
    g.addProduction("S", Collections.nCopies(63, "A"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new CnfConverter.EpsilonRemover().transformGrammar(g));
    assertTrue(ex.getMessage().startsWith("Too many nullable symbols"));
  }

}
