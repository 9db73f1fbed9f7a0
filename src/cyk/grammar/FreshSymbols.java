package cyk.grammar;

import cyk.syntax.Grammar;

/**
 * Generates symbol names unused by a grammar, neither as nonterminal nor as
 * terminal.
 */
public final class FreshSymbols {

  private FreshSymbols() {}

  /** <code>base</code> if it is free, otherwise the first free of base1, base2, ... */
  public static String fresh(Grammar g, String base) {
    if (isFree(g, base))
      return base;
    int index = 1;
    while (!isFree(g, base + index))
      index ++;
    return base + index;
  }

  public static boolean isFree(Grammar g, String name) {
    return !g.isNonterminal(name) && !g.isTerminal(name);
  }

  /**
   * Hands out prefix1, prefix2, ... skipping names already used by the
   * grammar. The numbering never goes back, so two names from the same
   * counter never collide even before they are registered.
   */
  public static class Counter {

    public Counter(String prefix) {
      _prefix = prefix;
    }

    public String next(Grammar g) {
      while (true) {
        String candidate = _prefix + _next;
        _next ++;
        if (isFree(g, candidate))
          return candidate;
      }
    }

    private final String _prefix;
    private int _next = 1;
  }

}
