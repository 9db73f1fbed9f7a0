package cyk.grammar;

import cyk.syntax.Grammar;

/**
 * One stage of a grammar rewriting pipeline. Implementations never modify
 * their argument and return an independent grammar.
 */
public interface GrammarTransformer {
  public Grammar transformGrammar(Grammar g);
}
