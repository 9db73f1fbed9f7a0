package cyk.syntax;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import cyk.util.StringUtils;

/**
 * Reads a grammar from its textual description:
 * <pre>
 * # comment
 * Variables: S, A
 * Terminals: a, b
 * Start: S
 * Rules:
 * S -&gt; A b | ε
 * A -&gt; a | "two words"
 * </pre>
 *
 */
public class GrammarReader {

  private static final Pattern HEADER = Pattern.compile("^(Variables|Terminals|Start|Rules):");
  private static final Pattern QUOTED = Pattern.compile("(\"([^\"\\\\]|\\\\.)*\"|'([^'\\\\]|\\\\.)*')");

  public static Grammar readGrammar(String filename) throws IOException, ParserException {
    BufferedReader br = new BufferedReader(new InputStreamReader(
        new FileInputStream(filename), StandardCharsets.UTF_8));
    try {
      return readGrammar(br);
    } finally {
      br.close();
    }
  }

  public static Grammar parseGrammar(String text) throws ParserException {
    try {
      return readGrammar(new StringReader(text));
    } catch (IOException ex) {
      // StringReader does not fail
      throw new IllegalStateException(ex);
    }
  }

  public static Grammar readGrammar(Reader in) throws IOException, ParserException {
    BufferedReader br = (in instanceof BufferedReader) ? (BufferedReader)in : new BufferedReader(in);
    List<String> lines = new ArrayList<String>();
    String line = null;
    while ((line = br.readLine()) != null) {
      line = line.trim();
      if (line.isEmpty() || line.startsWith("#"))
        continue;
      lines.add(line);
    }
    if (lines.isEmpty())
      throw new ParserException("The grammar is empty");

    // headers
    Map<String,String> header = new HashMap<String,String>();
    int rulesStart = -1;
    for (int i = 0; i < lines.size(); i ++) {
      Matcher m = HEADER.matcher(lines.get(i));
      if (!m.find())
        throw new ParserException("Expected a header line (Variables/Terminals/Start/Rules): " + lines.get(i));
      String key = m.group(1);
      if (key.equals("Rules")) {
        header.put(key, "");
        rulesStart = i + 1;
        break;
      }
      header.put(key, lines.get(i).substring(lines.get(i).indexOf(':') + 1).trim());
    }
    if (!header.containsKey("Rules"))
      throw new ParserException("Missing 'Rules:' section");
    if (!header.containsKey("Variables") || !header.containsKey("Terminals") || !header.containsKey("Start"))
      throw new ParserException("The Variables, Terminals and Start headers are mandatory");

    Set<String> variables = new LinkedHashSet<String>(splitList(header.get("Variables")));
    Set<String> terminals = new LinkedHashSet<String>(splitList(header.get("Terminals")));
    String start = header.get("Start").trim();
    if (!variables.contains(start))
      throw new ParserException("Start symbol '" + start + "' is not a declared variable");
    for (String t : terminals)
      if (variables.contains(t))
        throw new ParserException("'" + t + "' is declared both as variable and terminal");

    List<String> rules = lines.subList(rulesStart, lines.size());
    if (rules.isEmpty())
      throw new ParserException("The rule section is empty");

    Grammar g = new Grammar(variables, terminals, start);
    for (String raw : rules) {
      int arrow = raw.indexOf("->");
      if (arrow < 0)
        throw new ParserException("Invalid rule: '" + raw + "'");
      String lhs = raw.substring(0, arrow).trim();
      String rhs = raw.substring(arrow + 2).trim();
      if (!variables.contains(lhs))
        throw new ParserException("'" + lhs + "' is not a declared variable");
      List<String> alternatives = new ArrayList<String>();
      for (String alt : rhs.split("\\|")) {
        if (!alt.trim().isEmpty())
          alternatives.add(alt.trim());
      }
      if (alternatives.isEmpty())
        throw new ParserException("Rule without alternatives for '" + lhs + "'");
      for (String alt : alternatives) {
        if (isEpsilon(alt)) {
          g.addProduction(lhs);
          continue;
        }
        List<String> body = splitSymbols(alt);
        for (String s : body) {
          if (!variables.contains(s) && !terminals.contains(s))
            throw new ParserException("Undeclared symbol '" + s + "' in rule for '" + lhs + "'");
        }
        g.addProduction(lhs, body);
      }
    }
    return g;
  }

  public static boolean isEpsilon(String alt) {
    return alt.equals(Grammar.EPSILON) || alt.equals("epsilon") || alt.equals("EPSILON");
  }

  /** Comma separated symbol list, quoted items are unquoted */
  static List<String> splitList(String text) {
    List<String> tokens = new ArrayList<String>();
    for (String chunk : text.split(",")) {
      String token = chunk.trim();
      if (token.isEmpty())
        continue;
      tokens.add(StringUtils.unquote(token));
    }
    return tokens;
  }

  /** Whitespace separated symbols; quoted symbols may contain whitespace */
  static List<String> splitSymbols(String text) throws ParserException {
    List<String> tokens = new ArrayList<String>();
    int i = 0;
    int length = text.length();
    while (i < length) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i ++;
        continue;
      }
      if (c == '"' || c == '\'') {
        Matcher m = QUOTED.matcher(text);
        m.region(i, length);
        if (!m.lookingAt())
          throw new ParserException("Unterminated quoted symbol in: " + text.substring(i));
        tokens.add(StringUtils.unquote(m.group()));
        i = m.end();
      } else {
        int j = i;
        while (j < length && !Character.isWhitespace(text.charAt(j)))
          j ++;
        tokens.add(text.substring(i, j));
        i = j;
      }
    }
    return tokens;
  }

}
