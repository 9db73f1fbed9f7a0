package cyk.grammar;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import cyk.syntax.Grammar;
import cyk.syntax.GrammarReader;
import cyk.syntax.ParseResult;
import cyk.syntax.ParseTree;
import cyk.syntax.Parser;
import cyk.syntax.ParserException;
import cyk.treebank.Trees;
import cyk.util.Logging;
import cyk.util.StringUtils;

/** Converts a CFG to CNF and decides with CYK whether a sentence belongs to
 * its language, printing the parse tree when it does.
 *
 */
public class CnfCykTool {

  public static final String USAGE = "CnfCykTool [options] <grammar file> [sentence | tokens ...]";
  /** longest base name of generated tree files */
  public static final int MAX_FILENAME = 50;

  public static Options options() {
    Options options = new Options();
    options.addOption("h", "help", false, "print this message");
    options.addOption("v", false, "verbose mode");
    Option cnfout = OptionBuilder.withLongOpt("cnf-output").withArgName("file").hasArg()
        .withDescription("write the CNF grammar to the given file").create("o");
    options.addOption(cnfout);
    options.addOption(OptionBuilder.withLongOpt("show-cnf")
        .withDescription("print the CNF grammar").create());
    options.addOption(OptionBuilder.withLongOpt("lowercase")
        .withDescription("lower-case the sentence before tokenizing").create());
    options.addOption(OptionBuilder.withLongOpt("tokens")
        .withDescription("take the remaining arguments as tokens, verbatim").create());
    options.addOption(OptionBuilder.withLongOpt("tree-dot")
        .withDescription("write the parse tree of an accepted sentence as Graphviz DOT").create());
    options.addOption(OptionBuilder.withLongOpt("tree-png")
        .withDescription("render the parse tree of an accepted sentence as PNG with Graphviz").create());
    options.addOption(OptionBuilder.withLongOpt("dot").withArgName("command").hasArg()
        .withDescription("Graphviz executable used by --tree-png (default: dot)").create());
    options.addOption(OptionBuilder.withLongOpt("no-tree")
        .withDescription("do not write any tree file").create());
    options.addOption(OptionBuilder.withLongOpt("no-color")
        .withDescription("black and white DOT output").create());
    Option outdir = OptionBuilder.withLongOpt("output-dir").withArgName("dir").hasArg()
        .withDescription("directory for tree files (default: current directory)").create("d");
    options.addOption(outdir);
    return options;
  }

  public static void main(String[] args) throws UnsupportedEncodingException {
    System.exit(run(args, System.in, utf8(System.out), utf8(System.err)));
  }

  /** Console stream writing UTF-8 whatever the platform charset is */
  static PrintStream utf8(OutputStream os) throws UnsupportedEncodingException {
    return new PrintStream(os, true, "UTF-8");
  }

  /** @return the process exit status */
  public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    Options options = options();
    CommandLine cmd = null;
    try {
      CommandLineParser parser = new PosixParser();
      cmd = parser.parse(options, args, true);
    } catch (ParseException ex) {
      err.println("error: " + ex.getMessage());
      printUsage(options, err);
      return 1;
    }
    if (cmd.hasOption("h")) {
      printUsage(options, out);
      return 0;
    }
    String[] rest = cmd.getArgs();
    if (rest.length < 1) {
      err.println("error: no grammar file given");
      printUsage(options, err);
      return 1;
    }
    Logging.configure(err, cmd.hasOption("v") ? Level.FINE : Level.WARNING);

    try {
      Grammar grammar = GrammarReader.readGrammar(rest[0]);
      Grammar cnf = CnfConverter.convert(grammar);

      if (cmd.hasOption("o")) {
        String cnffile = cmd.getOptionValue("o");
        writeFile(new File(cnffile), StringUtils.join(cnf.toLines(), "\n") + "\n");
        out.println("CNF grammar written to: " + cnffile);
      }
      if (cmd.hasOption("show-cnf")) {
        out.println("CNF grammar:");
        out.println(StringUtils.join(cnf.toLines(), "\n"));
        out.println();
      }

      List<String> tokens = null;
      List<String> words = Arrays.asList(rest).subList(1, rest.length);
      if (cmd.hasOption("tokens")) {
        tokens = new ArrayList<String>(words);
      } else {
        String sentence = words.isEmpty() ? readAll(in) : StringUtils.join(words, " ");
        tokens = Parser.tokenize(sentence, cmd.hasOption("lowercase"));
      }

      long startTime = System.nanoTime();
      ParseResult result = Parser.parse(cnf, tokens);
      long endTime = System.nanoTime();

      out.println("Tokens: " + tokens);
      out.println("Accepted: " + (result.accepted() ? "YES" : "NO"));
      out.println(String.format(Locale.ROOT, "CYK time: %.6f s", (endTime - startTime) / 1e9));

      if (!result.accepted()) {
        out.println("No parse tree can be built because the sentence is not in the language.");
        return 0;
      }
      ParseTree tree = result.tree();
      out.println("Parse tree:");
      out.println(Trees.IndentedRenderer.render(tree));

      if (tree != null && !cmd.hasOption("no-tree")) {
        File dir = new File(cmd.getOptionValue("d", "."));
        boolean colorize = !cmd.hasOption("no-color");
        if (cmd.hasOption("tree-dot")) {
          File dotfile = new File(dir, StringUtils.fileName(tokens, "dot", MAX_FILENAME));
          writeFile(dotfile, Trees.DotRenderer.render(tree, colorize));
          out.println("Tree written as DOT: " + dotfile.getPath());
        }
        if (cmd.hasOption("tree-png")) {
          File pngfile = new File(dir, StringUtils.fileName(tokens, "png", MAX_FILENAME));
          Trees.PngRenderer.render(tree, colorize,
              cmd.getOptionValue("dot", Trees.PngRenderer.DEFAULT_COMMAND), pngfile);
          out.println("Tree written as PNG: " + pngfile.getPath());
        }
      }
      return 0;
    } catch (ParserException ex) {
      err.println("error: invalid grammar: " + ex.getMessage());
      return 1;
    } catch (IOException ex) {
      err.println("error: " + ex.getMessage());
      return 1;
    }
  }

  private static void printUsage(Options options, PrintStream ps) {
    PrintWriter pw = new PrintWriter(new OutputStreamWriter(ps, StandardCharsets.UTF_8));
    new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
        HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    pw.flush();
  }

  private static void writeFile(File f, String content) throws IOException {
    Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8);
    try {
      w.write(content);
    } finally {
      w.close();
    }
  }

  private static String readAll(InputStream in) throws IOException {
    BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    StringBuilder sb = new StringBuilder();
    String line = null;
    while ((line = br.readLine()) != null)
      sb.append(line).append('\n');
    return sb.toString();
  }

}
