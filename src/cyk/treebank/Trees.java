package cyk.treebank;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import cyk.syntax.ParseTree;
import cyk.util.StringUtils;

/**
 * Renderers for parse trees.
 *
 */
public class Trees {

  /**
   * One node per line, children indented two spaces below their parent:
   * <pre>
   * S
   *   N -&gt; 'dog'
   *   V -&gt; 'barks'
   * </pre>
   */
  public static class IndentedRenderer {

    public static String render(ParseTree tree) {
      if (tree == null)
        return "(∅)";
      List<String> lines = new ArrayList<String>();
      render(tree, 0, lines);
      return StringUtils.join(lines, "\n");
    }

    private static void render(ParseTree tree, int indent, List<String> lines) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < indent; i ++)
        sb.append("  ");
      sb.append(tree.getLabel());
      if (tree.isLeaf()) {
        sb.append(" -> '").append(((ParseTree.Leaf)tree).getToken()).append("'");
        lines.add(sb.toString());
        return;
      }
      lines.add(sb.toString());
      for (ParseTree child : tree.getChildren())
        render(child, indent + 1, lines);
    }
  }

  public static class PennTreeRenderer {

    public static String render(ParseTree tree) {
      if (tree == null)
        return "()";
      return tree.toString();
    }
  }

  /**
   * Graphviz DOT output. Nodes are named n0, n1, ... in pre-order, each leaf
   * gets an extra node holding its token.
   */
  public static class DotRenderer implements ParseTree.Visitor<String> {

    public static final String NONTERMINAL_COLOR = "lightblue";
    public static final String TOKEN_COLOR = "lightyellow";

    public static String render(ParseTree tree, boolean colorize) {
      DotRenderer renderer = new DotRenderer(colorize);
      renderer._lines.add("digraph ParseTree {");
      renderer._lines.add("  rankdir=TB;");
      renderer._lines.add("  node [shape=plaintext, fontsize=12];");
      tree.accept(renderer);
      renderer._lines.add("}");
      return StringUtils.join(renderer._lines, "\n") + "\n";
    }

    public static String render(ParseTree tree) {
      return render(tree, true);
    }

    private DotRenderer(boolean colorize) {
      _colorize = colorize;
    }

    public String visitLeaf(ParseTree.Leaf leaf) {
      String id = node(leaf.getLabel(), NONTERMINAL_COLOR);
      String tid = node(leaf.getToken(), TOKEN_COLOR);
      _lines.add("  " + id + " -> " + tid + ";");
      return id;
    }

    public String visitInternal(ParseTree.Internal node) {
      String id = node(node.getLabel(), NONTERMINAL_COLOR);
      String lid = node.getLeft().accept(this);
      String rid = node.getRight().accept(this);
      _lines.add("  " + id + " -> " + lid + ";");
      _lines.add("  " + id + " -> " + rid + ";");
      return id;
    }

    private String node(String label, String color) {
      String id = "n" + (_counter++);
      if (_colorize)
        _lines.add("  " + id + " [label=\"" + escape(label) + "\", style=filled, fillcolor=" + color + "];");
      else
        _lines.add("  " + id + " [label=\"" + escape(label) + "\"];");
      return id;
    }

    public static String escape(String label) {
      return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private final boolean _colorize;
    private final List<String> _lines = new ArrayList<String>();
    private int _counter = 0;
  }

  /**
   * PNG output through the Graphviz <code>dot</code> executable. The DOT
   * text is fed to <code>dot -Tpng</code> on standard input and the image
   * goes straight to the target file.
   */
  public static class PngRenderer {

    public static final String DEFAULT_COMMAND = "dot";

    /**
     * @throws IOException if the executable cannot be started or exits with
     * a non-zero status; no partial image is left behind in that case
     */
    public static void render(ParseTree tree, boolean colorize, String command, File target)
        throws IOException {
      renderDot(DotRenderer.render(tree, colorize), command, target);
    }

    public static void renderDot(String dot, String command, File target) throws IOException {
      ProcessBuilder pb = new ProcessBuilder(Arrays.asList(command, "-Tpng"));
      pb.redirectOutput(target);
      pb.redirectError(ProcessBuilder.Redirect.INHERIT);
      Process process = null;
      try {
        process = pb.start();
      } catch (IOException ex) {
        target.delete();
        throw new IOException("Could not run Graphviz (" + command +
            "), make sure it is installed and on the PATH: " + ex.getMessage(), ex);
      }
      int status;
      try {
        OutputStream os = process.getOutputStream();
        try {
          os.write(dot.getBytes(StandardCharsets.UTF_8));
        } finally {
          os.close();
        }
        status = process.waitFor();
      } catch (InterruptedException ex) {
        process.destroy();
        target.delete();
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while waiting for " + command);
      } catch (IOException ex) {
        process.destroy();
        target.delete();
        throw ex;
      }
      if (status != 0) {
        target.delete();
        throw new IOException("Graphviz (" + command + ") exited with status " + status);
      }
    }
  }

}
