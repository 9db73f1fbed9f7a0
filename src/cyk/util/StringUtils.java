package cyk.util;

import java.util.*;

public class StringUtils {

  public static String join(Collection<String> s, String delimiter) {
    if (s.isEmpty()) return "";
    Iterator<String> iter = s.iterator();
    StringBuilder buffer = new StringBuilder(iter.next());
    while (iter.hasNext()) {
      buffer.append(delimiter);
      buffer.append(iter.next());
    }
    return buffer.toString();
  }

  /**
   * Maps arbitrary symbol text to an identifier-safe fragment: every run of
   * characters outside [0-9A-Za-z] becomes a single underscore. Never returns
   * an empty string.
   */
  public static String slug(String s) {
    String slug = s.replaceAll("[^0-9A-Za-z]+", "_");
    return slug.isEmpty() ? "sym" : slug;
  }

  /** Builds a file name out of a token sequence, e.g. "the_dog_barks.dot" */
  public static String fileName(List<String> tokens, String extension, int maxlen) {
    String base = join(tokens, "_");
    base = base.replace('/', '_').replace('\\', '_').replace('.', '_');
    if (base.length() > maxlen)
      base = base.substring(0, maxlen);
    return base + "." + extension;
  }

  /** Strips one level of matching single or double quotes and resolves backslash escapes. */
  public static String unquote(String token) {
    if (token.length() < 2)
      return token;
    char q = token.charAt(0);
    if ((q != '"' && q != '\'') || token.charAt(token.length() - 1) != q)
      return token;
    String inner = token.substring(1, token.length() - 1);
    StringBuilder sb = new StringBuilder(inner.length());
    for (int i = 0; i < inner.length(); i ++) {
      char c = inner.charAt(i);
      if (c != '\\' || i == inner.length() - 1) {
        sb.append(c);
        continue;
      }
      char e = inner.charAt(++i);
      switch (e) {
      case 'n': sb.append('\n'); break;
      case 't': sb.append('\t'); break;
      case 'r': sb.append('\r'); break;
      case '0': sb.append('\0'); break;
      case 'u':
        if (i + 4 < inner.length() && isHex(inner.substring(i + 1, i + 5))) {
          sb.append((char)Integer.parseInt(inner.substring(i + 1, i + 5), 16));
          i += 4;
          break;
        }
        sb.append('\\').append(e);
        break;
      case '\\':
      case '\'':
      case '"':
        sb.append(e);
        break;
      default:
        sb.append('\\').append(e);
      }
    }
    return sb.toString();
  }

  private static boolean isHex(String s) {
    for (int i = 0; i < s.length(); i ++) {
      if (Character.digit(s.charAt(i), 16) < 0)
        return false;
    }
    return true;
  }

}
