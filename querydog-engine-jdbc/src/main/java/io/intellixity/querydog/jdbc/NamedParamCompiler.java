package io.intellixity.querydog.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites {@code :name} placeholders into JDBC '?' markers.
 * <p>
 * Rules:
 * <ul>
 *   <li>a placeholder is ':' followed by [A-Za-z_][A-Za-z0-9_]*;</li>
 *   <li>'::' is a cast, never a placeholder;</li>
 *   <li>text inside single quotes is left alone ('' and backslash escapes included);</li>
 *   <li>line comments ({@code --}) and block comments are left alone;</li>
 *   <li>only names in the bound set are rewritten, anything else stays as written.</li>
 * </ul>
 * A name occurring twice yields two markers, so {@link JdbcSql#params()} lists one entry per marker.
 */
public final class NamedParamCompiler {
  private NamedParamCompiler() {}

  public record JdbcSql(String sql, List<String> params) {
    public JdbcSql {
      params = List.copyOf(params);
    }
  }

  public static JdbcSql compile(String sql, Set<String> boundNames) {
    if (sql == null) return new JdbcSql("", List.of());
    StringBuilder out = new StringBuilder(sql.length());
    List<String> params = new ArrayList<>();
    int n = sql.length();

    for (int i = 0; i < n; i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        i = copyQuoted(sql, i, out);
        continue;
      }

      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int eol = sql.indexOf('\n', i);
        int stop = (eol < 0) ? n : eol;
        out.append(sql, i, stop);
        i = stop - 1;
        continue;
      }

      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        int stop = (close < 0) ? n : close + 2;
        out.append(sql, i, stop);
        i = stop - 1;
        continue;
      }

      if (ch == ':') {
        if (i + 1 < n && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < n && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < n && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          if (boundNames.contains(name)) {
            out.append('?');
            params.add(name);
          } else {
            out.append(sql, i, end);
          }
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return new JdbcSql(out.toString(), params);
  }

  /** Copies a single-quoted literal starting at {@code open}; returns the index of its closing quote. */
  private static int copyQuoted(String sql, int open, StringBuilder out) {
    int n = sql.length();
    out.append('\'');
    int i = open + 1;
    while (i < n) {
      char c = sql.charAt(i);
      if (c == '\\' && i + 1 < n) {
        out.append(c).append(sql.charAt(i + 1));
        i += 2;
        continue;
      }
      if (c == '\'') {
        if (i + 1 < n && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i += 2;
          continue;
        }
        out.append(c);
        return i;
      }
      out.append(c);
      i++;
    }
    return n - 1;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
