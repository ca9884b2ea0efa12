package io.intellixity.relata.persistence.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles a SQL string containing named parameters (e.g. :b1) into JDBC SQL with '?' binds.
 *
 * Rules:
 * <ul>
 *   <li>Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*</li>
 *   <li>'::' is a SQL cast, not a param</li>
 *   <li>Params inside single quotes are ignored</li>
 * </ul>
 * Bind order is the order of appearance, so fragments may be rendered in any order before assembly.
 */
public final class NamedParamSql {
  private NamedParamSql() {}

  /** Resolve binds for named params in appearance order. */
  public static List<Bind> bindsFor(String sql, Map<String, Bind> params) {
    if (sql == null) return List.of();
    List<Bind> binds = new ArrayList<>();
    scan(sql, new StringBuilder(), name -> {
      if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
      binds.add(params.get(name));
    });
    return binds;
  }

  /** Rewrite ":name" params into '?' placeholders. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    scan(sql, out, name -> {});
    return out.toString();
  }

  public static SqlStatement compile(String sql, Map<String, Bind> params, SqlStatement.ExecKind kind) {
    return new SqlStatement(toJdbcSql(sql), bindsFor(sql, params), kind);
  }

  private interface ParamSink {
    void accept(String name);
  }

  private static void scan(String sql, StringBuilder out, ParamSink sink) {
    boolean inSingleQuote = false;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // '' escape inside a literal
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          sink.accept(sql.substring(start, end));
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
