package io.intellixity.relata.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result sets into mutable rows keyed by column label, in column order. */
final class JdbcRows {
  private JdbcRows() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    List<Map<String, Object>> out = new ArrayList<>();
    if (rs == null) return out;
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) row.put(labels[i - 1], rs.getObject(i));
      out.add(row);
    }
    return out;
  }
}
