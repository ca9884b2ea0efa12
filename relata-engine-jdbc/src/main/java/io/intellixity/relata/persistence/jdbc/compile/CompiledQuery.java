package io.intellixity.relata.persistence.jdbc.compile;

import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.SqlStatement;

import java.util.List;

/**
 * Compiled parts of a query, assembled into SELECT or COUNT text on demand.
 *
 * @param from quoted root table
 * @param condition combined WHERE fragment, "" when unfiltered
 * @param pagination dialect pagination clause with a leading space, "" when unpaged
 */
public record CompiledQuery(String from,
                            List<String> fields,
                            String condition,
                            List<String> orderBy,
                            String pagination,
                            List<String> joins,
                            SqlParams params) {
  public CompiledQuery {
    fields = List.copyOf(fields);
    orderBy = List.copyOf(orderBy);
    joins = List.copyOf(joins);
  }

  public String selectSql() {
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", fields)).append(" FROM ").append(from);
    appendJoinsAndWhere(sql);
    if (!orderBy.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", orderBy));
    sql.append(pagination);
    return sql.toString();
  }

  public String countSql() {
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total FROM ").append(from);
    appendJoinsAndWhere(sql);
    return sql.toString();
  }

  public SqlStatement select() { return params.query(selectSql()); }

  public SqlStatement count() { return params.query(countSql()); }

  private void appendJoinsAndWhere(StringBuilder sql) {
    for (String j : joins) sql.append(' ').append(j);
    if (!condition.isBlank()) sql.append(" WHERE ").append(condition);
  }
}
