package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.FieldType;

import java.util.List;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * <ul>
 *   <li>INSERT statements, with hooks for OUTPUT/RETURNING placement</li>
 *   <li>the field type to column type mapping</li>
 *   <li>DDL literals</li>
 * </ul>
 * DB-specific dialects override hooks for quoting, paging, returning and the concrete type names.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private static final int DEFAULT_STRING_LENGTH = 255;
  private static final int DECIMAL_SCALE = 10;
  private static final int DEFAULT_DECIMAL_PRECISION = 20;
  private static final int MAX_DECIMAL_PRECISION = 38;

  @Override
  public String insertSql(String table, List<String> columns, List<String> tuples, String returningPk) {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(quoteIdent(table));
    if (!columns.isEmpty()) {
      sql.append(" (").append(String.join(", ", columns.stream().map(this::quoteIdent).toList())).append(')');
    }
    if (returningPk != null) sql.append(returningBeforeValues(returningPk));
    if (columns.isEmpty()) {
      sql.append(" DEFAULT VALUES");
    } else {
      if (tuples.isEmpty()) throw new IllegalArgumentException("INSERT into " + table + " has no rows");
      sql.append(" VALUES ").append(String.join(", ", tuples));
    }
    if (returningPk != null) sql.append(returningAfterValues(returningPk));
    return sql.toString();
  }

  /** Clause between the column list and VALUES (MSSQL OUTPUT). */
  protected String returningBeforeValues(String pk) { return ""; }

  /** Clause after VALUES (Postgres RETURNING). */
  protected String returningAfterValues(String pk) { return ""; }

  @Override
  public final String columnType(FieldDef f) {
    if (!f.hasColumn()) return null;
    if (f.primary()) {
      return f.type().isStringLike() ? wideIntegerType() : scalarType(f.type(), f.maxLength(), f.max());
    }
    return scalarType(f.type(), f.maxLength(), f.max());
  }

  @Override
  public final String scalarType(FieldType type) {
    return scalarType(type, null, null);
  }

  private String scalarType(FieldType type, Integer maxLength, Long max) {
    return switch (type) {
      case STRING, EMAIL, PASSWORD, TEL, URL, FILE -> stringType(maxLength == null ? DEFAULT_STRING_LENGTH : maxLength);
      case NUMBER, FLOAT -> decimalType(precision(max), DECIMAL_SCALE);
      case INTEGER, ENUM -> integerType();
      case BOOLEAN -> booleanType();
      case TIMESTAMP, RELATION -> wideIntegerType();
      case TEXT, OBJECT -> unboundedTextType();
      case LIST -> throw new IllegalArgumentException("List fields are stored in their own table");
    };
  }

  /** Digits of {@code max} plus the scale, capped at the widest portable precision. */
  private static int precision(Long max) {
    if (max == null) return DEFAULT_DECIMAL_PRECISION;
    int digits = String.valueOf(Math.abs(max)).length();
    return Math.min(MAX_DECIMAL_PRECISION, digits + DECIMAL_SCALE);
  }

  protected abstract String stringType(int maxLength);
  protected abstract String decimalType(int precision, int scale);
  protected abstract String integerType();
  protected abstract String wideIntegerType();
  protected abstract String booleanType();
  protected abstract String unboundedTextType();

  @Override
  public String dropTableIfExists(String table) {
    return "DROP TABLE IF EXISTS " + quoteIdent(table);
  }

  @Override
  public String literal(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return booleanLiteral(b);
    if (value instanceof Number n) return n.toString();
    return stringLiteral(String.valueOf(value));
  }

  protected abstract String booleanLiteral(boolean b);

  protected String stringLiteral(String s) {
    return "'" + s.replace("'", "''") + "'";
  }
}
