package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.schema.FieldType;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/** Binds {@link Bind}s onto a PreparedStatement by position. */
final class JdbcBinds {
  private JdbcBinds() {}

  static void bindAll(PreparedStatement ps, List<Bind> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      if (b.value() == null) ps.setNull(i + 1, sqlType(b.type()));
      else ps.setObject(i + 1, b.value());
    }
  }

  static int sqlType(FieldType t) {
    if (t == null) return Types.VARCHAR;
    return switch (t) {
      case STRING, EMAIL, PASSWORD, TEL, URL, FILE, TEXT, OBJECT, LIST -> Types.VARCHAR;
      case NUMBER, FLOAT -> Types.DECIMAL;
      case INTEGER, ENUM -> Types.INTEGER;
      case BOOLEAN -> Types.BOOLEAN;
      case TIMESTAMP, RELATION -> Types.BIGINT;
    };
  }
}
