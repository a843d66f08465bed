package io.intellixity.recordbase.persistence.jdbc;

import io.intellixity.recordbase.persistence.introspect.Bind;
import io.intellixity.recordbase.persistence.record.FieldKind;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * JDBC binding and reading per {@link FieldKind}.\n
 *
 * SQL NULL reads as the kind's zero value; a null string binds as SQL NULL.
 */
final class JdbcValues {
  private JdbcValues() {}

  static void bindAll(PreparedStatement ps, List<Bind> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) bind(ps, i + 1, binds.get(i));
  }

  static void bind(PreparedStatement ps, int index, Bind b) throws SQLException {
    Object v = b.value();
    if (v == null) {
      ps.setNull(index, sqlType(b.kind()));
      return;
    }
    switch (b.kind()) {
      case LONG -> ps.setLong(index, ((Number) v).longValue());
      case INT -> ps.setInt(index, ((Number) v).intValue());
      case STRING -> ps.setString(index, (String) v);
      case BOOLEAN -> ps.setBoolean(index, (Boolean) v);
    }
  }

  static Object read(ResultSet rs, int column, FieldKind kind) throws SQLException {
    return switch (kind) {
      case LONG -> rs.getLong(column);
      case INT -> rs.getInt(column);
      case STRING -> {
        String s = rs.getString(column);
        yield (s == null) ? "" : s;
      }
      case BOOLEAN -> rs.getBoolean(column);
    };
  }

  private static int sqlType(FieldKind kind) {
    return switch (kind) {
      case LONG -> Types.BIGINT;
      case INT -> Types.INTEGER;
      case STRING -> Types.VARCHAR;
      case BOOLEAN -> Types.BOOLEAN;
    };
  }
}
