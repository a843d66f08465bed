package io.intellixity.recordbase.persistence.jdbc.postgres;

import io.intellixity.recordbase.persistence.record.RecordDescriptor;
import io.intellixity.recordbase.persistence.schema.AbstractSqlGenerator;
import io.intellixity.recordbase.persistence.schema.GeneratorOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Postgres SQL generator.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractSqlGenerator}.
 */
public final class PostgresSqlGenerator extends AbstractSqlGenerator {
  public PostgresSqlGenerator(RecordDescriptor descriptor, GeneratorOptions options) {
    super(descriptor, options);
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyPage(String sql, int limit, int offset) {
    StringBuilder out = new StringBuilder(sql);
    if (limit > 0) out.append(" LIMIT ").append(limit);
    if (offset > 0) out.append(" OFFSET ").append(offset);
    return out.toString();
  }

  @Override
  protected String applyReturning(String sql, String column) {
    if (column == null || column.isBlank()) return sql;
    return sql + " RETURNING " + quoteIdent(column);
  }

  @Override
  protected String renderUpsert(String table, String identityColumn, List<String> dataColumns) {
    List<String> cols = new ArrayList<>();
    cols.add(identityColumn);
    cols.addAll(dataColumns);
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(table)
        .append(" (").append(String.join(", ", cols)).append(") VALUES (")
        .append(placeholders(cols.size())).append(")")
        .append(" ON CONFLICT (").append(identityColumn).append(")");
    if (dataColumns.isEmpty()) {
      sql.append(" DO NOTHING");
    } else {
      sql.append(" DO UPDATE SET ");
      sql.append(String.join(", ", dataColumns.stream().map(c -> c + " = EXCLUDED." + c).toList()));
    }
    return sql.toString();
  }
}
