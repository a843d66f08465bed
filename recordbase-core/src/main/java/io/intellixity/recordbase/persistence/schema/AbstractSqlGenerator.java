package io.intellixity.recordbase.persistence.schema;

import io.intellixity.recordbase.persistence.query.SortField;
import io.intellixity.recordbase.persistence.record.FieldDef;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dialect-neutral SQL generator base.\n
 *
 * Provides common rendering for:\n
 * - table and column naming (prefix + snake_case)\n
 * - select/count/delete/update with field filters, sort and paging\n
 * - insert and update-by-identity\n
 *
 * Dialects override hooks for quoting, paging, returning and upsert syntax.\n
 */
public abstract class AbstractSqlGenerator implements SqlGenerator {
  private final String type;
  private final String table;
  private final String identityField;
  private final String identityColumn;
  private final Map<String, String> dataColumns;
  private final Map<String, String> fieldsByColumn;

  protected AbstractSqlGenerator(RecordDescriptor descriptor, GeneratorOptions options) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(options, "options");
    this.type = descriptor.type();

    SqlGenerator source = options.source();
    String tableType = (options.forcedName() != null) ? options.forcedName() : descriptor.type();
    String derivedTable = (source != null) ? source.table() : Names.table(options.tablePrefix(), tableType);
    this.table = Names.requireIdentifier(derivedTable, "table");
    this.identityField = descriptor.identityField();
    this.identityColumn = Names.requireIdentifier(Names.underscore(identityField), "identity column");

    Map<String, String> cols = new LinkedHashMap<>();
    Map<String, String> byCol = new HashMap<>();
    byCol.put(identityColumn, descriptor.identityField());
    for (FieldDef f : descriptor.fields()) {
      String col = Names.requireIdentifier(Names.underscore(Names.requireIdentifier(f.name(), "field")), "column");
      if (source != null && source.fieldForColumn(col) == null) {
        throw new IllegalArgumentException("Column '" + col + "' of " + type + " not found in source table " + table);
      }
      if (byCol.putIfAbsent(col, f.name()) != null) {
        throw new IllegalArgumentException("Fields '" + byCol.get(col) + "' and '" + f.name() + "' map to the same column");
      }
      cols.put(f.name(), col);
    }
    if (source != null && !identityColumn.equals(source.identityColumn())) {
      throw new IllegalArgumentException("Identity column '" + identityColumn + "' of " + type
          + " differs from source identity '" + source.identityColumn() + "'");
    }
    this.dataColumns = Collections.unmodifiableMap(cols);
    this.fieldsByColumn = Collections.unmodifiableMap(byCol);
  }

  // ---- hooks ----

  protected abstract String quoteIdent(String ident);

  /** Append paging; 0 means unset. */
  protected abstract String applyPage(String sql, int limit, int offset);

  protected abstract String applyReturning(String sql, String column);

  /** Insert with identity; conflicting rows take the inserted values. */
  protected abstract String renderUpsert(String table, String identityColumn, List<String> dataColumns);

  /** Insert with no data columns (identity generated by the database). */
  protected String renderEmptyInsert(String table) {
    return "INSERT INTO " + table + " DEFAULT VALUES";
  }

  // ---- mapping ----

  public final String type() { return type; }

  @Override public final String table() { return table; }

  @Override public final String identityColumn() { return identityColumn; }

  @Override
  public final String columnFor(String field) {
    if (field == null) return null;
    String col = dataColumns.get(field);
    if (col != null) return col;
    return identityField.equals(field) ? identityColumn : null;
  }

  @Override
  public final String fieldForColumn(String column) {
    return (column == null) ? null : fieldsByColumn.get(column);
  }

  // ---- statements ----

  @Override
  public String insert() {
    if (dataColumns.isEmpty()) return applyReturning(renderEmptyInsert(quoteIdent(table)), identityColumn);
    List<String> cols = quotedDataColumns();
    String sql = "INSERT INTO " + quoteIdent(table) + " (" + String.join(", ", cols) + ") VALUES ("
        + placeholders(cols.size()) + ")";
    return applyReturning(sql, identityColumn);
  }

  @Override
  public String upsert() {
    return renderUpsert(quoteIdent(table), quoteIdent(identityColumn), quotedDataColumns());
  }

  @Override
  public String updateById() {
    List<String> sets = new ArrayList<>();
    for (String c : quotedDataColumns()) sets.add(c + " = ?");
    // Nothing to update: keep the statement valid and touch no columns.
    if (sets.isEmpty()) sets.add(quoteIdent(identityColumn) + " = " + quoteIdent(identityColumn));
    return "UPDATE " + quoteIdent(table) + " SET " + String.join(", ", sets) + " WHERE " + quoteIdent(identityColumn) + " = ?";
  }

  @Override
  public String selectById() {
    return selectAll() + " WHERE " + quoteIdent(identityColumn) + " = ?";
  }

  @Override
  public String select(List<SortField> order, int limit, int offset, Map<String, ?> filters) {
    StringBuilder sql = new StringBuilder(selectAll()).append(where(filters));
    if (order != null && !order.isEmpty()) {
      List<String> items = new ArrayList<>();
      for (SortField sf : order) {
        if (sf == null) continue;
        String col = columnFor(sf.field());
        if (col == null) throw new IllegalArgumentException("Unknown sort field '" + sf.field() + "' on type " + type);
        items.add(quoteIdent(col) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
      }
      if (!items.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", items));
    }
    return applyPage(sql.toString(), limit, offset);
  }

  @Override
  public String deleteById() {
    return "DELETE FROM " + quoteIdent(table) + " WHERE " + quoteIdent(identityColumn) + " = ?";
  }

  @Override
  public String deleteReturningIds(Map<String, ?> filters) {
    return applyReturning("DELETE FROM " + quoteIdent(table) + where(filters), identityColumn);
  }

  @Override
  public String update(Map<String, ?> values, Map<String, ?> filters) {
    if (values == null || values.isEmpty()) throw new IllegalArgumentException("update requires at least one value");
    List<String> sets = new ArrayList<>();
    for (String field : values.keySet()) sets.add(quoteIdent(dataColumn(field)) + " = ?");
    return "UPDATE " + quoteIdent(table) + " SET " + String.join(", ", sets) + where(filters);
  }

  @Override
  public String selectCount(Map<String, ?> filters) {
    return "SELECT COUNT(*) FROM " + quoteIdent(table) + where(filters);
  }

  // ---- helpers ----

  protected final String selectAll() {
    List<String> cols = new ArrayList<>();
    cols.add(quoteIdent(identityColumn));
    cols.addAll(quotedDataColumns());
    return "SELECT " + String.join(", ", cols) + " FROM " + quoteIdent(table);
  }

  protected final List<String> quotedDataColumns() {
    List<String> out = new ArrayList<>(dataColumns.size());
    for (String c : dataColumns.values()) out.add(quoteIdent(c));
    return out;
  }

  protected final String where(Map<String, ?> filters) {
    if (filters == null || filters.isEmpty()) return "";
    List<String> preds = new ArrayList<>();
    for (var e : filters.entrySet()) {
      String col = quoteIdent(dataColumn(e.getKey()));
      if (e.getValue() instanceof Collection<?> c) {
        preds.add(c.isEmpty() ? "1 = 0" : col + " IN (" + placeholders(c.size()) + ")");
      } else {
        preds.add(col + " = ?");
      }
    }
    return " WHERE " + String.join(" AND ", preds);
  }

  private String dataColumn(String field) {
    String col = dataColumns.get(field);
    if (col == null) throw new IllegalArgumentException("Unknown field '" + field + "' on type " + type);
    return col;
  }

  protected static String placeholders(int n) {
    return String.join(", ", Collections.nCopies(n, "?"));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{type=" + type + ", table=" + table + "}";
  }
}
