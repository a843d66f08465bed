package io.intellixity.recordbase.persistence.jdbc;

import io.intellixity.recordbase.persistence.error.CascadeDeleteException;
import io.intellixity.recordbase.persistence.error.ConversionException;
import io.intellixity.recordbase.persistence.error.MissingValuesException;
import io.intellixity.recordbase.persistence.error.PersistenceException;
import io.intellixity.recordbase.persistence.error.QueryException;
import io.intellixity.recordbase.persistence.error.ScanException;
import io.intellixity.recordbase.persistence.error.SchemaException;
import io.intellixity.recordbase.persistence.error.ValidationException;
import io.intellixity.recordbase.persistence.introspect.Bind;
import io.intellixity.recordbase.persistence.introspect.FieldIntrospector;
import io.intellixity.recordbase.persistence.introspect.FieldSlot;
import io.intellixity.recordbase.persistence.options.DeleteMultipleOptions;
import io.intellixity.recordbase.persistence.options.DeleteOptions;
import io.intellixity.recordbase.persistence.options.GetCountOptions;
import io.intellixity.recordbase.persistence.options.GetOptions;
import io.intellixity.recordbase.persistence.options.SaveOptions;
import io.intellixity.recordbase.persistence.options.UpdateMultipleOptions;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordFactory;
import io.intellixity.recordbase.persistence.schema.SchemaCache;
import io.intellixity.recordbase.persistence.schema.SqlGenerator;
import io.intellixity.recordbase.persistence.validate.DefaultValidator;
import io.intellixity.recordbase.persistence.validate.ValidationResult;
import io.intellixity.recordbase.persistence.validate.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Generic persistence controller over a JDBC {@link DataSource}.\n
 *
 * Every operation resolves the record type's {@link SqlGenerator} from the {@link SchemaCache}, validates
 * its inputs with the {@link Validator}, then runs one statement per database round trip on a connection
 * borrowed from the data source (autocommit). Failures surface as
 * {@link PersistenceException} subclasses whose {@code op()} names the failing step.\n
 *
 * Cascading deletes follow the relations declared on the deleted type, down to a fixed depth; see
 * {@link CascadeDeleter}.
 */
public final class PersistenceController {
  private static final Logger log = LoggerFactory.getLogger(PersistenceController.class);

  private final DataSource ds;
  private final SchemaCache schemas;
  private final Validator validator;
  private final CascadeDeleter cascade;

  public PersistenceController(DataSource ds, SchemaCache schemas, Validator validator) {
    this(ds, schemas, validator, CascadeDeleter.CHUNK_SIZE);
  }

  PersistenceController(DataSource ds, SchemaCache schemas, Validator validator, int cascadeChunkSize) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.cascade = new CascadeDeleter(this, cascadeChunkSize);
  }

  public PersistenceController(DataSource ds, SchemaCache schemas) {
    this(ds, schemas, new DefaultValidator());
  }

  // ---- single record ----

  public void save(Persistable record) {
    save(record, SaveOptions.defaults());
  }

  /**
   * Insert (identity 0), upsert (identity set) or update by identity ({@code noInsert}).\n
   *
   * On insert the generated identity is written back into the record.
   */
  public void save(Persistable record, SaveOptions opts) {
    Objects.requireNonNull(record, "record");
    SaveOptions o = (opts == null) ? SaveOptions.defaults() : opts;
    SqlGenerator g = schemas.resolve(record);
    String type = record.descriptor().type();

    ValidationResult vr = validator.validateRecord(record);
    if (!vr.valid()) throw new ValidationException("Validate", vr.invalidFields());

    long id = FieldIntrospector.identityValue(record);
    if (id == 0) {
      List<Bind> binds = FieldIntrospector.fieldBinds(record, false);
      long generated = query("INSERT", type, g.insert(), binds, rs -> {
        if (!rs.next()) throw new SQLException("insert returned no identity");
        return rs.getLong(1);
      });
      FieldIntrospector.identitySlot(record).set(generated);
    } else if (o.noInsert()) {
      List<Bind> binds = FieldIntrospector.fieldBinds(record, false);
      binds.add(FieldIntrospector.identitySlot(record).bind());
      update("UPDATE", type, g.updateById(), binds);
    } else {
      update("UPSERT", type, g.upsert(), FieldIntrospector.fieldBinds(record, true));
    }
  }

  /**
   * Fill {@code record} from the row with identity {@code id}.\n
   *
   * A missing row resets the record to zero values and is not an error.
   *
   * @throws ConversionException when {@code id} is not a non-negative integer
   */
  public void load(Persistable record, String id) {
    Objects.requireNonNull(record, "record");
    SqlGenerator g = schemas.resolve(record);
    long key = parseId(id);
    List<Bind> binds = List.of(new Bind(key, FieldIntrospector.identitySlot(record).kind()));
    boolean found = query("LOAD", record.descriptor().type(), g.selectById(), binds, rs -> {
      if (!rs.next()) return false;
      scanRow(rs, FieldIntrospector.fieldSlots(record, true));
      return true;
    });
    if (!found) FieldIntrospector.resetFields(record);
  }

  public void delete(Persistable record) {
    delete(record, DeleteOptions.defaults());
  }

  /**
   * Delete the record's row, reset the record, then cascade into relations with a registered constructor.\n
   *
   * A record with identity 0 is left alone (no database round trip), though its schema must still resolve.
   *
   * @throws SchemaException when the record's type cannot be registered
   * @throws CascadeDeleteException when the row was deleted but cascading failed
   */
  public void delete(Persistable record, DeleteOptions opts) {
    Objects.requireNonNull(record, "record");
    DeleteOptions o = (opts == null) ? DeleteOptions.defaults() : opts;
    SqlGenerator g = schemas.resolve(record);
    long id = FieldIntrospector.identityValue(record);
    if (id == 0) return;

    update("DELETE", record.descriptor().type(), g.deleteById(), List.of(FieldIntrospector.identitySlot(record).bind()));
    FieldIntrospector.resetFields(record);
    cascadeFromRoot(record, List.of(id), 0, o.constructors());
  }

  // ---- multi-row ----

  /**
   * Delete every row matching the filters and return their identities.\n
   *
   * Cascades over the deleted identities while {@code cascadeDeleteDepth} is below
   * {@link CascadeDeleter#MAX_DEPTH}; deeper calls delete without cascading.
   *
   * @throws CascadeDeleteException when rows were deleted but cascading failed
   */
  public <T extends Persistable> List<Long> deleteMultiple(RecordFactory<T> factory, DeleteMultipleOptions opts) {
    Objects.requireNonNull(factory, "factory");
    DeleteMultipleOptions o = (opts == null) ? DeleteMultipleOptions.where(Map.of()) : opts;
    T prototype = factory.create();
    List<Long> ids = deleteWhere(prototype, o.filters());
    if (o.cascadeDeleteDepth() < CascadeDeleter.MAX_DEPTH) {
      cascadeFromRoot(prototype, ids, o.cascadeDeleteDepth(), o.constructors());
    }
    return ids;
  }

  /**
   * Assign {@code values} on every row matching the filters.\n
   *
   * Value binds precede filter binds. The affected row count is logged, not returned.
   *
   * @throws MissingValuesException when {@code values} is empty (before or after string coercion)
   */
  public <T extends Persistable> void updateMultiple(RecordFactory<T> factory, Map<String, ?> values,
                                                     UpdateMultipleOptions opts) {
    Objects.requireNonNull(factory, "factory");
    if (values == null || values.isEmpty()) throw new MissingValuesException("MissingValues", "No values to update");
    UpdateMultipleOptions o = (opts == null) ? UpdateMultipleOptions.where(Map.of()) : opts;
    T prototype = factory.create();
    SqlGenerator g = schemas.resolve(prototype);

    Map<String, ?> effective = values;
    if (o.convertValuesFromString()) {
      effective = FieldIntrospector.coerceStringMap(prototype, values);
      if (effective.isEmpty()) {
        throw new MissingValuesException("MissingValues", "No values left after string conversion: " + values.keySet());
      }
    }

    ValidationResult vv = validator.validateValues(prototype, effective);
    if (!vv.valid()) throw new ValidationException("ValidateValues", vv.invalidFields());
    ValidationResult vf = validator.validateFilters(prototype, o.filters());
    if (!vf.valid()) throw new ValidationException("ValidateFilters", vf.invalidFields());

    Map<String, Object> orderedValues = FieldIntrospector.ordered(effective);
    Map<String, Object> orderedFilters = FieldIntrospector.ordered(o.filters());
    List<Bind> binds = new ArrayList<>(FieldIntrospector.mapBinds(prototype, orderedValues));
    binds.addAll(FieldIntrospector.mapBinds(prototype, orderedFilters));
    update("UPDATE_MULTIPLE", prototype.descriptor().type(), g.update(orderedValues, orderedFilters), binds);
  }

  /**
   * Select rows into fresh records from {@code factory}.\n
   *
   * Each record is passed through the row transform when one is set; the transform's result takes the
   * record's place in the returned list.
   */
  public <T extends Persistable> List<Object> get(RecordFactory<T> factory, GetOptions<T> opts) {
    Objects.requireNonNull(factory, "factory");
    GetOptions<T> o = (opts == null) ? GetOptions.all() : opts;
    T prototype = factory.create();
    SqlGenerator g = schemas.resolve(prototype);

    ValidationResult vf = validator.validateFilters(prototype, o.filters());
    if (!vf.valid()) throw new ValidationException("ValidateFilters", vf.invalidFields());
    ValidationResult vo = validator.validateOrder(prototype, o.order());
    if (!vo.valid()) throw new ValidationException("ValidateOrder", vo.invalidFields());

    Map<String, Object> filters = FieldIntrospector.ordered(o.filters());
    String sql = g.select(o.order(), o.limit(), o.offset(), filters);
    Function<? super T, ?> transform = o.rowTransform();
    return query("SELECT", prototype.descriptor().type(), sql, FieldIntrospector.mapBinds(prototype, filters), rs -> {
      List<Object> out = new ArrayList<>();
      while (rs.next()) {
        T rec = factory.create();
        scanRow(rs, FieldIntrospector.fieldSlots(rec, true));
        out.add(transform == null ? rec : transform.apply(rec));
      }
      return out;
    });
  }

  public <T extends Persistable> long getCount(RecordFactory<T> factory, GetCountOptions opts) {
    Objects.requireNonNull(factory, "factory");
    GetCountOptions o = (opts == null) ? GetCountOptions.all() : opts;
    T prototype = factory.create();
    SqlGenerator g = schemas.resolve(prototype);

    ValidationResult vf = validator.validateFilters(prototype, o.filters());
    if (!vf.valid()) throw new ValidationException("ValidateFilters", vf.invalidFields());

    Map<String, Object> filters = FieldIntrospector.ordered(o.filters());
    return query("COUNT", prototype.descriptor().type(), g.selectCount(filters), FieldIntrospector.mapBinds(prototype, filters),
        rs -> rs.next() ? rs.getLong(1) : 0L);
  }

  // ---- schema / validation pass-throughs ----

  public void register(Persistable record, Persistable parent, boolean overwrite) {
    schemas.register(record, parent, overwrite);
  }

  /** Validate a value map against the record (the whole record when the map is empty). */
  public ValidationResult validate(Persistable record, Map<String, ?> values) {
    schemas.resolve(record);
    if (values == null || values.isEmpty()) return validator.validateRecord(record);
    return validator.validateValues(record, values);
  }

  public String fieldNameForColumn(Persistable record, String column) {
    return schemas.fieldNameForColumn(record, column);
  }

  // ---- cascade internals ----

  /** Filtered delete plus cascade, without root-level wrapping; used while traversing relations. */
  List<Long> deleteCascading(Persistable prototype, Map<String, ?> filters, int depth,
                             Map<String, RecordFactory<?>> constructors) {
    List<Long> ids = deleteWhere(prototype, filters);
    if (depth < CascadeDeleter.MAX_DEPTH) cascade.run(prototype, ids, depth, constructors);
    return ids;
  }

  private List<Long> deleteWhere(Persistable prototype, Map<String, ?> filters) {
    SqlGenerator g = schemas.resolve(prototype);
    ValidationResult vf = validator.validateFilters(prototype, filters);
    if (!vf.valid()) throw new ValidationException("ValidateFilters", vf.invalidFields());

    Map<String, Object> ordered = FieldIntrospector.ordered(filters);
    return query("DELETE_MULTIPLE", prototype.descriptor().type(), g.deleteReturningIds(ordered),
        FieldIntrospector.mapBinds(prototype, ordered), rs -> {
          List<Long> ids = new ArrayList<>();
          while (rs.next()) ids.add(rs.getLong(1));
          return ids;
        });
  }

  private void cascadeFromRoot(Persistable owner, List<Long> ids, int depth, Map<String, RecordFactory<?>> constructors) {
    try {
      cascade.run(owner, ids, depth, constructors);
    } catch (PersistenceException e) {
      String type = owner.descriptor().type();
      log.error("recordbase.cascade_incomplete type={} ids={} depth={} failedOp={}", type, ids, depth, e.op(), e);
      throw new CascadeDeleteException(type, ids, e);
    }
  }

  // ---- execution ----

  @FunctionalInterface
  private interface RowsHandler<R> {
    R handle(ResultSet rs) throws SQLException;
  }

  private <R> R query(String op, String type, String sql, List<Bind> binds, RowsHandler<R> handler) {
    long start = System.nanoTime();
    debugSql(op, type, sql, binds);
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      JdbcValues.bindAll(ps, binds);
      try (ResultSet rs = ps.executeQuery()) {
        R out;
        try {
          out = handler.handle(rs);
        } catch (SQLException e) {
          throw new ScanException("DBQueryRowsScan", "Cannot read " + type + " rows: " + e.getMessage(), e);
        }
        debugDone(op, type, out, System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new QueryException("DBQuery", op + " " + type + " failed: " + e.getMessage(), e);
    }
  }

  private long update(String op, String type, String sql, List<Bind> binds) {
    long start = System.nanoTime();
    debugSql(op, type, sql, binds);
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      JdbcValues.bindAll(ps, binds);
      long n = ps.executeUpdate();
      debugDone(op, type, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new QueryException("DBQuery", op + " " + type + " failed: " + e.getMessage(), e);
    }
  }

  private static void scanRow(ResultSet rs, List<FieldSlot> slots) throws SQLException {
    for (int i = 0; i < slots.size(); i++) {
      FieldSlot s = slots.get(i);
      s.set(JdbcValues.read(rs, i + 1, s.kind()));
    }
  }

  private static long parseId(String id) {
    long key;
    try {
      key = Long.parseLong(id);
    } catch (NumberFormatException e) {
      throw new ConversionException("IDToInt", "Invalid identity '" + id + "'", e);
    }
    if (key < 0) throw new ConversionException("IDToInt", "Negative identity '" + id + "'");
    return key;
  }

  private static void debugSql(String op, String type, String sql, List<Bind> binds) {
    if (!log.isDebugEnabled()) return;
    log.debug("recordbase.jdbc op={} type={} bindCount={} sql={}", op, type, binds.size(), sql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : binds) {
        Object v = b.value();
        log.trace("recordbase.jdbc bind index={} kind={} valueType={}",
            idx++, b.kind(), v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(String op, String type, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("recordbase.jdbc_done op={} type={} durationMs={} result={}",
        op, type, durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof Boolean b) return b ? "found" : "missing";
    if (r instanceof List<?> l) return "rows=" + l.size();
    return r.getClass().getSimpleName();
  }
}
