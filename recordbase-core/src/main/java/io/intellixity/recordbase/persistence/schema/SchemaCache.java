package io.intellixity.recordbase.persistence.schema;

import io.intellixity.recordbase.persistence.error.SchemaException;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link SqlGenerator} per record type name.\n
 *
 * Generators are created lazily on first {@link #resolve}, or explicitly through {@link #register}, and are
 * replaced only by a forced re-registration. Reads are lock-free; registration is serialized so that a type
 * is never built twice concurrently.
 */
public final class SchemaCache {
  private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

  private final SqlGeneratorFactory factory;
  private final String tablePrefix;
  private final Map<String, SqlGenerator> generators = new ConcurrentHashMap<>();

  public SchemaCache(SqlGeneratorFactory factory, String tablePrefix) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.tablePrefix = (tablePrefix == null) ? "" : tablePrefix;
  }

  public SchemaCache(SqlGeneratorFactory factory) {
    this(factory, "");
  }

  public String tablePrefix() { return tablePrefix; }

  /** Cached generator for the record's type; registers the type on first use. */
  public SqlGenerator resolve(Persistable record) {
    Objects.requireNonNull(record, "record");
    String type = record.descriptor().type();
    SqlGenerator g = generators.get(type);
    if (g != null) return g;
    try {
      register(record, null, false);
    } catch (SchemaException e) {
      throw new SchemaException("ResolveSchema", "Cannot resolve schema for " + type + ": " + e.getMessage(), e);
    }
    return generators.get(type);
  }

  /**
   * Build and cache the generator for {@code record}'s type.\n
   *
   * With a {@code parent}, the generator reads and writes the parent's table (projection records).
   * An existing entry is kept unless {@code overwrite} is set.
   *
   * @throws SchemaException when the generator cannot be built
   */
  public synchronized void register(Persistable record, Persistable parent, boolean overwrite) {
    Objects.requireNonNull(record, "record");
    RecordDescriptor d = record.descriptor();
    if (!overwrite && generators.containsKey(d.type())) return;

    GeneratorOptions options;
    if (parent == null) {
      options = GeneratorOptions.withPrefix(tablePrefix);
    } else {
      SqlGenerator source = resolve(parent);
      options = new GeneratorOptions(tablePrefix, parent.descriptor().type(), source);
    }

    SqlGenerator g;
    try {
      g = factory.create(d, options);
    } catch (RuntimeException e) {
      throw new SchemaException("RegisterSchema", "Cannot build schema for " + d.type() + ": " + e.getMessage(), e);
    }
    if (g == null) throw new SchemaException("RegisterSchema", "Generator factory returned null for " + d.type());
    generators.put(d.type(), g);
    if (log.isDebugEnabled()) {
      log.debug("recordbase.schema registered type={} table={} parent={} overwrite={}",
          d.type(), g.table(), parent == null ? null : parent.descriptor().type(), overwrite);
    }
  }

  public boolean isRegistered(String type) {
    return type != null && generators.containsKey(type);
  }

  /**
   * Field name mapped to a database column.\n
   *
   * @throws SchemaException for columns the type does not map
   */
  public String fieldNameForColumn(Persistable record, String column) {
    SqlGenerator g = resolve(record);
    String field = g.fieldForColumn(column);
    if (field == null) {
      throw new SchemaException("FieldForColumn", "No field for column '" + column + "' on type " + record.descriptor().type());
    }
    return field;
  }
}
