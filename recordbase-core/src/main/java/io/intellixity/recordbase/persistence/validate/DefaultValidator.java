package io.intellixity.recordbase.persistence.validate;

import io.intellixity.recordbase.persistence.introspect.FieldIntrospector;
import io.intellixity.recordbase.persistence.query.SortField;
import io.intellixity.recordbase.persistence.record.FieldDef;
import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default field validation.\n
 *
 * Validates:\n
 * - keys against the record's data fields (identity is not assignable or filterable)\n
 * - values against field kinds\n
 * - values against {@link io.intellixity.recordbase.persistence.record.FieldConstraints} (records and assignments only)\n
 * - sort fields\n
 */
public final class DefaultValidator implements Validator {
  @Override
  public ValidationResult validateRecord(Persistable record) {
    Objects.requireNonNull(record, "record");
    RecordDescriptor d = record.descriptor();
    List<String> invalid = new ArrayList<>();
    if (FieldIntrospector.identityValue(record) < 0) invalid.add(d.identityField());
    for (FieldDef f : d.fields()) {
      if (!isValidAssignment(f, record.get(f.name()))) invalid.add(f.name());
    }
    return ValidationResult.of(invalid);
  }

  @Override
  public ValidationResult validateValues(Persistable record, Map<String, ?> values) {
    Objects.requireNonNull(record, "record");
    if (values == null || values.isEmpty()) return ValidationResult.ok();
    RecordDescriptor d = record.descriptor();
    List<String> invalid = new ArrayList<>();
    for (var e : values.entrySet()) {
      FieldDef f = d.field(e.getKey());
      if (f == null || !isValidAssignment(f, e.getValue())) invalid.add(String.valueOf(e.getKey()));
    }
    return ValidationResult.of(invalid);
  }

  @Override
  public ValidationResult validateFilters(Persistable record, Map<String, ?> filters) {
    Objects.requireNonNull(record, "record");
    if (filters == null || filters.isEmpty()) return ValidationResult.ok();
    RecordDescriptor d = record.descriptor();
    List<String> invalid = new ArrayList<>();
    for (var e : filters.entrySet()) {
      FieldDef f = d.field(e.getKey());
      if (f == null || !isValidPredicate(f, e.getValue())) invalid.add(String.valueOf(e.getKey()));
    }
    return ValidationResult.of(invalid);
  }

  @Override
  public ValidationResult validateOrder(Persistable record, List<SortField> order) {
    Objects.requireNonNull(record, "record");
    if (order == null || order.isEmpty()) return ValidationResult.ok();
    RecordDescriptor d = record.descriptor();
    List<String> invalid = new ArrayList<>();
    for (SortField sf : order) {
      if (sf == null) continue;
      if (!d.isIdentity(sf.field()) && d.field(sf.field()) == null) invalid.add(sf.field());
    }
    return ValidationResult.of(invalid);
  }

  private static boolean isValidAssignment(FieldDef f, Object value) {
    if (value == null) {
      // null strings persist as NULL; primitive kinds have no null
      return f.kind() == FieldKind.STRING && !f.constraints().required();
    }
    if (!f.kind().accepts(value)) return false;
    return f.constraints().test(f.kind(), f.kind().normalize(value));
  }

  private static boolean isValidPredicate(FieldDef f, Object value) {
    if (value instanceof Collection<?> c) {
      for (Object o : c) {
        if (o == null || !f.kind().accepts(o)) return false;
      }
      return true;
    }
    return value != null && f.kind().accepts(value);
  }
}
