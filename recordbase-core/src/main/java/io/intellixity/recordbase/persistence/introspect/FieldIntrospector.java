package io.intellixity.recordbase.persistence.introspect;

import io.intellixity.recordbase.persistence.record.FieldDef;
import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generic field access over {@link Persistable} records.\n
 *
 * Slot order is: identity (when requested), then data fields in descriptor order. SQL generators
 * render columns in the same order, so slot lists line up with statement parameters and result columns.
 */
public final class FieldIntrospector {
  private static final Logger log = LoggerFactory.getLogger(FieldIntrospector.class);

  private FieldIntrospector() {}

  public static List<FieldSlot> fieldSlots(Persistable record, boolean includeIdentity) {
    RecordDescriptor d = record.descriptor();
    List<FieldSlot> out = new ArrayList<>(d.fields().size() + 1);
    if (includeIdentity) out.add(identitySlot(record));
    for (FieldDef f : d.fields()) out.add(new FieldSlot(record, f.name(), f.kind()));
    return out;
  }

  public static List<Bind> fieldBinds(Persistable record, boolean includeIdentity) {
    List<FieldSlot> slots = fieldSlots(record, includeIdentity);
    List<Bind> out = new ArrayList<>(slots.size());
    for (FieldSlot s : slots) out.add(s.bind());
    return out;
  }

  public static FieldSlot identitySlot(Persistable record) {
    return new FieldSlot(record, record.descriptor().identityField(), FieldKind.LONG);
  }

  public static long identityValue(Persistable record) {
    Object v = record.get(record.descriptor().identityField());
    return (v == null) ? 0L : ((Number) v).longValue();
  }

  /**
   * Convert string values to the kinds of the record's fields.\n
   *
   * Keys the record does not declare, and values that do not parse, are left out of the result.
   * Non-string values are left out too.
   */
  public static Map<String, Object> coerceStringMap(Persistable record, Map<String, ?> values) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (values == null) return out;
    RecordDescriptor d = record.descriptor();
    for (var e : values.entrySet()) {
      FieldDef f = d.field(e.getKey());
      if (f == null) continue;
      if (!(e.getValue() instanceof String raw)) continue;
      try {
        out.put(e.getKey(), f.kind().parse(raw));
      } catch (NumberFormatException ex) {
        log.trace("recordbase.coerce dropped type={} field={} kind={}", d.type(), e.getKey(), f.kind());
      }
    }
    return out;
  }

  public static void resetFields(Persistable record) {
    for (FieldSlot s : fieldSlots(record, true)) s.set(s.kind().zero());
  }

  /** Copy of a filter/value map with keys in natural order; generators and binds both iterate this order. */
  public static Map<String, Object> ordered(Map<String, ?> map) {
    Map<String, Object> out = new TreeMap<>();
    if (map != null) out.putAll(map);
    return out;
  }

  /**
   * Binds for an (already ordered and validated) filter or value map.\n
   *
   * Collection values expand into one bind per element, matching {@code IN (?, ?, ...)} rendering.
   */
  public static List<Bind> mapBinds(Persistable record, Map<String, ?> ordered) {
    RecordDescriptor d = record.descriptor();
    List<Bind> out = new ArrayList<>();
    for (var e : ordered.entrySet()) {
      FieldDef f = d.field(e.getKey());
      if (f == null) throw new IllegalArgumentException("Unknown field '" + e.getKey() + "' on type " + d.type());
      Object v = e.getValue();
      if (v instanceof Collection<?> c) {
        for (Object o : c) out.add(new Bind(f.kind().normalize(o), f.kind()));
      } else {
        out.add(new Bind(v == null ? null : f.kind().normalize(v), f.kind()));
      }
    }
    return out;
  }
}
