package io.intellixity.recordbase.persistence.options;

import io.intellixity.recordbase.persistence.record.RecordFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param filters field predicates (equality, or IN for collection values); empty deletes every row\n
 * @param cascadeDeleteDepth current cascade depth; at the maximum depth cascading is skipped\n
 * @param constructors child factories keyed by relation name\n
 */
public record DeleteMultipleOptions(Map<String, Object> filters,
                                    int cascadeDeleteDepth,
                                    Map<String, RecordFactory<?>> constructors) {
  public DeleteMultipleOptions {
    if (cascadeDeleteDepth < 0) throw new IllegalArgumentException("cascadeDeleteDepth must be >= 0");
    filters = (filters == null) ? Map.of() : copy(filters);
    constructors = (constructors == null) ? Map.of() : Map.copyOf(constructors);
  }

  public static DeleteMultipleOptions where(Map<String, Object> filters) {
    return new DeleteMultipleOptions(filters, 0, Map.of());
  }

  public DeleteMultipleOptions withConstructors(Map<String, RecordFactory<?>> constructors) {
    return new DeleteMultipleOptions(filters, cascadeDeleteDepth, constructors);
  }

  public DeleteMultipleOptions withCascadeDeleteDepth(int depth) {
    return new DeleteMultipleOptions(filters, depth, constructors);
  }

  // Map.copyOf rejects null values; those are reported by validation instead.
  static Map<String, Object> copy(Map<String, Object> m) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(m));
  }
}
