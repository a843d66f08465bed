package io.intellixity.recordbase.persistence.options;

import io.intellixity.recordbase.persistence.record.RecordFactory;

import java.util.Map;

/**
 * @param constructors child factories keyed by relation name; relations without an entry are not cascaded\n
 */
public record DeleteOptions(Map<String, RecordFactory<?>> constructors) {
  public DeleteOptions {
    constructors = (constructors == null) ? Map.of() : Map.copyOf(constructors);
  }

  public static DeleteOptions defaults() { return new DeleteOptions(Map.of()); }

  public static DeleteOptions cascading(Map<String, RecordFactory<?>> constructors) {
    return new DeleteOptions(constructors);
  }
}
