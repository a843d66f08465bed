package io.intellixity.recordbase.persistence.error;

import java.util.List;

/**
 * A record, filter map or value map failed validation.\n
 *
 * Carries the offending field names (unknown keys, wrong-typed values or violated constraints).
 */
public final class ValidationException extends PersistenceException {
  private final List<String> fields;

  public ValidationException(String op, List<String> fields) {
    super(op, "Invalid fields: " + fields);
    this.fields = List.copyOf(fields);
  }

  public List<String> fields() { return fields; }
}
