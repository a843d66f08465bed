package io.intellixity.recordbase.persistence.record;

/**
 * Capability every persisted record type implements.\n
 *
 * Field access goes through name-keyed accessors written once per type (no reflection). The identity
 * field is read and written through the same accessors using {@link RecordDescriptor#identityField()};
 * it always holds a {@code Long}.
 */
public interface Persistable {
  RecordDescriptor descriptor();

  /**
   * Current value of a field (identity or data field).\n
   *
   * @throws IllegalArgumentException for names the type does not declare
   */
  Object get(String field);

  /**
   * Assign a field. The value is already normalized to the field kind's canonical Java type.\n
   *
   * @throws IllegalArgumentException for names the type does not declare
   */
  void set(String field, Object value);
}
