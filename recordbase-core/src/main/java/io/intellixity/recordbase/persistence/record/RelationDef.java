package io.intellixity.recordbase.persistence.record;

/**
 * One-to-many link from a parent record type to a child type, followed by cascading delete.\n
 *
 * @param name relation name; the key callers use in a constructors map to supply the child factory\n
 * @param foreignKeyField data field on the child type holding the parent's identity\n
 */
public record RelationDef(String name, String foreignKeyField) {
  public RelationDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("relation name is required");
    if (foreignKeyField == null || foreignKeyField.isBlank()) {
      throw new IllegalArgumentException("foreignKeyField is required for relation '" + name + "'");
    }
  }
}
