package io.intellixity.recordbase.examples.domain;

import io.intellixity.recordbase.persistence.record.FieldConstraints;
import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;

/** A named group of persons. Deleting a group with the "persons" constructor deletes its members. */
public final class Group implements Persistable {
  public static final String PERSONS = "persons";

  public static final RecordDescriptor DESCRIPTOR = RecordDescriptor.builder("Group")
      .field("name", FieldKind.STRING, FieldConstraints.none().withRequired().withLength(1, 80))
      .relation(PERSONS, "groupId")
      .build();

  private long id;
  private String name = "";

  public long id() { return id; }
  public Group id(long id) { this.id = id; return this; }

  public String name() { return name; }
  public Group name(String name) { this.name = name; return this; }

  @Override public RecordDescriptor descriptor() { return DESCRIPTOR; }

  @Override
  public Object get(String field) {
    return switch (field) {
      case "id" -> id;
      case "name" -> name;
      default -> throw new IllegalArgumentException("Unknown Group field: " + field);
    };
  }

  @Override
  public void set(String field, Object value) {
    switch (field) {
      case "id" -> id = (Long) value;
      case "name" -> name = (String) value;
      default -> throw new IllegalArgumentException("Unknown Group field: " + field);
    }
  }
}
