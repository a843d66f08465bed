package io.intellixity.recordbase.examples.domain;

import io.intellixity.recordbase.persistence.record.FieldConstraints;
import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordDescriptor;

public final class Person implements Persistable {
  public static final RecordDescriptor DESCRIPTOR = RecordDescriptor.builder("Person")
      .field("name", FieldKind.STRING, FieldConstraints.none().withRequired().withLength(1, 80))
      .field("email", FieldKind.STRING, FieldConstraints.none().withPattern("[^@\\s]+@[^@\\s]+"))
      .field("age", FieldKind.INT, FieldConstraints.none().withRange(0, 150))
      .field("active", FieldKind.BOOLEAN)
      .field("groupId", FieldKind.LONG)
      .build();

  private long id;
  private String name = "";
  private String email = "";
  private int age;
  private boolean active;
  private long groupId;

  public long id() { return id; }
  public Person id(long id) { this.id = id; return this; }

  public String name() { return name; }
  public Person name(String name) { this.name = name; return this; }

  public String email() { return email; }
  public Person email(String email) { this.email = email; return this; }

  public int age() { return age; }
  public Person age(int age) { this.age = age; return this; }

  public boolean active() { return active; }
  public Person active(boolean active) { this.active = active; return this; }

  public long groupId() { return groupId; }
  public Person groupId(long groupId) { this.groupId = groupId; return this; }

  @Override public RecordDescriptor descriptor() { return DESCRIPTOR; }

  @Override
  public Object get(String field) {
    return switch (field) {
      case "id" -> id;
      case "name" -> name;
      case "email" -> email;
      case "age" -> age;
      case "active" -> active;
      case "groupId" -> groupId;
      default -> throw new IllegalArgumentException("Unknown Person field: " + field);
    };
  }

  @Override
  public void set(String field, Object value) {
    switch (field) {
      case "id" -> id = (Long) value;
      case "name" -> name = (String) value;
      case "email" -> email = (String) value;
      case "age" -> age = (Integer) value;
      case "active" -> active = (Boolean) value;
      case "groupId" -> groupId = (Long) value;
      default -> throw new IllegalArgumentException("Unknown Person field: " + field);
    }
  }
}
