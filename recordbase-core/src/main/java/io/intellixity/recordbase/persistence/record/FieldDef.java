package io.intellixity.recordbase.persistence.record;

import java.util.Objects;

public record FieldDef(String name, FieldKind kind, FieldConstraints constraints) {
  public FieldDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is required");
    Objects.requireNonNull(kind, "kind");
    constraints = (constraints == null) ? FieldConstraints.none() : constraints;
  }

  public FieldDef(String name, FieldKind kind) {
    this(name, kind, FieldConstraints.none());
  }
}
