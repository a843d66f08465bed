package io.intellixity.recordbase.persistence.introspect;

import io.intellixity.recordbase.persistence.record.FieldKind;

import java.util.Objects;

/** One positional statement parameter: value plus the kind that decides how it is bound. */
public record Bind(Object value, FieldKind kind) {
  public Bind {
    Objects.requireNonNull(kind, "kind");
  }
}
