package io.intellixity.recordbase.persistence.introspect;

import io.intellixity.recordbase.persistence.record.FieldKind;
import io.intellixity.recordbase.persistence.record.Persistable;

import java.util.Objects;

/** Addressable field of one record instance; used as bind source and as scan target. */
public record FieldSlot(Persistable owner, String name, FieldKind kind) {
  public FieldSlot {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
  }

  public Object get() {
    return owner.get(name);
  }

  public void set(Object value) {
    owner.set(name, value == null ? null : kind.normalize(value));
  }

  public Bind bind() {
    Object v = get();
    return new Bind(v == null ? null : kind.normalize(v), kind);
  }
}
