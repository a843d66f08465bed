package io.intellixity.recordbase.persistence.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of a record type: name, identity field, ordered data fields and relations.\n
 *
 * Declared once per type (usually as a {@code static final} constant next to the type).
 */
public final class RecordDescriptor {
  private final String type;
  private final String identityField;
  private final Map<String, FieldDef> fields;
  private final List<RelationDef> relations;

  private RecordDescriptor(String type, String identityField, Map<String, FieldDef> fields, List<RelationDef> relations) {
    this.type = type;
    this.identityField = identityField;
    this.fields = Collections.unmodifiableMap(fields);
    this.relations = List.copyOf(relations);
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public String type() { return type; }

  public String identityField() { return identityField; }

  /** Data fields in declaration order (identity excluded). */
  public List<FieldDef> fields() { return List.copyOf(fields.values()); }

  public List<RelationDef> relations() { return relations; }

  /** Data field by name, or null (also null for the identity field). */
  public FieldDef field(String name) {
    return (name == null) ? null : fields.get(name);
  }

  public boolean isIdentity(String name) {
    return identityField.equals(name);
  }

  @Override
  public String toString() {
    return "RecordDescriptor{type=" + type + ", identity=" + identityField + ", fields=" + fields.keySet()
        + ", relations=" + relations + "}";
  }

  public static final class Builder {
    private final String type;
    private String identityField = "id";
    private final Map<String, FieldDef> fields = new LinkedHashMap<>();
    private final List<RelationDef> relations = new ArrayList<>();

    private Builder(String type) {
      if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");
      this.type = type;
    }

    public Builder identity(String name) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("identity field name is required");
      this.identityField = name;
      return this;
    }

    public Builder field(String name, FieldKind kind) {
      return field(new FieldDef(name, kind));
    }

    public Builder field(String name, FieldKind kind, FieldConstraints constraints) {
      return field(new FieldDef(name, kind, constraints));
    }

    public Builder field(FieldDef def) {
      Objects.requireNonNull(def, "def");
      if (fields.putIfAbsent(def.name(), def) != null) {
        throw new IllegalArgumentException("Duplicate field '" + def.name() + "' on type " + type);
      }
      return this;
    }

    public Builder relation(String name, String foreignKeyField) {
      relations.add(new RelationDef(name, foreignKeyField));
      return this;
    }

    public RecordDescriptor build() {
      if (fields.containsKey(identityField)) {
        throw new IllegalArgumentException("Identity field '" + identityField + "' declared as data field on type " + type);
      }
      for (RelationDef r : relations) {
        long same = relations.stream().filter(o -> o.name().equals(r.name())).count();
        if (same > 1) throw new IllegalArgumentException("Duplicate relation '" + r.name() + "' on type " + type);
      }
      return new RecordDescriptor(type, identityField, new LinkedHashMap<>(fields), relations);
    }
  }
}
