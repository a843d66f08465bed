package io.intellixity.recordbase.persistence.record;

/**
 * Primitive kinds a data field may declare.\n
 *
 * Each kind knows its zero value, which Java values it accepts, and how to parse its string form.
 */
public enum FieldKind {
  LONG(0L) {
    @Override public boolean accepts(Object value) {
      return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    @Override public Object parse(String raw) { return Long.parseLong(raw); }

    @Override public Object normalize(Object value) { return ((Number) value).longValue(); }
  },
  INT(0) {
    @Override public boolean accepts(Object value) {
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) return true;
      if (value instanceof Long l) return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
      return false;
    }

    @Override public Object parse(String raw) { return Integer.parseInt(raw); }

    @Override public Object normalize(Object value) { return ((Number) value).intValue(); }
  },
  STRING("") {
    @Override public boolean accepts(Object value) { return value instanceof String; }

    @Override public Object parse(String raw) { return raw; }

    @Override public Object normalize(Object value) { return value; }
  },
  BOOLEAN(false) {
    @Override public boolean accepts(Object value) { return value instanceof Boolean; }

    /** Only the exact string {@code "true"} is true; everything else is false. */
    @Override public Object parse(String raw) { return "true".equals(raw); }

    @Override public Object normalize(Object value) { return value; }
  };

  private final Object zero;

  FieldKind(Object zero) {
    this.zero = zero;
  }

  public Object zero() { return zero; }

  public abstract boolean accepts(Object value);

  /** @throws NumberFormatException when the string is not a valid value of this kind */
  public abstract Object parse(String raw);

  /** Widen/narrow an accepted value to the kind's canonical Java type. */
  public abstract Object normalize(Object value);
}
