package io.intellixity.recordbase.persistence.record;

import java.util.regex.Pattern;

/**
 * Optional value rules attached to a data field.\n
 *
 * Length rules apply to strings, range rules to integer kinds. {@code required} means non-empty for
 * strings and non-zero for integers. A bound of -1 (length) or null (range) is "unset".
 */
public record FieldConstraints(boolean required,
                               int minLength,
                               int maxLength,
                               Long minValue,
                               Long maxValue,
                               Pattern pattern) {
  private static final FieldConstraints NONE = new FieldConstraints(false, -1, -1, null, null, null);

  public FieldConstraints {
    if (minLength >= 0 && maxLength >= 0 && minLength > maxLength) {
      throw new IllegalArgumentException("minLength must be <= maxLength");
    }
    if (minValue != null && maxValue != null && minValue > maxValue) {
      throw new IllegalArgumentException("minValue must be <= maxValue");
    }
  }

  public static FieldConstraints none() { return NONE; }

  public FieldConstraints withRequired() {
    return new FieldConstraints(true, minLength, maxLength, minValue, maxValue, pattern);
  }

  public FieldConstraints withLength(int min, int max) {
    return new FieldConstraints(required, min, max, minValue, maxValue, pattern);
  }

  public FieldConstraints withRange(long min, long max) {
    return new FieldConstraints(required, minLength, maxLength, min, max, pattern);
  }

  public FieldConstraints withPattern(String regex) {
    return new FieldConstraints(required, minLength, maxLength, minValue, maxValue, Pattern.compile(regex));
  }

  /** Value is assumed to be accepted by {@code kind} already (or null for strings). */
  public boolean test(FieldKind kind, Object value) {
    switch (kind) {
      case STRING -> {
        String s = (String) value;
        if (s == null || s.isEmpty()) return !required;
        if (minLength >= 0 && s.length() < minLength) return false;
        if (maxLength >= 0 && s.length() > maxLength) return false;
        return pattern == null || pattern.matcher(s).matches();
      }
      case LONG, INT -> {
        long n = ((Number) value).longValue();
        if (required && n == 0) return false;
        if (minValue != null && n < minValue) return false;
        return maxValue == null || n <= maxValue;
      }
      default -> {
        return true;
      }
    }
  }
}
