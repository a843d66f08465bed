package io.intellixity.recordbase.persistence.validate;

import java.util.List;

public record ValidationResult(boolean valid, List<String> invalidFields) {
  private static final ValidationResult OK = new ValidationResult(true, List.of());

  public ValidationResult {
    invalidFields = (invalidFields == null) ? List.of() : List.copyOf(invalidFields);
  }

  public static ValidationResult ok() { return OK; }

  public static ValidationResult of(List<String> invalidFields) {
    return invalidFields.isEmpty() ? OK : new ValidationResult(false, invalidFields);
  }
}
