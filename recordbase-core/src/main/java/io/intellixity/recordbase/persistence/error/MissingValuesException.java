package io.intellixity.recordbase.persistence.error;

public final class MissingValuesException extends PersistenceException {
  public MissingValuesException(String op, String message) {
    super(op, message);
  }
}
