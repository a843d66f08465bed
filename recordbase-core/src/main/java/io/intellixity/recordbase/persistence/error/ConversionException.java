package io.intellixity.recordbase.persistence.error;

/** Malformed identity string. */
public final class ConversionException extends PersistenceException {
  public ConversionException(String op, String message, Throwable cause) {
    super(op, message, cause);
  }

  public ConversionException(String op, String message) {
    super(op, message);
  }
}
