package io.intellixity.recordbase.persistence.error;

/** A result row could not be bound into record fields. */
public final class ScanException extends PersistenceException {
  public ScanException(String op, String message, Throwable cause) {
    super(op, message, cause);
  }
}
