package io.intellixity.recordbase.persistence.error;

/** A record type's schema handle could not be derived or resolved. */
public final class SchemaException extends PersistenceException {
  public SchemaException(String op, String message) {
    super(op, message);
  }

  public SchemaException(String op, String message, Throwable cause) {
    super(op, message, cause);
  }
}
