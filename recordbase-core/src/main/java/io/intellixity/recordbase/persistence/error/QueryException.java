package io.intellixity.recordbase.persistence.error;

/** Statement execution failed in the database driver. */
public final class QueryException extends PersistenceException {
  public QueryException(String op, String message, Throwable cause) {
    super(op, message, cause);
  }
}
