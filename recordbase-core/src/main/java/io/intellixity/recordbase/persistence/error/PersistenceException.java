package io.intellixity.recordbase.persistence.error;

/**
 * Base of every failure raised by the persistence controller.\n
 *
 * {@link #op()} names the step that failed (e.g. {@code Validate}, {@code DBQuery}, {@code IDToInt}), so
 * callers can branch on it without parsing messages.
 */
public class PersistenceException extends RuntimeException {
  private final String op;

  public PersistenceException(String op, String message) {
    super(message);
    this.op = op;
  }

  public PersistenceException(String op, String message, Throwable cause) {
    super(message, cause);
    this.op = op;
  }

  public String op() { return op; }
}
