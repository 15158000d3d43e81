package io.anchor;

import java.util.Optional;

/**
 * Exception thrown when a recurrence rule is malformed or cannot be decoded.
 *
 * <p>Unchecked, since rule records validate in their canonical constructors.
 */
public final class RecurrenceException extends RuntimeException {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending field, if the error concerns a single field. */
  private final String field;

  private RecurrenceException(ErrorKind kind, String message, String field, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.field = field;
  }

  /**
   * Creates a new rule construction error.
   *
   * @param field the name of the invalid field
   * @param message the error message
   * @return a new RecurrenceException for an invalid rule
   */
  public static RecurrenceException invalidRule(String field, String message) {
    return new RecurrenceException(ErrorKind.INVALID_RULE, message, field, null);
  }

  /**
   * Creates a new decode error.
   *
   * @param message the error message
   * @return a new RecurrenceException for a decode error
   */
  public static RecurrenceException decode(String message) {
    return new RecurrenceException(ErrorKind.DECODE, message, null, null);
  }

  /**
   * Creates a new decode error caused by another exception.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new RecurrenceException for a decode error
   */
  public static RecurrenceException decode(String message, Throwable cause) {
    return new RecurrenceException(ErrorKind.DECODE, message, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the name of the invalid field, if available.
   *
   * @return the field name, or empty if not available
   */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }

  /**
   * Formats the message prefixed with its kind and field, e.g. {@code invalid_rule(interval):
   * interval must be at least 1}.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder(kind.value());
    if (field != null) {
      sb.append('(').append(field).append(')');
    }
    return sb.append(": ").append(getMessage()).toString();
  }
}
