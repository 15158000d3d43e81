package io.anchor;

/** The type of error raised while building or decoding a recurrence rule. */
public enum ErrorKind {
  /** Rule construction error - a parameter violates the rule's invariants. */
  INVALID_RULE("invalid_rule"),
  /** Decode error - a persisted rule could not be read back. */
  DECODE("decode");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
