package io.crontab;

/** The type of error that occurred while parsing a crontab line. */
public enum ErrorKind {
  /** A bare field value is neither a known name nor an in-bounds integer. */
  UNKNOWN_TIME_PART("unknown_time_part"),
  /** A range endpoint is neither a known name nor an in-bounds integer. */
  INVALID_RANGE_VALUE("invalid_range_value"),
  /** A range token matches none of the {@code *}, {@code a-b} or {@code a-b/n} forms. */
  UNKNOWN_TIME_RANGE("unknown_time_range"),
  /** The line matches neither the five-field form nor the {@code @name} form. */
  SYNTAX("syntax");

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
