package io.crontab;

import io.crontab.ast.FieldSpec;
import java.util.Optional;

/** Exception thrown when a crontab line, field or range token cannot be parsed. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The field the token was parsed against, if any. */
  private final FieldSpec field;

  /** The offending token or line. */
  private final String token;

  private CronException(ErrorKind kind, String message, FieldSpec field, String token) {
    super(message);
    this.kind = kind;
    this.field = field;
    this.token = token;
  }

  /**
   * Creates an error for a bare field value that cannot be resolved.
   *
   * @param field the field being parsed
   * @param token the offending token
   * @return a new CronException of kind {@link ErrorKind#UNKNOWN_TIME_PART}
   */
  public static CronException unknownTimePart(FieldSpec field, String token) {
    return new CronException(
        ErrorKind.UNKNOWN_TIME_PART,
        "unknown cron time part for " + field.label() + ": " + token,
        field,
        token);
  }

  /**
   * Creates an error for a range endpoint that cannot be resolved.
   *
   * @param field the field being parsed
   * @param token the offending endpoint
   * @return a new CronException of kind {@link ErrorKind#INVALID_RANGE_VALUE}
   */
  public static CronException invalidRangeValue(FieldSpec field, String token) {
    return new CronException(
        ErrorKind.INVALID_RANGE_VALUE,
        "invalid range value for " + field.label() + ": " + token,
        field,
        token);
  }

  /**
   * Creates an error for a range token of unknown shape.
   *
   * @param field the field being parsed
   * @param token the offending range token
   * @return a new CronException of kind {@link ErrorKind#UNKNOWN_TIME_RANGE}
   */
  public static CronException unknownTimeRange(FieldSpec field, String token) {
    return new CronException(
        ErrorKind.UNKNOWN_TIME_RANGE,
        "unknown time range value for " + field.label() + ": " + token,
        field,
        token);
  }

  /**
   * Creates an error for a line that is not a cron entry.
   *
   * @param message the error message
   * @param line the offending line
   * @return a new CronException of kind {@link ErrorKind#SYNTAX}
   */
  public static CronException syntax(String message, String line) {
    return new CronException(ErrorKind.SYNTAX, message, null, line);
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
   * Returns the field the token was parsed against, if available.
   *
   * @return the field, or empty for line-level errors
   */
  public Optional<FieldSpec> field() {
    return Optional.ofNullable(field);
  }

  /**
   * Returns the offending token, or the whole line for syntax errors.
   *
   * @return the token, or empty if not available
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /**
   * Formats the message prefixed the way command-line tools report errors.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    return "error[" + kind + "]: " + getMessage();
  }
}
