package io.crontab.ast;

/**
 * One comma-separated element of a time field.
 *
 * <ul>
 *   <li>{@link TimeValue} - a single value, e.g. {@code 5}
 *   <li>{@link TimeRange} - a span with a step, e.g. {@code 9-17/2} or {@code *}
 * </ul>
 */
public sealed interface TimeComponent permits TimeValue, TimeRange {
  /**
   * Renders this component as it appears in a cron field.
   *
   * @return the cron text
   */
  String render();
}
