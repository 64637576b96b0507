package io.crontab.ast;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * One of the five positional slots of a cron line, with its inclusive bounds and optional name
 * enumeration.
 *
 * <p>Declaration order is the order of the fields on a cron line.
 */
public enum FieldSpec {
  MINUTE("Minute", 0, 59, List.of()),
  HOUR("Hours", 0, 23, List.of()),
  DAY_OF_MONTH("Day of Month", 1, 31, List.of()),
  MONTH(
      "Month",
      1,
      12,
      List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec")),
  // 7 is also Sunday; the name sun resolves to its first position, 0
  DAY_OF_WEEK("Day of Week", 0, 7, List.of("sun", "mon", "tue", "wed", "thu", "fri", "sat", "sun"));

  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  private final String label;
  private final int min;
  private final int max;
  private final List<String> names;

  FieldSpec(String label, int min, int max, List<String> names) {
    this.label = label;
    this.min = min;
    this.max = max;
    this.names = names;
  }

  /**
   * Returns the human readable name used in error messages.
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the smallest value this field accepts.
   *
   * @return the inclusive lower bound
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest value this field accepts.
   *
   * @return the inclusive upper bound
   */
  public int max() {
    return max;
  }

  /**
   * Returns the lowercase value names, in value order, or an empty list when the field has none.
   *
   * @return the name enumeration
   */
  public List<String> names() {
    return names;
  }

  /**
   * Checks whether a value lies within this field's bounds.
   *
   * @param value the value to check
   * @return true if {@code min <= value <= max}
   */
  public boolean contains(int value) {
    return value >= min && value <= max;
  }

  /**
   * Resolves a value token: a name from the enumeration (case insensitive) or a base-10 integer.
   *
   * <p>A name resolves to {@code min + position} of its first occurrence, so {@code jan} is 1 and
   * {@code sun} is always 0; Sunday as 7 can only be written numerically. Integers are ASCII
   * digits only, without sign.
   *
   * @param token the token to resolve
   * @return the value, or empty if the token is unknown or out of bounds
   */
  public OptionalInt resolve(String token) {
    int index = names.indexOf(token.toLowerCase());
    int value;
    if (index >= 0) {
      value = min + index;
    } else if (!DIGITS.matcher(token).matches()) {
      return OptionalInt.empty();
    } else {
      try {
        value = Integer.parseInt(token);
      } catch (NumberFormatException e) {
        return OptionalInt.empty();
      }
    }
    return contains(value) ? OptionalInt.of(value) : OptionalInt.empty();
  }

  /**
   * Returns the fields in cron line order.
   *
   * @return minute, hour, day of month, month, day of week
   */
  public static List<FieldSpec> lineOrder() {
    return List.of(values());
  }
}
