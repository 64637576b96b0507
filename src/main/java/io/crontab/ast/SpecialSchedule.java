package io.crontab.ast;

import java.util.Optional;

/**
 * The {@code @name} shortcuts a crontab line may use instead of five time fields.
 *
 * <p>Declaration order is significant: when a rendered five-field expression equals the expansion
 * of more than one shortcut, the one declared first is used. {@code daily} therefore wins over
 * {@code midnight}, and {@code yearly} over {@code annually}.
 */
public enum SpecialSchedule {
  REBOOT("reboot", "@reboot"),
  HOURLY("hourly", "0 * * * *"),
  DAILY("daily", "0 0 * * *"),
  WEEKLY("weekly", "0 0 * * 0"),
  MONTHLY("monthly", "0 0 1 * *"),
  YEARLY("yearly", "0 0 1 1 *"),
  ANNUALLY("annually", "0 0 1 1 *"),
  MIDNIGHT("midnight", "0 0 * * *");

  private final String shortcutName;
  private final String expansion;

  SpecialSchedule(String shortcutName, String expansion) {
    this.shortcutName = shortcutName;
    this.expansion = expansion;
  }

  /**
   * Returns the shortcut name without the leading {@code @}.
   *
   * @return the name, e.g. {@code daily}
   */
  public String shortcutName() {
    return shortcutName;
  }

  /**
   * Returns what the shortcut stands for: a five-field expression, or a literal marker.
   *
   * @return the expansion
   */
  public String expansion() {
    return expansion;
  }

  /**
   * Returns true if the expansion is a literal marker rather than five time fields.
   *
   * @return true for {@code @reboot}
   */
  public boolean isMarker() {
    return expansion.startsWith("@");
  }

  /**
   * Returns the expansion split into its five field tokens.
   *
   * @return the field tokens in line order
   * @throws IllegalStateException if this shortcut is a marker
   */
  public String[] fieldTokens() {
    if (isMarker()) {
      throw new IllegalStateException("@" + shortcutName + " has no time fields");
    }
    return expansion.split(" ");
  }

  @Override
  public String toString() {
    return "@" + shortcutName;
  }

  /**
   * Looks up a shortcut by name (case sensitive, without the leading {@code @}).
   *
   * @param name the name to look up
   * @return the shortcut if known
   */
  public static Optional<SpecialSchedule> parse(String name) {
    for (SpecialSchedule s : values()) {
      if (s.shortcutName.equals(name)) {
        return Optional.of(s);
      }
    }
    return Optional.empty();
  }

  /**
   * Finds the first declared shortcut whose expansion equals the given time expression.
   *
   * @param time a rendered time expression or marker
   * @return the first matching shortcut, or empty if none matches
   */
  public static Optional<SpecialSchedule> forExpansion(String time) {
    for (SpecialSchedule s : values()) {
      if (s.expansion.equals(time)) {
        return Optional.of(s);
      }
    }
    return Optional.empty();
  }
}
