package io.crontab.ast;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The command part of a cron line.
 *
 * @param text the command, trimmed
 */
public record Command(String text) {
  /** Trims the command text. */
  public Command {
    text = Objects.requireNonNull(text, "text").trim();
  }

  /**
   * Tests whether the command contains the given text.
   *
   * @param fragment the text to look for
   * @return true if the command contains {@code fragment}
   */
  public boolean match(String fragment) {
    return text.contains(fragment);
  }

  /**
   * Tests whether the pattern occurs anywhere in the command.
   *
   * @param pattern the pattern to look for
   * @return true if the pattern is found
   */
  public boolean match(Pattern pattern) {
    return pattern.matcher(text).find();
  }

  @Override
  public String toString() {
    return text;
  }
}
