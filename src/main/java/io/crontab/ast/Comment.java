package io.crontab.ast;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The trailing comment of a cron line, without the {@code #} marker.
 *
 * @param text the comment, trimmed; empty when the line has none
 */
public record Comment(String text) {
  /** Trims the comment text. */
  public Comment {
    text = Objects.requireNonNull(text, "text").trim();
  }

  /**
   * Returns a comment with no text.
   *
   * @return an empty comment
   */
  public static Comment none() {
    return new Comment("");
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  /**
   * Tests whether the comment contains the given text.
   *
   * @param fragment the text to look for
   * @return true if the comment contains {@code fragment}
   */
  public boolean match(String fragment) {
    return text.contains(fragment);
  }

  /**
   * Tests whether the pattern occurs anywhere in the comment.
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
