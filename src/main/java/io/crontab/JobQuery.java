package io.crontab;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Selects jobs by command and/or comment.
 *
 * <p>Plain strings match as substrings; patterns match if found anywhere. An empty query matches
 * every job.
 *
 * <pre>{@code
 * tab.jobs(JobQuery.command("backup").andComment(Pattern.compile("^nightly")));
 * }</pre>
 */
public final class JobQuery implements Predicate<ScheduleLine> {
  private static final JobQuery ALL = new JobQuery(null, null);

  private final Predicate<ScheduleLine> command;
  private final Predicate<ScheduleLine> comment;

  private JobQuery(Predicate<ScheduleLine> command, Predicate<ScheduleLine> comment) {
    this.command = command;
    this.comment = comment;
  }

  /**
   * Returns a query matching every job.
   *
   * @return the empty query
   */
  public static JobQuery all() {
    return ALL;
  }

  public static JobQuery command(String fragment) {
    return ALL.andCommand(fragment);
  }

  public static JobQuery command(Pattern pattern) {
    return ALL.andCommand(pattern);
  }

  public static JobQuery comment(String fragment) {
    return ALL.andComment(fragment);
  }

  public static JobQuery comment(Pattern pattern) {
    return ALL.andComment(pattern);
  }

  /**
   * Returns a copy of this query that also requires the command to contain {@code fragment}.
   *
   * @param fragment the text to look for
   * @return a new query
   */
  public JobQuery andCommand(String fragment) {
    Objects.requireNonNull(fragment, "fragment");
    return withCommand(job -> job.commandPart().match(fragment));
  }

  /**
   * Returns a copy of this query that also requires {@code pattern} to occur in the command.
   *
   * @param pattern the pattern to look for
   * @return a new query
   */
  public JobQuery andCommand(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return withCommand(job -> job.commandPart().match(pattern));
  }

  /**
   * Returns a copy of this query that also requires the comment to contain {@code fragment}.
   *
   * @param fragment the text to look for
   * @return a new query
   */
  public JobQuery andComment(String fragment) {
    Objects.requireNonNull(fragment, "fragment");
    return withComment(job -> job.commentPart().match(fragment));
  }

  /**
   * Returns a copy of this query that also requires {@code pattern} to occur in the comment.
   *
   * @param pattern the pattern to look for
   * @return a new query
   */
  public JobQuery andComment(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return withComment(job -> job.commentPart().match(pattern));
  }

  private JobQuery withCommand(Predicate<ScheduleLine> p) {
    return new JobQuery(command == null ? p : command.and(p), comment);
  }

  private JobQuery withComment(Predicate<ScheduleLine> p) {
    return new JobQuery(command, comment == null ? p : comment.and(p));
  }

  public boolean isEmpty() {
    return command == null && comment == null;
  }

  @Override
  public boolean test(ScheduleLine job) {
    if (command != null && !command.test(job)) {
      return false;
    }
    return comment == null || comment.test(job);
  }
}
