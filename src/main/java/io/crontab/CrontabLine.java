package io.crontab;

import java.util.Objects;

/**
 * One line of a crontab file.
 *
 * <ul>
 *   <li>{@link Job} - a parsed cron entry
 *   <li>{@link Raw} - anything else, kept verbatim: blank lines, comments, unparseable entries
 * </ul>
 */
public sealed interface CrontabLine permits CrontabLine.Job, CrontabLine.Raw {

  /**
   * Renders this line as it is written back to the crontab.
   *
   * @return the line text
   */
  String render();

  /**
   * A parsed entry. Invalid entries are written commented out.
   *
   * @param job the entry
   */
  record Job(ScheduleLine job) implements CrontabLine {
    public Job {
      Objects.requireNonNull(job, "job");
    }

    @Override
    public String render() {
      return job.isValid() ? job.render() : "# " + job.render();
    }
  }

  /**
   * A line kept exactly as it was read.
   *
   * @param text the line
   */
  record Raw(String text) implements CrontabLine {
    public Raw {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String render() {
      return text;
    }
  }
}
