package io.crontab;

import io.crontab.store.CrontabStore;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A user's crontab: the ordered lines of the file, with the parsed entries available as jobs.
 *
 * <p>Lines that are not cron entries are kept verbatim, so loading and saving without edits
 * preserves the file apart from trailing blank lines.
 *
 * <pre>{@code
 * Crontab tab = Crontab.load(store);
 * tab.remove(JobQuery.comment("obsolete"));
 * tab.create("backup.sh", "@daily", "nightly backup");
 * tab.save();
 * }</pre>
 */
public final class Crontab {
  private static final Logger log = LoggerFactory.getLogger(Crontab.class);

  private final CrontabStore store;
  private List<CrontabLine> lines = new ArrayList<>();
  private List<ScheduleLine> jobs = new ArrayList<>();
  private List<CrontabLine> backupLines = List.of();
  private List<ScheduleLine> backupJobs = List.of();

  private Crontab(CrontabStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Loads the crontab held by a store. A missing crontab loads as an empty one.
   *
   * @param store the store to read from and later save to
   * @return the loaded crontab
   * @throws IOException if the store cannot be read
   */
  public static Crontab load(CrontabStore store) throws IOException {
    Crontab tab = new Crontab(store);
    Optional<String> text = store.loadRawText();
    if (text.isEmpty()) {
      log.info("No crontab present, starting empty");
    } else {
      tab.read(text.get());
    }
    tab.backupLines = List.copyOf(tab.lines);
    tab.backupJobs = List.copyOf(tab.jobs);
    return tab;
  }

  /**
   * Creates a crontab with no lines, without reading the store.
   *
   * @param store the store to save to
   * @return an empty crontab
   */
  public static Crontab empty(CrontabStore store) {
    return new Crontab(store);
  }

  private void read(String text) {
    String[] rawLines = text.split("\n", -1);
    for (int i = 0; i < rawLines.length; i++) {
      String raw = rawLines[i];
      try {
        ScheduleLine job = ScheduleLine.parse(raw);
        jobs.add(job);
        lines.add(new CrontabLine.Job(job));
      } catch (CronException e) {
        if (!raw.isBlank()) {
          log.debug("Keeping line {} verbatim: {}", i + 1, e.getMessage());
        }
        lines.add(new CrontabLine.Raw(raw));
      }
    }
    truncateLines();
    log.info("Loaded crontab with {} lines, {} jobs", lines.size(), jobs.size());
  }

  /**
   * Returns all jobs in file order.
   *
   * @return a copy of the job list
   */
  public List<ScheduleLine> jobs() {
    return List.copyOf(jobs);
  }

  /**
   * Returns the jobs matching a query, in file order.
   *
   * @param query the query
   * @return the matching jobs
   */
  public List<ScheduleLine> jobs(JobQuery query) {
    return jobs.stream().filter(query).collect(Collectors.toList());
  }

  /**
   * Alias of {@link #jobs(JobQuery)}.
   *
   * @param query the query
   * @return the matching jobs
   */
  public List<ScheduleLine> find(JobQuery query) {
    return jobs(query);
  }

  /**
   * Returns every line of the file, parsed or verbatim.
   *
   * @return a copy of the line list
   */
  public List<CrontabLine> lines() {
    return List.copyOf(lines);
  }

  /**
   * Appends a job running every minute.
   *
   * @param command the command
   * @return the new job
   */
  public ScheduleLine create(String command) {
    return create(command, "");
  }

  /**
   * Appends a job running every minute.
   *
   * @param command the command
   * @param comment the comment
   * @return the new job
   */
  public ScheduleLine create(String command, String comment) {
    ScheduleLine job = ScheduleLine.of(command, comment);
    append(job);
    return job;
  }

  /**
   * Appends a job scheduled by a five-field or {@code @name} expression.
   *
   * @param command the command
   * @param when the time expression, e.g. {@code "*}{@code /5 * * * *"} or {@code "@hourly"}
   * @param comment the comment, may be empty
   * @return the new job, or empty if the expression does not parse
   */
  public Optional<ScheduleLine> create(String command, String when, String comment) {
    String line = when + " " + command.trim() + " #" + comment.trim();
    Optional<ScheduleLine> job = ScheduleLine.tryParse(line);
    if (job.isEmpty()) {
      log.debug("Not creating job, '{}' does not parse", when);
    }
    job.ifPresent(this::append);
    return job;
  }

  /**
   * Appends a job running at the minute, hour, day and month of a date-time, every year.
   *
   * @param command the command
   * @param when the date-time; seconds and year are ignored
   * @param comment the comment, may be empty
   * @return the new job
   */
  public ScheduleLine create(String command, LocalDateTime when, String comment) {
    ScheduleLine job = ScheduleLine.of(command, comment);
    job.minute().on(when.getMinute());
    job.hour().on(when.getHour());
    job.dayOfMonth().on(when.getDayOfMonth());
    job.month().on(when.getMonthValue());
    append(job);
    return job;
  }

  /**
   * Parses a line without adding it.
   *
   * @param line the raw line
   * @return the parsed job, or empty if it does not parse
   */
  public Optional<ScheduleLine> parse(String line) {
    return ScheduleLine.tryParse(line);
  }

  /**
   * Removes a job. Jobs are compared by identity.
   *
   * @param job the job to remove
   */
  public void remove(ScheduleLine job) {
    removeOne(job);
    truncateLines();
  }

  /**
   * Removes several jobs. Jobs are compared by identity.
   *
   * @param toRemove the jobs to remove
   */
  public void remove(Collection<? extends ScheduleLine> toRemove) {
    for (ScheduleLine job : List.copyOf(toRemove)) {
      removeOne(job);
    }
    truncateLines();
  }

  /**
   * Removes every job matching a query.
   *
   * @param query the query
   */
  public void remove(JobQuery query) {
    remove(jobs(query));
  }

  /** Restores the lines and jobs as they were when loaded. */
  public void reset() {
    lines = new ArrayList<>(backupLines);
    jobs = new ArrayList<>(backupJobs);
  }

  /**
   * Renders the whole crontab. Invalid jobs are written commented out.
   *
   * @return the text, ending with exactly one newline
   */
  public String render() {
    String text = lines.stream().map(CrontabLine::render).collect(Collectors.joining("\n"));
    return text.trim() + "\n";
  }

  /**
   * Writes the rendered crontab to the store.
   *
   * @throws IOException if the store cannot be written
   */
  public void save() throws IOException {
    store.saveRawText(render());
    log.info("Saved crontab with {} jobs", jobs.size());
  }

  @Override
  public String toString() {
    return render();
  }

  private void append(ScheduleLine job) {
    jobs.add(job);
    lines.add(new CrontabLine.Job(job));
  }

  private void removeOne(ScheduleLine job) {
    jobs.removeIf(j -> j == job);
    lines.removeIf(line -> line instanceof CrontabLine.Job j && j.job() == job);
  }

  /** Drops blank lines from the end. */
  private void truncateLines() {
    while (!lines.isEmpty() && lines.get(lines.size() - 1).render().isBlank()) {
      lines.remove(lines.size() - 1);
    }
  }
}
