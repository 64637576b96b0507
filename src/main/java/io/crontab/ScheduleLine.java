package io.crontab;

import io.crontab.ast.Command;
import io.crontab.ast.Comment;
import io.crontab.ast.FieldSpec;
import io.crontab.ast.LineData;
import io.crontab.ast.SpecialSchedule;
import io.crontab.ast.TimeField;
import io.crontab.display.Display;
import io.crontab.parser.Parser;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One cron entry: five time fields, a command and an optional comment.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ScheduleLine line = ScheduleLine.parse("0 0 * * * backup.sh #nightly");
 * line.hour().clear();
 * line.hour().on(2);
 * System.out.println(line.render()); // 0 2 * * * backup.sh #nightly
 * }</pre>
 *
 * <p>Fields, command and comment are mutable; the validity flag is fixed at construction and
 * {@link #render()} always reflects the current state.
 */
public final class ScheduleLine {
  private final Map<FieldSpec, TimeField> fields = new EnumMap<>(FieldSpec.class);
  private final boolean valid;
  private Command command;
  private Comment comment;
  private SpecialSchedule marker;

  private ScheduleLine(LineData data, boolean valid) {
    for (TimeField field : data.fields()) {
      fields.put(field.spec(), field);
    }
    this.command = data.command();
    this.comment = data.comment();
    this.marker = data.marker();
    this.valid = valid;
  }

  /**
   * Parses a crontab line.
   *
   * @param line the raw line
   * @return the parsed line, always valid
   * @throws CronException if the line is not a cron entry or a field is invalid
   */
  public static ScheduleLine parse(String line) throws CronException {
    return new ScheduleLine(Parser.parseLine(line), true);
  }

  /**
   * Parses a crontab line, returning empty instead of throwing.
   *
   * <p>An empty result means the line must be kept verbatim by the caller.
   *
   * @param line the raw line
   * @return the parsed line, or empty if it does not parse
   */
  public static Optional<ScheduleLine> tryParse(String line) {
    try {
      return Optional.of(parse(line));
    } catch (CronException e) {
      return Optional.empty();
    }
  }

  /**
   * Validates a crontab line without throwing.
   *
   * @param line the raw line
   * @return true if the line parses
   */
  public static boolean validate(String line) {
    return tryParse(line).isPresent();
  }

  /**
   * Creates a line running {@code command} every minute, ready for its fields to be set.
   *
   * <p>The line is valid only if the command is not blank.
   *
   * @param command the command
   * @param comment the comment, may be empty
   * @return a new line rendering as {@code * * * * * command}
   */
  public static ScheduleLine of(String command, String comment) {
    Command c = new Command(command);
    return new ScheduleLine(LineData.of(c, new Comment(comment)), !c.text().isEmpty());
  }

  /**
   * Creates a line with no comment.
   *
   * @param command the command
   * @return a new line
   * @see #of(String, String)
   */
  public static ScheduleLine of(String command) {
    return of(command, "");
  }

  /**
   * Returns true if this line was parsed from a recognized grammar, or created with a command.
   *
   * @return the validity captured at construction
   */
  public boolean isValid() {
    return valid;
  }

  public TimeField minute() {
    return fields.get(FieldSpec.MINUTE);
  }

  public TimeField hour() {
    return fields.get(FieldSpec.HOUR);
  }

  public TimeField dayOfMonth() {
    return fields.get(FieldSpec.DAY_OF_MONTH);
  }

  public TimeField month() {
    return fields.get(FieldSpec.MONTH);
  }

  public TimeField dayOfWeek() {
    return fields.get(FieldSpec.DAY_OF_WEEK);
  }

  /**
   * Returns the field for a slot.
   *
   * @param spec the slot
   * @return the field
   */
  public TimeField field(FieldSpec spec) {
    return fields.get(spec);
  }

  /**
   * Returns the marker shortcut this line uses instead of time fields, such as {@code @reboot}.
   *
   * <p>Shortcuts that expand to time fields, such as {@code @daily}, are not reported here: they
   * are stored as fields and compacted again on render.
   *
   * @return the marker, or empty
   */
  public Optional<SpecialSchedule> special() {
    return Optional.ofNullable(marker);
  }

  public String command() {
    return command.text();
  }

  public Command commandPart() {
    return command;
  }

  /**
   * Replaces the command.
   *
   * @param command the new command, trimmed
   */
  public void setCommand(String command) {
    this.command = new Command(Objects.requireNonNull(command, "command"));
  }

  public String comment() {
    return comment.text();
  }

  public Comment commentPart() {
    return comment;
  }

  /**
   * Replaces the comment.
   *
   * @param comment the new comment, trimmed; empty removes it
   */
  public void setComment(String comment) {
    this.comment = new Comment(Objects.requireNonNull(comment, "comment"));
  }

  /** Drops any marker and clears every field, setting the time to {@code * * * * *}. */
  public void clear() {
    marker = null;
    for (TimeField field : fields.values()) {
      field.clear();
    }
  }

  /**
   * Returns an independent copy of this line.
   *
   * @return a new line with copied fields
   */
  public ScheduleLine copy() {
    return new ScheduleLine(new LineData(copyFields(), command, comment, marker), valid);
  }

  /**
   * Returns a snapshot of the current state. Later edits to this line do not affect it.
   *
   * @return the line data, with copied fields
   */
  public LineData data() {
    return new LineData(copyFields(), command, comment, marker);
  }

  /**
   * Renders this line as it would be written to a crontab.
   *
   * @return the canonical line
   */
  public String render() {
    return Display.render(data());
  }

  @Override
  public String toString() {
    return render();
  }

  private List<TimeField> copyFields() {
    List<TimeField> copies = new ArrayList<>();
    for (TimeField field : fields.values()) {
      copies.add(field.copy());
    }
    return copies;
  }
}
