package io.crontab.ast;

import java.util.List;
import java.util.Objects;

/**
 * A parsed cron line: five time fields, the command, the comment and an optional marker shortcut.
 *
 * @param fields the five fields in line order; all empty for a marker line
 * @param command the command
 * @param comment the comment
 * @param marker the marker shortcut such as {@code @reboot}, or null
 */
public record LineData(
    List<TimeField> fields, Command command, Comment comment, SpecialSchedule marker) {
  /** Checks the field layout and copies the field list. */
  public LineData {
    fields = List.copyOf(fields);
    if (fields.size() != FieldSpec.values().length) {
      throw new IllegalArgumentException("expected 5 time fields, got " + fields.size());
    }
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).spec() != FieldSpec.values()[i]) {
        throw new IllegalArgumentException(
            "field " + i + " is " + fields.get(i).spec() + ", expected " + FieldSpec.values()[i]);
      }
    }
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(comment, "comment");
    if (marker != null && !marker.isMarker()) {
      throw new IllegalArgumentException(marker + " expands to time fields, not a marker");
    }
  }

  /**
   * Creates line data with five empty fields and no marker.
   *
   * @param command the command
   * @param comment the comment
   * @return new line data rendering as {@code * * * * *}
   */
  public static LineData of(Command command, Comment comment) {
    return new LineData(emptyFields(), command, comment, null);
  }

  /**
   * Creates five empty fields in line order.
   *
   * @return the fields
   */
  public static List<TimeField> emptyFields() {
    return FieldSpec.lineOrder().stream().map(TimeField::new).toList();
  }
}
