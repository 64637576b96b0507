package io.crontab.display;

import io.crontab.ast.LineData;
import io.crontab.ast.SpecialSchedule;
import io.crontab.ast.TimeField;
import java.util.stream.Collectors;

/** Renders parsed lines as canonical crontab text. */
public final class Display {
  private Display() {}

  /**
   * Renders a line as it would be written to a crontab.
   *
   * <p>A time expression equal to a shortcut's expansion is written as that shortcut, the first
   * declared one winning. The comment, when present, follows as {@code " #" + comment}.
   *
   * @param data the line to render
   * @return the canonical line
   */
  public static String render(LineData data) {
    StringBuilder sb = new StringBuilder();

    sb.append(renderSchedule(data));
    sb.append(' ');
    sb.append(data.command().text());

    if (!data.comment().isEmpty()) {
      sb.append(" #");
      sb.append(data.comment().text());
    }

    return sb.toString();
  }

  /**
   * Renders the time portion of a line, compacted to an {@code @name} shortcut where possible.
   *
   * @param data the line
   * @return the time portion
   */
  public static String renderSchedule(LineData data) {
    String time = renderTime(data);
    return SpecialSchedule.forExpansion(time).map(SpecialSchedule::toString).orElse(time);
  }

  /**
   * Renders the time portion without shortcut compaction: the marker, or the five fields.
   *
   * @param data the line
   * @return the expanded time portion
   */
  public static String renderTime(LineData data) {
    if (data.marker() != null) {
      return data.marker().expansion();
    }
    return data.fields().stream().map(TimeField::render).collect(Collectors.joining(" "));
  }
}
