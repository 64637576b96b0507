package io.crontab.parser;

import io.crontab.CronException;
import io.crontab.ast.Command;
import io.crontab.ast.Comment;
import io.crontab.ast.FieldSpec;
import io.crontab.ast.LineData;
import io.crontab.ast.SpecialSchedule;
import io.crontab.ast.TimeField;
import io.crontab.ast.TimeRange;
import io.crontab.ast.TimeValue;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses crontab lines, fields and range tokens. */
public final class Parser {
  /** Five field tokens, then the command up to an optional whitespace-preceded {@code #}. */
  private static final Pattern STANDARD_LINE =
      Pattern.compile(
          "^\\s*([^@#\\s]+)\\s+([^@#\\s]+)\\s+([^@#\\s]+)\\s+([^@#\\s]+)\\s+([^@#\\s]+)"
              + "\\s+([^#\\n]*)(\\s+#\\s*([^\\n]*)|$)");

  private static final Pattern SPECIAL_LINE =
      Pattern.compile("^\\s*@(\\w+)\\s([^#\\n]*)(\\s+#\\s*([^\\n]*)|$)");

  /** Steps may be negative; they are never range-checked. */
  private static final Pattern STEP = Pattern.compile("-?[0-9]+");

  private Parser() {}

  /**
   * Parses one crontab line.
   *
   * <p>The five-field form is tried first; the {@code @name} form only when that fails and no
   * {@code #} precedes the first {@code @}.
   *
   * @param line the raw line
   * @return the parsed line
   * @throws CronException if the line is not a cron entry or a field token is invalid
   */
  public static LineData parseLine(String line) throws CronException {
    if (line == null || line.isBlank()) {
      throw CronException.syntax("empty line", line);
    }

    Matcher m = STANDARD_LINE.matcher(line);
    if (m.find()) {
      List<TimeField> fields = new ArrayList<>();
      for (FieldSpec spec : FieldSpec.lineOrder()) {
        fields.add(parseField(spec, m.group(spec.ordinal() + 1)));
      }
      return new LineData(fields, new Command(m.group(6)), commentOf(m.group(8)), null);
    }

    int at = line.indexOf('@');
    int hash = line.indexOf('#');
    if (hash < 0 || at < hash) {
      m = SPECIAL_LINE.matcher(line);
      if (m.find()) {
        String name = m.group(1);
        SpecialSchedule special =
            SpecialSchedule.parse(name)
                .orElseThrow(() -> CronException.syntax("unknown special schedule @" + name, line));
        Command command = new Command(m.group(2));
        Comment comment = commentOf(m.group(4));

        if (special.isMarker()) {
          return new LineData(LineData.emptyFields(), command, comment, special);
        }

        String[] tokens = special.fieldTokens();
        List<TimeField> fields = new ArrayList<>();
        for (FieldSpec spec : FieldSpec.lineOrder()) {
          fields.add(parseField(spec, tokens[spec.ordinal()]));
        }
        return new LineData(fields, command, comment, null);
      }
    }

    throw CronException.syntax("not a cron line", line);
  }

  /**
   * Parses a comma-separated field token.
   *
   * <p>Pieces containing {@code /} or {@code -}, and a lone {@code *}, are ranges; anything else
   * is a single value resolved through {@link FieldSpec#resolve(String)}.
   *
   * @param spec the field being parsed
   * @param token the field token, or null for an empty field
   * @return the parsed field
   * @throws CronException if a piece cannot be resolved
   */
  public static TimeField parseField(FieldSpec spec, String token) throws CronException {
    TimeField field = new TimeField(spec);
    if (token == null || token.isEmpty()) {
      return field;
    }

    for (String piece : token.split(",", -1)) {
      if (piece.contains("/") || piece.contains("-") || piece.equals("*")) {
        field.add(parseRange(spec, piece));
      } else {
        OptionalInt value = spec.resolve(piece);
        if (value.isEmpty()) {
          throw CronException.unknownTimePart(spec, piece);
        }
        field.add(new TimeValue(value.getAsInt()));
      }
    }
    return field;
  }

  /**
   * Parses a range token: {@code *}, {@code a-b}, either followed by {@code /step}.
   *
   * @param spec the field being parsed
   * @param token the range token
   * @return the parsed range
   * @throws CronException if an endpoint is invalid or the token has no range shape
   */
  public static TimeRange parseRange(FieldSpec spec, String token) throws CronException {
    String span = token;
    int step = 1;

    int slash = token.indexOf('/');
    if (slash >= 0) {
      span = token.substring(0, slash);
      String stepToken = token.substring(slash + 1);
      if (!STEP.matcher(stepToken).matches()) {
        throw CronException.unknownTimeRange(spec, token);
      }
      try {
        step = Integer.parseInt(stepToken);
      } catch (NumberFormatException e) {
        throw CronException.unknownTimeRange(spec, token);
      }
    }

    int dash = span.indexOf('-');
    if (dash >= 0) {
      int from = resolveEndpoint(spec, span.substring(0, dash));
      int to = resolveEndpoint(spec, span.substring(dash + 1));
      return new TimeRange(spec, from, to, step);
    }

    if (span.equals("*")) {
      return TimeRange.every(spec, step);
    }

    // Single values are only valid without a step, and are handled by parseField
    throw CronException.unknownTimeRange(spec, token);
  }

  private static int resolveEndpoint(FieldSpec spec, String token) throws CronException {
    OptionalInt value = spec.resolve(token);
    if (value.isEmpty()) {
      throw CronException.invalidRangeValue(spec, token);
    }
    return value.getAsInt();
  }

  private static Comment commentOf(String text) {
    return text == null ? Comment.none() : new Comment(text);
  }
}
