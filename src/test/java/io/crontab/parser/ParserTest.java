package io.crontab.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.crontab.CronException;
import io.crontab.ErrorKind;
import io.crontab.ast.FieldSpec;
import io.crontab.ast.LineData;
import io.crontab.ast.SpecialSchedule;
import io.crontab.ast.TimeField;
import io.crontab.ast.TimeRange;
import io.crontab.ast.TimeValue;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for line, field and range parsing. */
public class ParserTest {

  // Ranges

  @Test
  void testRangeMonthNames() throws CronException {
    // Month names are one-based like the month field itself
    TimeRange r = Parser.parseRange(FieldSpec.MONTH, "jan-mar");
    assertEquals(1, r.from());
    assertEquals(3, r.to());
    assertEquals(1, r.step());
    assertEquals("1-3", r.render());
  }

  @Test
  void testRangeWeekdayNames() throws CronException {
    TimeRange r = Parser.parseRange(FieldSpec.DAY_OF_WEEK, "MON-fri");
    assertEquals(1, r.from());
    assertEquals(5, r.to());
  }

  @Test
  void testRangeWithStep() throws CronException {
    TimeRange r = Parser.parseRange(FieldSpec.HOUR, "9-17/2");
    assertEquals(new TimeRange(FieldSpec.HOUR, 9, 17, 2), r);
    assertEquals("9-17/2", r.render());
  }

  @Test
  void testRangeWildcard() throws CronException {
    TimeRange r = Parser.parseRange(FieldSpec.DAY_OF_MONTH, "*");
    assertEquals(1, r.from());
    assertEquals(31, r.to());
    assertEquals("*", r.render());
  }

  @Test
  void testZeroStepAccepted() throws CronException {
    TimeRange r = Parser.parseRange(FieldSpec.MINUTE, "*/0");
    assertEquals(0, r.step());
    assertEquals("*/0", r.render());
  }

  @Test
  void testNegativeStepAccepted() throws CronException {
    assertEquals(-2, Parser.parseRange(FieldSpec.MINUTE, "*/-2").step());
  }

  @Test
  void testSignedOrNonAsciiStepRejected() {
    for (String token : new String[] {"*/+2", "*/\u0662", "*/--2"}) {
      CronException e =
          assertThrows(CronException.class, () -> Parser.parseRange(FieldSpec.MINUTE, token));
      assertEquals(ErrorKind.UNKNOWN_TIME_RANGE, e.kind(), token);
    }
  }

  @Test
  void testBareValueIsNotARange() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseRange(FieldSpec.MINUTE, "5"));
    assertEquals(ErrorKind.UNKNOWN_TIME_RANGE, e.kind());
  }

  @Test
  void testBadStep() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseRange(FieldSpec.MINUTE, "1-2/x"));
    assertEquals(ErrorKind.UNKNOWN_TIME_RANGE, e.kind());
    assertEquals("1-2/x", e.token().orElseThrow());
  }

  @Test
  void testRangeEndpointOutOfBounds() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseRange(FieldSpec.MINUTE, "1-60"));
    assertEquals(ErrorKind.INVALID_RANGE_VALUE, e.kind());
    assertEquals("60", e.token().orElseThrow());
    assertEquals(FieldSpec.MINUTE, e.field().orElseThrow());
  }

  @Test
  void testRangeSplitsOnFirstDash() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseRange(FieldSpec.MINUTE, "1-2-3"));
    assertEquals(ErrorKind.INVALID_RANGE_VALUE, e.kind());
    assertEquals("2-3", e.token().orElseThrow());
  }

  // Fields

  @Test
  void testWildcardRendersAsWildcardForEveryField() throws CronException {
    for (FieldSpec spec : FieldSpec.values()) {
      assertEquals("*", Parser.parseField(spec, "*").render(), spec.label());
    }
  }

  @Test
  void testNullFieldIsEmpty() throws CronException {
    TimeField f = Parser.parseField(FieldSpec.MINUTE, null);
    assertTrue(f.isEmpty());
    assertEquals("*", f.render());
  }

  @Test
  void testBothSundays() throws CronException {
    TimeField f = Parser.parseField(FieldSpec.DAY_OF_WEEK, "0,7");
    assertEquals(List.of(new TimeValue(0), new TimeValue(7)), f.components());
    assertEquals("0,7", f.render());
  }

  @Test
  void testDuplicatesKept() throws CronException {
    TimeField f = Parser.parseField(FieldSpec.DAY_OF_WEEK, "sun,SUN,0");
    assertEquals(3, f.components().size());
    assertEquals("0,0,0", f.render());
  }

  @Test
  void testMixedComponents() throws CronException {
    TimeField f = Parser.parseField(FieldSpec.MONTH, "feb,jun-aug,*/3");
    assertEquals(
        List.of(
            new TimeValue(2),
            new TimeRange(FieldSpec.MONTH, 6, 8, 1),
            new TimeRange(FieldSpec.MONTH, 1, 12, 3)),
        f.components());
    assertEquals("2,6-8,*/3", f.render());
  }

  @Test
  void testOutOfBoundsValue() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseField(FieldSpec.MINUTE, "60"));
    assertEquals(ErrorKind.UNKNOWN_TIME_PART, e.kind());
    assertEquals("60", e.token().orElseThrow());
  }

  @Test
  void testFirstBadPieceAbortsField() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseField(FieldSpec.HOUR, "1,x,99"));
    assertEquals("x", e.token().orElseThrow());
  }

  // Lines

  @Test
  void testStandardLine() throws CronException {
    LineData d = Parser.parseLine("*/5 0 1 jan mon run.sh --all # every five");
    assertEquals("*/5", d.fields().get(0).render());
    assertEquals("0", d.fields().get(1).render());
    assertEquals("1", d.fields().get(2).render());
    assertEquals("1", d.fields().get(3).render());
    assertEquals("1", d.fields().get(4).render());
    assertEquals("run.sh --all", d.command().text());
    assertEquals("every five", d.comment().text());
    assertNull(d.marker());
  }

  @Test
  void testFieldsInLineOrder() throws CronException {
    LineData d = Parser.parseLine("1 2 3 4 5 x");
    for (FieldSpec spec : FieldSpec.values()) {
      assertEquals(spec, d.fields().get(spec.ordinal()).spec());
    }
  }

  @Test
  void testCommandWithoutComment() throws CronException {
    LineData d = Parser.parseLine("* * * * * ls -l /");
    assertEquals("ls -l /", d.command().text());
    assertTrue(d.comment().isEmpty());
  }

  @Test
  void testRebootKeepsFieldsEmpty() throws CronException {
    LineData d = Parser.parseLine("@reboot start.sh");
    assertEquals(SpecialSchedule.REBOOT, d.marker());
    for (TimeField f : d.fields()) {
      assertTrue(f.isEmpty());
    }
    assertEquals("start.sh", d.command().text());
  }

  @Test
  void testShortcutExpandsToFields() throws CronException {
    LineData d = Parser.parseLine("@hourly ping");
    assertNull(d.marker());
    assertEquals("0", d.fields().get(0).render());
    for (int i = 1; i < 5; i++) {
      assertEquals("*", d.fields().get(i).render());
    }
  }

  @Test
  void testShortcutNamesAreCaseSensitive() {
    CronException e = assertThrows(CronException.class, () -> Parser.parseLine("@Daily x"));
    assertEquals(ErrorKind.SYNTAX, e.kind());
  }

  @Test
  void testShortcutAfterCommentMarker() {
    assertThrows(CronException.class, () -> Parser.parseLine("# @daily y"));
  }

  @Test
  void testBadFieldFailsWholeLine() {
    CronException e =
        assertThrows(CronException.class, () -> Parser.parseLine("0 0 * foo * backup.sh"));
    assertEquals(ErrorKind.UNKNOWN_TIME_PART, e.kind());
    assertEquals(FieldSpec.MONTH, e.field().orElseThrow());
  }
}
