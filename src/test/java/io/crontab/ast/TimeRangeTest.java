package io.crontab.ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Unit tests for range rendering. */
public class TimeRangeTest {

  @Test
  void testFullDomainRendersWildcard() {
    assertEquals("*", new TimeRange(FieldSpec.MINUTE, 0, 59, 1).render());
    assertEquals("*", new TimeRange(FieldSpec.MONTH, 1, 12, 1).render());
    assertTrue(new TimeRange(FieldSpec.DAY_OF_WEEK, 0, 7, 1).isFullDomain());
  }

  @Test
  void testStepAppendedWhenNotOne() {
    assertEquals("*/5", new TimeRange(FieldSpec.MINUTE, 0, 59, 5).render());
    assertEquals("1-5/2", new TimeRange(FieldSpec.DAY_OF_WEEK, 1, 5, 2).render());
  }

  @Test
  void testPartialSpan() {
    assertEquals("0-58", new TimeRange(FieldSpec.MINUTE, 0, 58, 1).render());
    assertEquals("2-12", new TimeRange(FieldSpec.MONTH, 2, 12, 1).render());
  }

  @Test
  void testReversedRangeRenderedLiterally() {
    assertEquals("22-2", new TimeRange(FieldSpec.HOUR, 22, 2, 1).render());
  }

  @Test
  void testEveryAndWithStep() {
    TimeRange r = TimeRange.every(FieldSpec.HOUR, 3);
    assertEquals("*/3", r.render());
    assertEquals("*", r.withStep(1).render());
    assertEquals(3, r.step());
  }
}
