package io.crontab.display;

import static org.junit.jupiter.api.Assertions.*;

import io.crontab.ast.Command;
import io.crontab.ast.Comment;
import io.crontab.ast.LineData;
import io.crontab.ast.SpecialSchedule;
import io.crontab.ast.TimeField;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for line rendering. */
public class DisplayTest {

  private static LineData line(String command, String comment) {
    return LineData.of(new Command(command), new Comment(comment));
  }

  @Test
  void testEmptyFieldsRenderWildcards() {
    assertEquals("* * * * * ls", Display.render(line("ls", "")));
  }

  @Test
  void testCommentAppendedWithoutSpaceAfterHash() {
    assertEquals("* * * * * ls #list it", Display.render(line("ls", "list it")));
  }

  @Test
  void testCompactsToFirstDeclaredShortcut() {
    LineData d = line("backup.sh", "");
    d.fields().get(0).on(0);
    d.fields().get(1).on(0);
    assertEquals("0 0 * * *", Display.renderTime(d));
    assertEquals("@daily", Display.renderSchedule(d));
    assertEquals("@daily backup.sh", Display.render(d));
  }

  @Test
  void testNoCompactionForOtherExpressions() {
    LineData d = line("x", "");
    d.fields().get(0).on(0);
    d.fields().get(1).on(1);
    assertEquals("0 1 * * * x", Display.render(d));
  }

  @Test
  void testMarkerRenderedVerbatim() {
    List<TimeField> fields = LineData.emptyFields();
    LineData d =
        new LineData(fields, new Command("start.sh"), Comment.none(), SpecialSchedule.REBOOT);
    assertEquals("@reboot", Display.renderTime(d));
    assertEquals("@reboot start.sh", Display.render(d));
  }

  @Test
  void testEmptyCommandKeepsSeparator() {
    assertEquals("* * * * * ", Display.render(line("", "")));
  }
}
