package io.crontab.ast;

/**
 * An inclusive span of values within a field, visited every {@code step} units.
 *
 * <p>{@code from > to} is kept as written; ranges do not wrap. The step is never range-checked, so
 * {@code *}{@code /0} is representable.
 *
 * @param field the field this range belongs to
 * @param from the first value
 * @param to the last value
 * @param step the step, 1 when not written
 */
public record TimeRange(FieldSpec field, int from, int to, int step) implements TimeComponent {

  /**
   * Creates a range covering the whole field, i.e. {@code *} or {@code *}{@code /step}.
   *
   * @param field the field
   * @param step the step
   * @return a new full-domain range
   */
  public static TimeRange every(FieldSpec field, int step) {
    return new TimeRange(field, field.min(), field.max(), step);
  }

  /**
   * Returns a copy of this range with another step.
   *
   * @param step the new step
   * @return a new range
   */
  public TimeRange withStep(int step) {
    return new TimeRange(field, from, to, step);
  }

  /**
   * Returns true if this range spans the field's whole domain.
   *
   * @return true when rendered with a {@code *} base
   */
  public boolean isFullDomain() {
    return from == field.min() && to == field.max();
  }

  @Override
  public String render() {
    String base = isFullDomain() ? "*" : from + "-" + to;
    return step != 1 ? base + "/" + step : base;
  }

  @Override
  public String toString() {
    return render();
  }
}
