package io.crontab.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The components of one time slot of a cron line, in the order they were parsed or added.
 *
 * <p>Duplicates are kept. An empty field renders as {@code *}. The programmatic mutators append
 * exactly what parsing the equivalent token would have produced.
 */
public final class TimeField {
  private final FieldSpec spec;
  private final List<TimeComponent> components = new ArrayList<>();

  /**
   * Creates an empty field.
   *
   * @param spec the slot this field fills
   */
  public TimeField(FieldSpec spec) {
    this.spec = spec;
  }

  public FieldSpec spec() {
    return spec;
  }

  public int min() {
    return spec.min();
  }

  public int max() {
    return spec.max();
  }

  public List<String> names() {
    return spec.names();
  }

  /**
   * Returns a read-only view of the components.
   *
   * @return the components in order
   */
  public List<TimeComponent> components() {
    return Collections.unmodifiableList(components);
  }

  /**
   * Returns true if the field has no components and therefore renders as {@code *}.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return components.isEmpty();
  }

  /**
   * Appends a component.
   *
   * @param component the component to add
   * @throws IllegalArgumentException if a range belongs to another field, or a value is outside
   *     the field's bounds
   */
  public void add(TimeComponent component) {
    if (component instanceof TimeRange range && range.field() != spec) {
      throw new IllegalArgumentException(
          "range for " + range.field().label() + " added to " + spec.label());
    }
    if (component instanceof TimeValue value) {
      checkBounds(value.value());
    }
    components.add(component);
  }

  /**
   * Repeats every {@code n} units across the whole field, as {@code *}{@code /n} would.
   *
   * @param n the step
   * @return the appended range
   */
  public TimeRange everyN(int n) {
    TimeRange range = TimeRange.every(spec, n);
    components.add(range);
    return range;
  }

  /**
   * Alias of {@link #everyN(int)}.
   *
   * @param n the step
   * @return the appended range
   */
  public TimeRange every(int n) {
    return everyN(n);
  }

  /**
   * Appends each value as a single component, as {@code v1,v2,...} would.
   *
   * @param values the values
   * @throws IllegalArgumentException if a value is outside the field's bounds
   */
  public void onValues(int... values) {
    for (int value : values) {
      checkBounds(value);
    }
    for (int value : values) {
      components.add(new TimeValue(value));
    }
  }

  /**
   * Alias of {@link #onValues(int...)}.
   *
   * @param values the values
   */
  public void on(int... values) {
    onValues(values);
  }

  /**
   * Alias of {@link #onValues(int...)}.
   *
   * @param values the values
   */
  public void at(int... values) {
    onValues(values);
  }

  /**
   * Appends the span {@code from-to}, as that token would.
   *
   * @param from the first value
   * @param to the last value
   * @return the appended range
   * @throws IllegalArgumentException if an endpoint is outside the field's bounds
   */
  public TimeRange betweenFromTo(int from, int to) {
    return between(from, to, 1);
  }

  /**
   * Alias of {@link #betweenFromTo(int, int)}.
   *
   * @param from the first value
   * @param to the last value
   * @return the appended range
   */
  public TimeRange between(int from, int to) {
    return between(from, to, 1);
  }

  /**
   * Appends the span {@code from-to/step}, as that token would.
   *
   * @param from the first value
   * @param to the last value
   * @param step the step
   * @return the appended range
   * @throws IllegalArgumentException if an endpoint is outside the field's bounds
   */
  public TimeRange between(int from, int to, int step) {
    checkBounds(from);
    checkBounds(to);
    TimeRange range = new TimeRange(spec, from, to, step);
    components.add(range);
    return range;
  }

  /** Removes every component, so the field renders as {@code *}. */
  public void clear() {
    components.clear();
  }

  /**
   * Returns an independent copy of this field.
   *
   * @return a new field with the same components
   */
  public TimeField copy() {
    TimeField copy = new TimeField(spec);
    copy.components.addAll(components);
    return copy;
  }

  /**
   * Renders the field as it appears on a cron line.
   *
   * @return the components joined by commas, or {@code *} when empty
   */
  public String render() {
    if (components.isEmpty()) {
      return "*";
    }
    return components.stream().map(TimeComponent::render).collect(Collectors.joining(","));
  }

  @Override
  public String toString() {
    return render();
  }

  private void checkBounds(int value) {
    if (!spec.contains(value)) {
      throw new IllegalArgumentException(
          spec.label() + " value " + value + " outside " + spec.min() + "-" + spec.max());
    }
  }
}
