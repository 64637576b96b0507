package io.crontab.ast;

/**
 * A single resolved value within a field.
 *
 * @param value the value
 */
public record TimeValue(int value) implements TimeComponent {
  @Override
  public String render() {
    return Integer.toString(value);
  }

  @Override
  public String toString() {
    return render();
  }
}
