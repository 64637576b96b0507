package io.crontab.store;

import java.util.Objects;
import java.util.Optional;

/** A crontab held in memory. Starts with no crontab unless given initial text. */
public final class InMemoryCrontabStore implements CrontabStore {
  private String text;
  private int saves;

  public InMemoryCrontabStore() {
    this(null);
  }

  /**
   * Creates a store holding the given text.
   *
   * @param text the initial crontab, or null for none
   */
  public InMemoryCrontabStore(String text) {
    this.text = text;
  }

  @Override
  public synchronized Optional<String> loadRawText() {
    return Optional.ofNullable(text);
  }

  @Override
  public synchronized void saveRawText(String text) {
    this.text = Objects.requireNonNull(text, "text");
    saves++;
  }

  /**
   * Returns how many times the crontab has been saved.
   *
   * @return the save count
   */
  public synchronized int saveCount() {
    return saves;
  }
}
