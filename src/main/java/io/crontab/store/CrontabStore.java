package io.crontab.store;

import java.io.IOException;
import java.util.Optional;

/** Where a crontab's raw text is read from and written to. */
public interface CrontabStore {
  /**
   * Reads the raw crontab text.
   *
   * @return the newline-separated text, or empty if there is no crontab at all
   * @throws IOException if the crontab exists but cannot be read
   */
  Optional<String> loadRawText() throws IOException;

  /**
   * Replaces the crontab with the given text.
   *
   * @param text the fully rendered crontab
   * @throws IOException if the crontab cannot be written
   */
  void saveRawText(String text) throws IOException;
}
