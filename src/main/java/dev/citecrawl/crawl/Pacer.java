package dev.citecrawl.crawl;

import java.time.Duration;

/** Blocks between successive documents to respect third-party rate limits. */
@FunctionalInterface
public interface Pacer {

  /**
   * Wait for the given delay.
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  void pause(Duration delay) throws InterruptedException;
}
