package dev.citecrawl.crawl;

import java.time.Duration;
import org.springframework.stereotype.Component;

/** {@link Pacer} that sleeps the calling thread. */
@Component
public class SleepingPacer implements Pacer {

  @Override
  public void pause(Duration delay) throws InterruptedException {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    Thread.sleep(delay.toMillis());
  }
}
