package dev.citecrawl.crawl;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for crawl runs, keyed by run id.
 *
 * <p>Each update atomically replaces the run's {@link CrawlProgress} snapshot using {@code
 * computeIfPresent()}. Cancellation requests are recorded here and polled by {@link
 * CitationCrawler} between documents, so a run can be cancelled from another thread.
 */
@Component
public class CrawlProgressTracker {

  private final ConcurrentHashMap<UUID, CrawlProgress> activeRuns = new ConcurrentHashMap<>();
  private final Clock clock;

  public CrawlProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a run in phase {@link CrawlPhase#INIT}.
   *
   * @param runId the run
   */
  public void startRun(UUID runId) {
    activeRuns.put(
        runId, new CrawlProgress(runId, CrawlPhase.INIT, 0, 0, 0, 0, false, clock.instant()));
  }

  public void enterPhase(UUID runId, CrawlPhase phase) {
    activeRuns.computeIfPresent(runId, (id, progress) -> progress.withPhase(phase));
  }

  /**
   * Record that a document was processed.
   *
   * @param runId the run
   * @param facts facts extracted from the document
   * @param queued documents left in the frontier afterwards
   */
  public void recordDocumentProcessed(UUID runId, int facts, int queued) {
    activeRuns.computeIfPresent(
        runId, (id, progress) -> progress.withDocumentProcessed(facts, queued));
  }

  public void recordFailures(UUID runId, int count) {
    if (count <= 0) {
      return;
    }
    activeRuns.computeIfPresent(runId, (id, progress) -> progress.withFailures(count));
  }

  /**
   * Request cancellation. The run stops before its next dequeue.
   *
   * @return true if the run is being tracked
   */
  public boolean cancel(UUID runId) {
    return activeRuns.computeIfPresent(runId, (id, progress) -> progress.cancelled()) != null;
  }

  public boolean isCancelled(UUID runId) {
    CrawlProgress progress = activeRuns.get(runId);
    return progress != null && progress.cancelRequested();
  }

  public Optional<CrawlProgress> getProgress(UUID runId) {
    return Optional.ofNullable(activeRuns.get(runId));
  }

  public void removeRun(UUID runId) {
    activeRuns.remove(runId);
  }
}
