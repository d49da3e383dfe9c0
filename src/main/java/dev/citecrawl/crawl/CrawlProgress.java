package dev.citecrawl.crawl;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a crawl run's progress.
 *
 * <p>Created and updated by {@link CrawlProgressTracker}. Each mutation produces a new record.
 *
 * @param runId the run
 * @param phase current lifecycle phase
 * @param documentsProcessed documents dequeued and processed so far
 * @param factsExtracted fact records accumulated so far
 * @param documentsQueued documents waiting in the frontier
 * @param failures collaborator calls that failed
 * @param cancelRequested whether cancellation was requested
 * @param startedAt when the run started
 */
public record CrawlProgress(
    UUID runId,
    CrawlPhase phase,
    int documentsProcessed,
    int factsExtracted,
    int documentsQueued,
    int failures,
    boolean cancelRequested,
    Instant startedAt) {

  CrawlProgress withPhase(CrawlPhase newPhase) {
    return new CrawlProgress(
        runId,
        newPhase,
        documentsProcessed,
        factsExtracted,
        documentsQueued,
        failures,
        cancelRequested,
        startedAt);
  }

  CrawlProgress withDocumentProcessed(int facts, int queued) {
    return new CrawlProgress(
        runId,
        phase,
        documentsProcessed + 1,
        factsExtracted + facts,
        queued,
        failures,
        cancelRequested,
        startedAt);
  }

  CrawlProgress withFailures(int additional) {
    return new CrawlProgress(
        runId,
        phase,
        documentsProcessed,
        factsExtracted,
        documentsQueued,
        failures + additional,
        cancelRequested,
        startedAt);
  }

  CrawlProgress cancelled() {
    return new CrawlProgress(
        runId,
        phase,
        documentsProcessed,
        factsExtracted,
        documentsQueued,
        failures,
        true,
        startedAt);
  }
}
