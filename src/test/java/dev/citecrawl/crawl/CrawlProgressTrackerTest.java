package dev.citecrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CrawlProgressTrackerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

  private CrawlProgressTracker tracker;
  private UUID runId;

  @BeforeEach
  void setUp() {
    tracker = new CrawlProgressTracker(Clock.fixed(NOW, ZoneOffset.UTC));
    runId = UUID.randomUUID();
  }

  @Test
  void startRunCreatesInitialProgress() {
    tracker.startRun(runId);

    CrawlProgress progress = tracker.getProgress(runId).orElseThrow();

    assertThat(progress.runId()).isEqualTo(runId);
    assertThat(progress.phase()).isEqualTo(CrawlPhase.INIT);
    assertThat(progress.documentsProcessed()).isZero();
    assertThat(progress.factsExtracted()).isZero();
    assertThat(progress.documentsQueued()).isZero();
    assertThat(progress.failures()).isZero();
    assertThat(progress.cancelRequested()).isFalse();
    assertThat(progress.startedAt()).isEqualTo(NOW);
  }

  @Test
  void recordDocumentProcessedAccumulatesCounts() {
    tracker.startRun(runId);

    tracker.recordDocumentProcessed(runId, 3, 4);
    tracker.recordDocumentProcessed(runId, 2, 1);

    CrawlProgress progress = tracker.getProgress(runId).orElseThrow();
    assertThat(progress.documentsProcessed()).isEqualTo(2);
    assertThat(progress.factsExtracted()).isEqualTo(5);
    assertThat(progress.documentsQueued()).isEqualTo(1);
  }

  @Test
  void recordFailuresIgnoresZero() {
    tracker.startRun(runId);

    tracker.recordFailures(runId, 0);
    tracker.recordFailures(runId, 2);

    assertThat(tracker.getProgress(runId).orElseThrow().failures()).isEqualTo(2);
  }

  @Test
  void enterPhaseUpdatesPhase() {
    tracker.startRun(runId);

    tracker.enterPhase(runId, CrawlPhase.DRAINING);

    assertThat(tracker.getProgress(runId).orElseThrow().phase()).isEqualTo(CrawlPhase.DRAINING);
  }

  @Test
  void cancelMarksTrackedRun() {
    tracker.startRun(runId);

    assertThat(tracker.cancel(runId)).isTrue();
    assertThat(tracker.isCancelled(runId)).isTrue();
  }

  @Test
  void cancelUnknownRunReturnsFalse() {
    assertThat(tracker.cancel(runId)).isFalse();
    assertThat(tracker.isCancelled(runId)).isFalse();
  }

  @Test
  void updatesForUnknownRunAreIgnored() {
    tracker.recordDocumentProcessed(runId, 1, 1);
    tracker.enterPhase(runId, CrawlPhase.DONE);

    assertThat(tracker.getProgress(runId)).isEmpty();
  }

  @Test
  void removeRunDeletesProgress() {
    tracker.startRun(runId);

    tracker.removeRun(runId);

    assertThat(tracker.getProgress(runId)).isEmpty();
  }
}
