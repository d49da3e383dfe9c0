package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Breadth-first, depth-bounded crawl of a citation graph from a seed document. Each processed
 * document is run through the fact extractor; documents closer to the seed than the depth limit
 * also have their references discovered, filtered by title keywords, fetched and queued.
 *
 * <p>Processing is strictly sequential: one document at a time, with a fixed pause between
 * documents. Collaborator failures are logged and degrade to empty results; only a seed without
 * text ends a run early.
 */
@Service
public class CitationCrawler {

  private static final Logger log = LoggerFactory.getLogger(CitationCrawler.class);

  private static final int LOG_TITLE_LENGTH = 50;

  private final TextSource textSource;
  private final FactExtractor factExtractor;
  private final ReferenceSource referenceSource;
  private final CrawlProgressTracker progressTracker;
  private final Pacer pacer;

  public CitationCrawler(
      TextSource textSource,
      FactExtractor factExtractor,
      ReferenceSource referenceSource,
      CrawlProgressTracker progressTracker,
      Pacer pacer) {
    this.textSource = textSource;
    this.factExtractor = factExtractor;
    this.referenceSource = referenceSource;
    this.progressTracker = progressTracker;
    this.pacer = pacer;
  }

  /**
   * Crawl from a seed under a fresh run id.
   *
   * @param seed local PDF path or document identifier
   * @param settings limits and filters
   * @return the run's report
   */
  public CrawlReport crawl(String seed, CrawlSettings settings) {
    return crawl(UUID.randomUUID(), seed, settings);
  }

  /**
   * Crawl from a seed. The run can be cancelled through {@link CrawlProgressTracker#cancel(UUID)}
   * with the same run id; it then stops before its next dequeue.
   *
   * @param runId id under which progress is tracked
   * @param seed local PDF path or document identifier
   * @param settings limits and filters
   * @return the run's report
   */
  public CrawlReport crawl(UUID runId, String seed, CrawlSettings settings) {
    progressTracker.startRun(runId);
    try {
      return run(runId, seed, settings);
    } finally {
      progressTracker.enterPhase(runId, CrawlPhase.DONE);
    }
  }

  private CrawlReport run(UUID runId, String seed, CrawlSettings settings) {
    progressTracker.enterPhase(runId, CrawlPhase.SEEDING);
    Outcome<SeedDocument> seedOutcome =
        Outcome.of(
            "Seed fetch for " + seed, () -> textSource.fetchSeed(seed), SeedDocument.unreadable());
    SeedDocument seedDocument = seedOutcome.orElse(SeedDocument.unreadable());
    if (!seedDocument.hasText()) {
      log.error("Could not extract text from seed document {}", seed);
      return CrawlReport.seedFailed();
    }
    log.info(
        "Seed document loaded ({} chars): id={}, title={}",
        seedDocument.text().length(),
        seedDocument.ref().id(),
        seedDocument.ref().title());

    Frontier frontier = new Frontier();
    frontier.enqueue(seedDocument.ref(), 0, seedDocument.text());
    CitationDiscovery discovery = CitationDiscovery.standard(referenceSource, settings);
    FactAccumulator facts = new FactAccumulator();
    List<String> processedIds = new ArrayList<>();
    int failures = 0;
    int processed = 0;
    boolean cancelled = false;

    log.info(
        "Starting crawl {} (maxTotal={}, maxDepth={}, keywords={})",
        runId,
        settings.maxTotal(),
        settings.maxDepth(),
        settings.keywords());
    progressTracker.enterPhase(runId, CrawlPhase.DRAINING);

    while (!frontier.isEmpty() && Frontier.hasCapacity(processed, settings.maxTotal())) {
      if (progressTracker.isCancelled(runId)) {
        cancelled = true;
        break;
      }
      WorkItem item = frontier.dequeue().orElseThrow();
      processedIds.add(item.id());
      log.info(
          "Processing document {}/{} (distance {}): {}",
          processed + 1,
          settings.maxTotal(),
          item.distance(),
          abbreviate(item.ref().title()));

      int itemFailures = 0;
      Outcome<List<Map<String, String>>> extraction =
          Outcome.of(
              "Fact extraction for " + item.id(),
              () -> factExtractor.extract(item.text()),
              List.of());
      if (extraction.isFailure()) {
        itemFailures++;
      }
      int added = facts.addAll(item, extraction.orElse(List.of()));
      log.info("Extracted {} facts from {}", added, item.id());

      if (item.distance() >= settings.maxDepth()) {
        log.debug(
            "Not discovering from {}: depth limit {} reached", item.id(), settings.maxDepth());
      } else if (frontier.queuedCount() + processed + 1 >= settings.maxTotal()) {
        log.debug(
            "Not discovering from {}: budget of {} documents already committed",
            item.id(),
            settings.maxTotal());
      } else {
        itemFailures += discoverAndEnqueue(item, processed, frontier, discovery, settings);
      }

      processed++;
      failures += itemFailures;
      progressTracker.recordFailures(runId, itemFailures);
      progressTracker.recordDocumentProcessed(runId, added, frontier.queuedCount());

      if (!frontier.isEmpty() && Frontier.hasCapacity(processed, settings.maxTotal())) {
        if (!pause(runId, settings.interDocumentDelay())) {
          cancelled = true;
          break;
        }
      }
    }

    CrawlReport.Status status =
        cancelled ? CrawlReport.Status.CANCELLED : CrawlReport.Status.COMPLETED;
    log.info(
        "Crawl {} {}: {} documents processed, {} facts, {} collaborator failures",
        runId,
        status,
        processed,
        facts.size(),
        failures);
    return new CrawlReport(status, facts.snapshot(), processedIds, failures);
  }

  /**
   * Discover, filter, fetch and enqueue the candidates of one processed item.
   *
   * @param processedBefore documents processed before this item
   * @return number of failed collaborator calls
   */
  private int discoverAndEnqueue(
      WorkItem item,
      int processedBefore,
      Frontier frontier,
      CitationDiscovery discovery,
      CrawlSettings settings) {
    log.info("Discovering references of distance {} document {}", item.distance(), item.id());
    CitationDiscovery.DiscoveryResult result = discovery.discover(item);
    int failures = result.failures();
    log.info("Found {} candidates via {}", result.candidates().size(), result.method());

    List<DocumentRef> candidates = KeywordFilter.apply(result.candidates(), settings.keywords());
    if (!settings.keywords().isEmpty()) {
      log.info(
          "Filtered to {} candidates matching keywords {}", candidates.size(), settings.keywords());
    }

    int childDistance = item.distance() + 1;
    int committed = processedBefore + 1;
    int added = 0;
    for (DocumentRef candidate : candidates) {
      if (frontier.queuedCount() + committed >= settings.maxTotal()) {
        log.debug("Budget of {} documents reached, not fetching more", settings.maxTotal());
        break;
      }
      if (frontier.contains(candidate.id())) {
        log.debug("Skipping {} (already visited or queued)", candidate.id());
        continue;
      }
      Outcome<String> text =
          Outcome.of(
              "Text fetch for " + candidate.id(), () -> textSource.fetch(candidate.id()), "");
      if (text.isFailure()) {
        failures++;
      }
      if (!text.isSuccess()) {
        log.warn("No text available for: {}", abbreviate(candidate.title()));
        continue;
      }
      if (frontier.enqueue(candidate, childDistance, text.orElse(""))) {
        added++;
        log.info(
            "Added to queue (distance {}): {}", childDistance, abbreviate(candidate.title()));
      }
    }
    log.info("Added {} new documents to queue", added);
    return failures;
  }

  /**
   * Pause between documents. The pause is a cancellation point.
   *
   * @return false if the run was cancelled or interrupted
   */
  private boolean pause(UUID runId, Duration delay) {
    try {
      log.debug("Waiting {} ms before next document", delay.toMillis());
      pacer.pause(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Crawl {} interrupted, stopping", runId);
      return false;
    }
    if (progressTracker.isCancelled(runId)) {
      log.info("Crawl {} cancelled, stopping", runId);
      return false;
    }
    return true;
  }

  private static String abbreviate(String title) {
    if (title.length() <= LOG_TITLE_LENGTH) {
      return title;
    }
    return title.substring(0, LOG_TITLE_LENGTH) + "...";
  }
}
