package dev.citecrawl.crawl;

import dev.citecrawl.document.FactRecord;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Final result of a crawl run.
 *
 * @param status how the run ended
 * @param records accumulated fact records in extraction order
 * @param processedIds ids of processed documents in dequeue order
 * @param collaboratorFailures collaborator calls that failed and were degraded to empty
 */
public record CrawlReport(
    Status status, List<FactRecord> records, List<String> processedIds, int collaboratorFailures) {

  public CrawlReport {
    records = records == null ? List.of() : List.copyOf(records);
    processedIds = processedIds == null ? List.of() : List.copyOf(processedIds);
  }

  public static CrawlReport seedFailed() {
    return new CrawlReport(Status.SEED_FAILED, List.of(), List.of(), 0);
  }

  public int documentsProcessed() {
    return processedIds.size();
  }

  /** Fact record counts per distance from the seed, ascending by distance. */
  public SortedMap<Integer, Long> countsByDistance() {
    Map<Integer, Long> counts =
        records.stream()
            .collect(Collectors.groupingBy(FactRecord::distance, Collectors.counting()));
    return new TreeMap<>(counts);
  }

  /** Terminal condition of a run. */
  public enum Status {
    /** Frontier drained or budget exhausted */
    COMPLETED,
    /** The seed document yielded no text; nothing was processed */
    SEED_FAILED,
    /** Cancellation was requested; results are partial */
    CANCELLED
  }
}
