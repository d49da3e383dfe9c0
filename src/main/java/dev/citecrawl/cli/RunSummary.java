package dev.citecrawl.cli;

import dev.citecrawl.crawl.CrawlReport;
import dev.citecrawl.document.FactRecord;
import dev.citecrawl.extraction.SpeciesFactExtractor;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** End-of-run statistics written to the log. */
final class RunSummary {

  private static final Logger log = LoggerFactory.getLogger(RunSummary.class);

  private RunSummary() {}

  static long uniqueSpecies(CrawlReport report) {
    return report.records().stream()
        .map(FactRecord::payload)
        .map(payload -> payload.get(SpeciesFactExtractor.SPECIES))
        .filter(species -> species != null && !species.isBlank())
        .distinct()
        .count();
  }

  static void log(CrawlReport report, Path output) {
    log.info("Saved {} species entries to {}", report.records().size(), output);
    log.info("Unique species: {}", uniqueSpecies(report));
    for (Map.Entry<Integer, Long> entry : report.countsByDistance().entrySet()) {
      log.info("  Distance {}: {} entries", entry.getKey(), entry.getValue());
    }
    log.info("Total papers processed: {}", report.documentsProcessed());
  }
}
