package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds candidate documents for a processed item by trying discovery strategies in order and
 * stopping at the first one that yields candidates:
 *
 * <ol>
 *   <li>reference listing (skipped for the placeholder seed id)
 *   <li>title keyword search
 * </ol>
 *
 * A failing strategy counts as empty and the next one is tried.
 */
public class CitationDiscovery {

  private static final Logger log = LoggerFactory.getLogger(CitationDiscovery.class);

  private final List<DiscoveryStrategy> strategies;

  public CitationDiscovery(List<DiscoveryStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  /** Reference listing first, then title search, both against the same source. */
  public static CitationDiscovery standard(ReferenceSource source, CrawlSettings settings) {
    return new CitationDiscovery(
        List.of(
            new ReferenceListingDiscovery(source),
            new TitleSearchDiscovery(
                source, settings.titleSearchLimit(), settings.titleTermCount())));
  }

  /**
   * Discover candidates for the item.
   *
   * @param item the processed document
   * @return candidates from the first productive strategy, with the number of failed attempts
   */
  public DiscoveryResult discover(WorkItem item) {
    int failures = 0;
    for (DiscoveryStrategy strategy : strategies) {
      if (!strategy.appliesTo(item)) {
        log.debug("Skipping {} for {}", strategy.method(), item.id());
        continue;
      }
      Outcome<List<DocumentRef>> outcome =
          Outcome.of(
              strategy.method() + " for " + item.id(), () -> strategy.discover(item), List.of());
      if (outcome.isSuccess()) {
        return new DiscoveryResult(outcome.orElse(List.of()), strategy.method(), failures);
      }
      if (outcome.isFailure()) {
        failures++;
      }
      log.info("No candidates via {} for {}, trying next method", strategy.method(), item.id());
    }
    return new DiscoveryResult(List.of(), DiscoveryMethod.NONE, failures);
  }

  /** Method that produced the candidates. */
  public enum DiscoveryMethod {
    /** The document's own reference list */
    REFERENCE_LISTING,
    /** Keyword search on the document's title */
    TITLE_SEARCH,
    /** No strategy produced candidates */
    NONE
  }

  /**
   * Candidates discovered for one document.
   *
   * @param candidates candidates in upstream order, may contain duplicates
   * @param method the strategy that produced them
   * @param failures number of strategies that failed with a collaborator error
   */
  public record DiscoveryResult(
      List<DocumentRef> candidates, DiscoveryMethod method, int failures) {
    public DiscoveryResult {
      candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
  }
}
