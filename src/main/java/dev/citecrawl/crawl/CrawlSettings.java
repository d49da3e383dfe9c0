package dev.citecrawl.crawl;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable limits and filters for one crawl run.
 *
 * @param maxTotal global budget of documents to process, seed included
 * @param maxDepth discovery runs only for documents closer to the seed than this
 * @param keywords title filter for discovered candidates; empty keeps everything
 * @param interDocumentDelay pause between successive documents
 * @param titleSearchLimit maximum results requested from title search
 * @param titleTermCount number of significant title words used for title search
 */
public record CrawlSettings(
    int maxTotal,
    int maxDepth,
    List<String> keywords,
    Duration interDocumentDelay,
    int titleSearchLimit,
    int titleTermCount) {

  public static final int DEFAULT_MAX_TOTAL = 20;
  public static final int DEFAULT_MAX_DEPTH = 2;
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);
  public static final int DEFAULT_TITLE_SEARCH_LIMIT = 15;
  public static final int DEFAULT_TITLE_TERM_COUNT = 3;

  public CrawlSettings {
    if (maxTotal < 1) {
      throw new IllegalArgumentException("maxTotal must be >= 1, got: " + maxTotal);
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
    }
    keywords =
        keywords == null
            ? List.of()
            : keywords.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(k -> !k.isEmpty())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    interDocumentDelay = interDocumentDelay == null ? Duration.ZERO : interDocumentDelay;
  }

  /**
   * Settings with the default delay and title-search parameters.
   *
   * @param maxTotal document budget
   * @param maxDepth depth limit
   * @param keywords candidate title filter, may be empty
   */
  public static CrawlSettings of(int maxTotal, int maxDepth, List<String> keywords) {
    return new CrawlSettings(
        maxTotal,
        maxDepth,
        keywords,
        DEFAULT_DELAY,
        DEFAULT_TITLE_SEARCH_LIMIT,
        DEFAULT_TITLE_TERM_COUNT);
  }

  public CrawlSettings withInterDocumentDelay(Duration delay) {
    return new CrawlSettings(
        maxTotal, maxDepth, keywords, delay, titleSearchLimit, titleTermCount);
  }
}
