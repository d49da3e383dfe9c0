package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;
import java.util.Locale;

/**
 * Static utility that keeps candidates whose title mentions at least one keyword
 * (case-insensitive substring match). An empty keyword list keeps every candidate.
 */
public final class KeywordFilter {

  private KeywordFilter() {
    // utility class
  }

  /**
   * Filter candidates by title keywords, preserving their order.
   *
   * @param candidates discovered candidates
   * @param keywords filter terms; empty means no filtering
   * @return the retained candidates, a subset of the input
   */
  public static List<DocumentRef> apply(List<DocumentRef> candidates, List<String> keywords) {
    if (keywords.isEmpty()) {
      return candidates;
    }
    List<String> lowered = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    return candidates.stream().filter(c -> matches(c.title(), lowered)).toList();
  }

  static boolean matches(String title, List<String> loweredKeywords) {
    String lowerTitle = title.toLowerCase(Locale.ROOT);
    for (String keyword : loweredKeywords) {
      if (lowerTitle.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
