package dev.citecrawl.crawl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives keyword-search terms from a document title: words of four or more letters, lowercased,
 * stop-words removed, duplicates removed, kept in first-occurrence order.
 */
public final class TitleTerms {

  private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z]{4,}\\b");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "from", "into", "about", "over", "under", "between", "through", "their", "these",
          "those", "this", "that");

  private TitleTerms() {
    // utility class
  }

  /**
   * Extract up to {@code limit} significant words from a title.
   *
   * @param title the title
   * @param limit maximum number of terms
   * @return the terms, possibly empty
   */
  public static List<String> significant(String title, int limit) {
    if (title == null || title.isBlank() || limit <= 0) {
      return List.of();
    }
    Set<String> terms = new LinkedHashSet<>();
    Matcher matcher = WORD.matcher(title.toLowerCase(Locale.ROOT));
    while (matcher.find() && terms.size() < limit) {
      String word = matcher.group();
      if (!STOP_WORDS.contains(word)) {
        terms.add(word);
      }
    }
    return new ArrayList<>(terms);
  }
}
