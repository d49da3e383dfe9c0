package dev.citecrawl.text;

import dev.citecrawl.document.DocumentRef;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort recovery of a seed document's DOI and title from its extracted text.
 *
 * <p>The title is the first of the leading lines whose length looks like a title and that does not
 * look like a running header or footer. The DOI is the first DOI-shaped token introduced by {@code
 * doi:} or a {@code doi.org/} link; failing that, the first bare DOI-shaped token.
 * Placeholders from {@link DocumentRef} are used when nothing matches.
 */
public final class SeedMetadataExtractor {

  static final int TITLE_SCAN_LINES = 15;
  static final int MIN_TITLE_LENGTH = 20;
  static final int MAX_TITLE_LENGTH = 200;

  private static final List<String> HEADER_MARKERS =
      List.of("doi", "page", "journal", "research article");

  private static final Pattern PREFIXED_DOI =
      Pattern.compile(
          "(?:doi:?\\s*|doi\\.org/)(10\\.\\d{4,9}/[^\\s\\]),;]+)", Pattern.CASE_INSENSITIVE);

  private static final Pattern BARE_DOI = Pattern.compile("\\b(10\\.\\d{4,9}/[^\\s\\]),;]+)");

  private SeedMetadataExtractor() {
    // utility class
  }

  /** Recover id and title, falling back to placeholders. */
  public static DocumentRef recover(String text) {
    return new DocumentRef(
        findDoi(text).orElse(DocumentRef.PLACEHOLDER_ID),
        findTitle(text).orElse(DocumentRef.PLACEHOLDER_TITLE));
  }

  /** First {@code doi:} or {@code doi.org/} prefixed DOI, else the first bare DOI-shaped token. */
  public static Optional<String> findDoi(String text) {
    return firstMatch(PREFIXED_DOI, text).or(() -> firstMatch(BARE_DOI, text));
  }

  private static Optional<String> firstMatch(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String doi = matcher.group(1);
    // sentence punctuation
    while (doi.endsWith(".")) {
      doi = doi.substring(0, doi.length() - 1);
    }
    return Optional.of(doi);
  }

  public static Optional<String> findTitle(String text) {
    String[] lines = text.split("\n", -1);
    int scan = Math.min(lines.length, TITLE_SCAN_LINES);
    for (int i = 0; i < scan; i++) {
      String line = lines[i].strip();
      if (line.length() >= MIN_TITLE_LENGTH
          && line.length() <= MAX_TITLE_LENGTH
          && !looksLikeHeader(line)) {
        return Optional.of(line);
      }
    }
    return Optional.empty();
  }

  private static boolean looksLikeHeader(String line) {
    String lower = line.toLowerCase(Locale.ROOT);
    return HEADER_MARKERS.stream().anyMatch(lower::contains);
  }
}
