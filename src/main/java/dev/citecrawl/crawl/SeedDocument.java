package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;

/**
 * Seed document as loaded by a {@link TextSource}: recovered identity plus raw text.
 *
 * @param ref recovered identifier and title (placeholders when nothing could be recovered)
 * @param text raw text, empty when the seed could not be read
 */
public record SeedDocument(DocumentRef ref, String text) {

  public SeedDocument {
    text = text == null ? "" : text;
  }

  public static SeedDocument unreadable() {
    return new SeedDocument(
        new DocumentRef(DocumentRef.PLACEHOLDER_ID, DocumentRef.PLACEHOLDER_TITLE), "");
  }

  public boolean hasText() {
    return !text.isBlank();
  }
}
