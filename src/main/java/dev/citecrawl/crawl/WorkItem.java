package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.Objects;

/**
 * A discovered document whose text has been fetched, waiting in the {@link Frontier}.
 *
 * @param ref the document
 * @param distance BFS depth from the seed (seed is 0)
 * @param text fetched document text
 */
public record WorkItem(DocumentRef ref, int distance, String text) {

  public WorkItem {
    Objects.requireNonNull(ref, "ref");
    if (distance < 0) {
      throw new IllegalArgumentException("distance must be >= 0, got: " + distance);
    }
    text = text == null ? "" : text;
  }

  public String id() {
    return ref.id();
  }
}
