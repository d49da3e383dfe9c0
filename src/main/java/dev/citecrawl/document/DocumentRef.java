package dev.citecrawl.document;

import java.util.Objects;

/**
 * Reference to a scholarly document. Identity is the canonical identifier (typically a DOI);
 * two refs with the same id denote the same document whatever their titles say.
 *
 * @param id canonical identifier
 * @param title display title, possibly empty
 */
public record DocumentRef(String id, String title) {

  /** Identifier used for a seed document whose DOI could not be recovered. */
  public static final String PLACEHOLDER_ID = "SEED_PAPER";

  /** Title used for a seed document whose title could not be recovered. */
  public static final String PLACEHOLDER_TITLE = "Seed Paper";

  public DocumentRef {
    Objects.requireNonNull(id, "id");
    title = title == null ? "" : title;
  }

  /** Whether this ref carries a real identifier rather than the seed placeholder. */
  public boolean hasRealId() {
    return !id.isBlank() && !PLACEHOLDER_ID.equals(id);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DocumentRef other && id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }
}
