package dev.citecrawl.scopus;

/**
 * Title and abstract of a document as indexed by Scopus.
 *
 * @param title document title, possibly empty
 * @param description abstract text, possibly empty
 */
public record ScopusAbstract(String title, String description) {

  /** Text handed to the fact extractor: labelled title and abstract separated by a blank line. */
  public String toText() {
    StringBuilder sb = new StringBuilder();
    if (!title.isBlank()) {
      sb.append("Title: ").append(title);
    }
    if (!description.isBlank()) {
      if (sb.length() > 0) {
        sb.append("\n\n");
      }
      sb.append("Abstract: ").append(description);
    }
    return sb.toString();
  }
}
