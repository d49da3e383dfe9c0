package dev.citecrawl.scopus;

import com.fasterxml.jackson.databind.JsonNode;
import dev.citecrawl.document.DocumentRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Static utility that reads the loosely-shaped Scopus JSON responses.
 *
 * <p>Scopus returns a single object where a list would be expected when there is exactly one
 * element, reports empty result sets as an entry with an {@code error} field, and nests reference
 * titles either as a string or as an object. Everything here tolerates those shapes and returns
 * empty results for anything it does not recognise.
 */
public final class ScopusResponseParser {

  private static final String SCOPUS_ID_PREFIX = "SCOPUS_ID:";

  private ScopusResponseParser() {
    // utility class
  }

  /** Entries of a search response, excluding the "Result set was empty" marker entry. */
  public static List<JsonNode> searchEntries(@Nullable JsonNode response) {
    if (response == null) {
      return List.of();
    }
    List<JsonNode> entries = new ArrayList<>();
    for (JsonNode entry : asList(response.path("search-results").path("entry"))) {
      if (entry.isObject() && !entry.has("error")) {
        entries.add(entry);
      }
    }
    return entries;
  }

  /** Numeric Scopus id of the first search entry, without its {@code SCOPUS_ID:} prefix. */
  public static Optional<String> scopusId(@Nullable JsonNode response) {
    return searchEntries(response).stream()
        .findFirst()
        .map(entry -> text(entry, "dc:identifier").replace(SCOPUS_ID_PREFIX, "").strip())
        .filter(id -> !id.isEmpty());
  }

  /** Search entries that carry both a DOI and a title. */
  public static List<DocumentRef> documents(@Nullable JsonNode response) {
    List<DocumentRef> documents = new ArrayList<>();
    for (JsonNode entry : searchEntries(response)) {
      String doi = text(entry, "prism:doi");
      String title = text(entry, "dc:title");
      if (!doi.isEmpty() && !title.isEmpty()) {
        documents.add(new DocumentRef(doi, title));
      }
    }
    return documents;
  }

  /**
   * Cited documents from an abstract references response.
   *
   * @param response the references response
   * @param minTitleLength titles must be strictly longer than this
   * @return references with both DOI and a sufficiently long title, in response order
   */
  public static List<DocumentRef> references(@Nullable JsonNode response, int minTitleLength) {
    if (response == null) {
      return List.of();
    }
    JsonNode section = response.path("abstract-retrieval-response").path("references");
    JsonNode referenceNode = section.isObject() ? section.path("reference") : section;

    List<DocumentRef> references = new ArrayList<>();
    for (JsonNode reference : asList(referenceNode)) {
      JsonNode refInfo = reference.path("ref-info");
      String doi = text(refInfo.path("ref-publicationtitle"), "prism:doi");
      String title = referenceTitle(refInfo);
      if (!doi.isEmpty() && title.length() > minTitleLength) {
        references.add(new DocumentRef(doi, title));
      }
    }
    return references;
  }

  /** Title and description of the first search entry, if any. */
  public static Optional<ScopusAbstract> firstAbstract(@Nullable JsonNode response) {
    return searchEntries(response).stream()
        .findFirst()
        .map(entry -> new ScopusAbstract(text(entry, "dc:title"), text(entry, "dc:description")));
  }

  private static String referenceTitle(JsonNode refInfo) {
    JsonNode titleNode = refInfo.path("ref-title");
    String title = "";
    if (titleNode.isObject()) {
      title = text(titleNode, "ref-titletext");
    } else if (titleNode.isTextual()) {
      title = titleNode.asText().strip();
    }
    if (title.isEmpty()) {
      title = text(refInfo, "ref-titletext");
    }
    return title;
  }

  private static List<JsonNode> asList(JsonNode node) {
    if (node.isArray()) {
      List<JsonNode> items = new ArrayList<>();
      node.forEach(items::add);
      return items;
    }
    if (node.isObject()) {
      return List.of(node);
    }
    return List.of();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() ? value.asText("").strip() : "";
  }
}
