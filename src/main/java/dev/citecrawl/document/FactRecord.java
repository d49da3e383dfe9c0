package dev.citecrawl.document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One extracted domain fact stamped with its provenance. The payload is opaque to the crawler;
 * only the extractor and the result sink interpret its fields.
 *
 * @param sourceId identifier of the document the fact was extracted from
 * @param distance BFS distance of that document from the seed
 * @param title title of that document
 * @param payload domain-specific fields, e.g. species name and location
 */
public record FactRecord(String sourceId, int distance, String title, Map<String, String> payload) {

  public static final String SOURCE_ID_COLUMN = "doi";
  public static final String DISTANCE_COLUMN = "distance_from_seed";
  public static final String TITLE_COLUMN = "title";

  public FactRecord {
    title = title == null ? "" : title.strip();
    payload = payload == null ? Map.of() : withoutNulls(payload);
  }

  /** Extractors may emit null fields; those are treated as absent. */
  private static Map<String, String> withoutNulls(Map<String, String> payload) {
    Map<String, String> kept = new LinkedHashMap<>();
    payload.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            kept.put(key, value);
          }
        });
    return Map.copyOf(kept);
  }

  /**
   * Flattens the record into column values: payload fields plus the provenance columns. The
   * provenance columns win over payload keys of the same name.
   */
  public Map<String, String> asRow() {
    Map<String, String> row = new LinkedHashMap<>(payload);
    row.put(SOURCE_ID_COLUMN, sourceId);
    row.put(DISTANCE_COLUMN, Integer.toString(distance));
    row.put(TITLE_COLUMN, title);
    return row;
  }
}
