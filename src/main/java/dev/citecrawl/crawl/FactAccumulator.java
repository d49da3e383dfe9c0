package dev.citecrawl.crawl;

import dev.citecrawl.document.FactRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Append-only collection of the fact records of one run. */
public class FactAccumulator {

  private final List<FactRecord> records = new ArrayList<>();

  /**
   * Stamp payloads with the item's provenance and append them.
   *
   * @return number of records appended
   */
  public int addAll(WorkItem item, List<Map<String, String>> payloads) {
    int added = 0;
    for (Map<String, String> payload : payloads) {
      if (payload == null) {
        continue;
      }
      records.add(new FactRecord(item.id(), item.distance(), item.ref().title(), payload));
      added++;
    }
    return added;
  }

  public int size() {
    return records.size();
  }

  public List<FactRecord> snapshot() {
    return List.copyOf(records);
  }
}
