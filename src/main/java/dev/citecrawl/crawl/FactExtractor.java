package dev.citecrawl.crawl;

import java.util.List;
import java.util.Map;

/** Turns raw document text into structured fact payloads. */
public interface FactExtractor {

  /**
   * Extract facts from document text. Malformed upstream output is recovered on a best-effort
   * basis; total failure yields an empty list and never an exception.
   *
   * @param text raw document text
   * @return zero or more fact payloads
   */
  List<Map<String, String>> extract(String text);
}
