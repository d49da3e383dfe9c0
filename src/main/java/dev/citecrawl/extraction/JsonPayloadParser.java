package dev.citecrawl.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers a list of flat JSON objects from model output that may be wrapped in Markdown code
 * fences or surrounded by prose.
 *
 * <p>The outermost {@code [...]} or {@code {...}} span is parsed; a single object becomes a
 * one-element list and non-object array elements are dropped. Nested values are kept as their JSON
 * text.
 */
public class JsonPayloadParser {

  private static final Logger log = LoggerFactory.getLogger(JsonPayloadParser.class);

  private static final Pattern FENCE_OPEN = Pattern.compile("```(?:json)?\\n");
  private static final Pattern FENCE_CLOSE = Pattern.compile("\\n```");
  private static final Pattern JSON_SPAN = Pattern.compile("(\\[.*]|\\{.*})", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  public JsonPayloadParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse model output into field maps.
   *
   * @param raw model output
   * @return the recovered objects, empty if nothing parses
   */
  public List<Map<String, String>> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    String cleaned = FENCE_CLOSE.matcher(FENCE_OPEN.matcher(raw).replaceAll("")).replaceAll("");
    Matcher span = JSON_SPAN.matcher(cleaned);
    String json = span.find() ? span.group(1) : cleaned;

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("Model output is not valid JSON: {}", e.getOriginalMessage());
      return List.of();
    }
    if (root == null) {
      return List.of();
    }
    if (root.isObject()) {
      return List.of(toFields(root));
    }
    if (!root.isArray()) {
      log.debug("Model output is JSON but neither an object nor an array");
      return List.of();
    }
    List<Map<String, String>> records = new ArrayList<>();
    for (JsonNode element : root) {
      if (element.isObject()) {
        records.add(toFields(element));
      }
    }
    return records;
  }

  private static Map<String, String> toFields(JsonNode object) {
    Map<String, String> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = object.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> field = it.next();
      JsonNode value = field.getValue();
      if (value.isNull()) {
        continue;
      }
      fields.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
    }
    return fields;
  }
}
