package dev.citecrawl.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.citecrawl.crawl.FactExtractor;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link FactExtractor} that asks a chat model for the species observations of a paper.
 *
 * <p>Every returned record carries the four species fields, with {@code UNSPECIFIED} or {@code not
 * specified} for those the model left out. Model, transport and parse failures are logged and
 * yield an empty list.
 */
@Service
public class SpeciesFactExtractor implements FactExtractor {

  private static final Logger log = LoggerFactory.getLogger(SpeciesFactExtractor.class);

  public static final String SPECIES = "species";
  public static final String ABUNDANCE_OR_BIOMASS = "abundance_or_biomass";
  public static final String NUMBER = "number";
  public static final String LOCATION = "location";

  static final String UNSPECIFIED = "UNSPECIFIED";
  static final String NOT_SPECIFIED = "not specified";

  private static final Map<String, String> FIELD_DEFAULTS = fieldDefaults();

  private final ChatModel chatModel;
  private final JsonPayloadParser parser;
  private final int maxInputChars;

  public SpeciesFactExtractor(
      ChatModel chatModel, ObjectMapper objectMapper, AnthropicProperties properties) {
    this.chatModel = chatModel;
    this.parser = new JsonPayloadParser(objectMapper);
    this.maxInputChars = properties.maxInputChars();
  }

  @Override
  public List<Map<String, String>> extract(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String response;
    try {
      response = chatModel.chat(SpeciesPrompt.forText(text, maxInputChars));
    } catch (RuntimeException e) {
      log.warn("Species extraction request failed: {}", e.getMessage());
      return List.of();
    }

    List<Map<String, String>> records = new ArrayList<>();
    for (Map<String, String> raw : parser.parse(response)) {
      records.add(normalize(raw));
    }
    return records;
  }

  private static Map<String, String> normalize(Map<String, String> raw) {
    Map<String, String> fields = new LinkedHashMap<>();
    FIELD_DEFAULTS.forEach(
        (field, fallback) -> {
          String value = raw.get(field);
          fields.put(field, value == null ? fallback : value.strip());
        });
    return fields;
  }

  private static Map<String, String> fieldDefaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put(SPECIES, UNSPECIFIED);
    defaults.put(ABUNDANCE_OR_BIOMASS, NOT_SPECIFIED);
    defaults.put(NUMBER, NOT_SPECIFIED);
    defaults.put(LOCATION, UNSPECIFIED);
    return defaults;
  }
}
