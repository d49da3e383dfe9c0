package dev.citecrawl.extraction;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the chat model behind {@link SpeciesFactExtractor}. */
@Configuration
public class ExtractionConfig {

  /**
   * Anthropic chat model configured from {@link AnthropicProperties}. The call timeout bounds every
   * extraction request.
   */
  @Bean
  public ChatModel extractionChatModel(AnthropicProperties properties) {
    return AnthropicChatModel.builder()
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .maxTokens(properties.maxTokens())
        .temperature(properties.temperature())
        .timeout(properties.timeout())
        .build();
  }
}
