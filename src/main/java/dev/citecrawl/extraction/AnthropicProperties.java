package dev.citecrawl.extraction;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the Anthropic model used for fact extraction, bound from {@code
 * citecrawl.anthropic.*}.
 *
 * @param apiKey Anthropic API key
 * @param modelName model identifier
 * @param maxTokens response token limit
 * @param temperature sampling temperature
 * @param timeout per-call timeout
 * @param maxInputChars document text beyond this many characters is not sent
 */
@Validated
@ConfigurationProperties(prefix = "citecrawl.anthropic")
public record AnthropicProperties(
    @NotBlank String apiKey,
    @NotBlank String modelName,
    @Min(1) int maxTokens,
    double temperature,
    Duration timeout,
    @Min(1) int maxInputChars) {}
