package dev.citecrawl.scopus;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "citecrawl.scopus")
public record ScopusProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @Min(1) int connectTimeoutMs,
    @Min(1) int readTimeoutMs,
    @Min(1) int referencesPageSize,
    @Min(1) int maxReferences,
    @Min(0) int minReferenceTitleLength,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
