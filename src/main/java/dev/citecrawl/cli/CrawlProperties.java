package dev.citecrawl.cli;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Discovery tuning bound from {@code citecrawl.crawl.*}.
 *
 * @param titleSearchLimit results requested from the title-search fallback
 * @param titleTermCount significant title words used by the title-search fallback
 */
@Validated
@ConfigurationProperties(prefix = "citecrawl.crawl")
public record CrawlProperties(
    @DefaultValue("15") @Min(1) int titleSearchLimit,
    @DefaultValue("3") @Min(1) int titleTermCount) {}
