package dev.citecrawl.cli;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Command-line surface of a crawl run, bound from {@code citecrawl.run.*}; pass values as {@code
 * --citecrawl.run.seed=paper.pdf} and so on.
 *
 * @param seed seed PDF path or DOI
 * @param output CSV file; derived from the seed name under {@code outputDir} when absent
 * @param outputDir directory for derived output files
 * @param maxPapers document budget, seed included
 * @param maxDepth reference depth (1 = references of the seed, 2 = references of references)
 * @param keywords comma-separated title keywords candidates must mention
 * @param interDocumentDelay pause between documents
 * @param shutdownTimeout how long shutdown waits for a cancelled crawl to write its results
 */
@Validated
@ConfigurationProperties(prefix = "citecrawl.run")
public record RunProperties(
    @Nullable String seed,
    @Nullable String output,
    @DefaultValue("./reference_data") String outputDir,
    @DefaultValue("20") @Min(1) int maxPapers,
    @DefaultValue("2") @Min(0) int maxDepth,
    @DefaultValue List<String> keywords,
    @DefaultValue("3s") Duration interDocumentDelay,
    @DefaultValue("90s") Duration shutdownTimeout) {}
