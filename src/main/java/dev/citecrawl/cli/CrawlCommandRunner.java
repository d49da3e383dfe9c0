package dev.citecrawl.cli;

import dev.citecrawl.crawl.CitationCrawler;
import dev.citecrawl.crawl.CrawlReport;
import dev.citecrawl.crawl.CrawlProgressTracker;
import dev.citecrawl.crawl.CrawlSettings;
import dev.citecrawl.export.CsvResultSink;
import dev.citecrawl.export.ResultSink;
import dev.citecrawl.export.SpeciesColumns;
import java.io.IOException;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs one crawl from the command line and writes its facts to CSV.
 *
 * <p>Exit codes: 0 when the run completes, with or without facts; 1 when the seed yields no text or
 * the output cannot be written; 2 when no seed was given.
 *
 * <p>When the application context is closed while a crawl is running (Ctrl-C, SIGTERM), {@link
 * #stop()} cancels the crawl through the {@link CrawlProgressTracker} and waits, up to {@code
 * citecrawl.run.shutdown-timeout}, for the facts gathered so far to be written.
 */
@Component
public class CrawlCommandRunner implements ApplicationRunner, ExitCodeGenerator, SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(CrawlCommandRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private final CitationCrawler crawler;
  private final CrawlProgressTracker progressTracker;
  private final RunProperties run;
  private final CrawlProperties crawl;
  private final Function<Path, ResultSink> sinkFactory;

  private volatile int exitCode = EXIT_OK;
  private volatile boolean running;
  private volatile @Nullable UUID activeRun;
  private volatile CountDownLatch runFinished = new CountDownLatch(0);

  @Autowired
  public CrawlCommandRunner(
      CitationCrawler crawler,
      CrawlProgressTracker progressTracker,
      RunProperties run,
      CrawlProperties crawl) {
    this(crawler, progressTracker, run, crawl, CsvResultSink::new);
  }

  CrawlCommandRunner(
      CitationCrawler crawler,
      CrawlProgressTracker progressTracker,
      RunProperties run,
      CrawlProperties crawl,
      Function<Path, ResultSink> sinkFactory) {
    this.crawler = crawler;
    this.progressTracker = progressTracker;
    this.run = run;
    this.crawl = crawl;
    this.sinkFactory = sinkFactory;
  }

  @Override
  public void run(ApplicationArguments args) {
    String seed = run.seed();
    if (seed == null || seed.isBlank()) {
      log.error("No seed given. Usage: --citecrawl.run.seed=<pdf path or DOI>");
      exitCode = EXIT_USAGE;
      return;
    }

    Path output = OutputPathResolver.resolve(run);
    log.info("Seed: {}", seed);
    log.info("Output: {}", output);
    log.info("Max papers: {}, max depth: {}", run.maxPapers(), run.maxDepth());
    if (!run.keywords().isEmpty()) {
      log.info("Keywords filter: {}", String.join(", ", run.keywords()));
    }

    UUID runId = UUID.randomUUID();
    runFinished = new CountDownLatch(1);
    activeRun = runId;
    try {
      exitCode = crawlAndWrite(runId, seed, output);
    } finally {
      activeRun = null;
      progressTracker.removeRun(runId);
      runFinished.countDown();
    }
  }

  private int crawlAndWrite(UUID runId, String seed, Path output) {
    CrawlReport report = crawler.crawl(runId, seed, settings());
    if (report.status() == CrawlReport.Status.SEED_FAILED) {
      log.error("Could not extract text from seed {}", seed);
      return EXIT_FAILURE;
    }
    if (report.status() == CrawlReport.Status.CANCELLED) {
      log.warn("Crawl cancelled, keeping the {} facts gathered so far", report.records().size());
    }
    if (report.records().isEmpty()) {
      log.warn(
          "No species data extracted ({} papers processed)", report.documentsProcessed());
      return EXIT_OK;
    }

    try {
      sinkFactory.apply(output).write(report.records(), SpeciesColumns.ALL);
    } catch (IOException e) {
      log.error("Could not write results to {}: {}", output, e.getMessage());
      return EXIT_FAILURE;
    }
    RunSummary.log(report, output);
    return EXIT_OK;
  }

  @Override
  public void start() {
    running = true;
  }

  /** Cancel the active crawl, if any, and wait for its partial results to be written. */
  @Override
  public void stop() {
    running = false;
    UUID runId = activeRun;
    if (runId == null) {
      return;
    }
    if (progressTracker.cancel(runId)) {
      log.warn("Shutdown requested, cancelling crawl {}", runId);
    }
    try {
      if (!runFinished.await(run.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Crawl {} did not finish within {}, partial results may be lost",
            runId,
            run.shutdownTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for crawl {} to finish", runId);
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  CrawlSettings settings() {
    return new CrawlSettings(
        run.maxPapers(),
        run.maxDepth(),
        run.keywords(),
        run.interDocumentDelay(),
        crawl.titleSearchLimit(),
        crawl.titleTermCount());
  }
}
