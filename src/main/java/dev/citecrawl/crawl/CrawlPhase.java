package dev.citecrawl.crawl;

/** Lifecycle of one crawl run. */
public enum CrawlPhase {
  /** Nothing processed yet */
  INIT,
  /** Loading the seed document */
  SEEDING,
  /** Processing the frontier */
  DRAINING,
  /** Frontier empty, budget exhausted, seed failed or run cancelled */
  DONE
}
