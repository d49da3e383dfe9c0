package dev.citecrawl.cli;

import java.nio.file.Path;
import java.util.Locale;

/** Chooses the CSV file a run writes to. */
final class OutputPathResolver {

  static final String SUFFIX = "_species_data.csv";

  private OutputPathResolver() {}

  /**
   * The explicit output file if given, otherwise {@code <outputDir>/<seed name>_species_data.csv}.
   */
  static Path resolve(RunProperties run) {
    if (run.output() != null && !run.output().isBlank()) {
      return Path.of(run.output());
    }
    return Path.of(run.outputDir()).resolve(seedName(run.seed()) + SUFFIX);
  }

  /**
   * File-name-safe base name of the seed: last path segment without a {@code .pdf} suffix, spaces
   * turned into underscores, anything but letters, digits, {@code _} and {@code -} dropped.
   */
  static String seedName(String seed) {
    String name = seed.replace('\\', '/');
    int slash = name.lastIndexOf('/');
    if (slash >= 0 && slash < name.length() - 1) {
      name = name.substring(slash + 1);
    }
    if (name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      name = name.substring(0, name.length() - 4);
    }
    String safe = name.replace(' ', '_').replaceAll("[^A-Za-z0-9_-]", "");
    return safe.isEmpty() ? "seed" : safe;
  }
}
