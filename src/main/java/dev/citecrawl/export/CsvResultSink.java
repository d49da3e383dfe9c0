package dev.citecrawl.export;

import dev.citecrawl.document.FactRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes fact records to a UTF-8 CSV file with a header row. Every field is quoted and embedded
 * quotes are doubled.
 */
public class CsvResultSink implements ResultSink {

  private static final Logger log = LoggerFactory.getLogger(CsvResultSink.class);

  private final Path path;

  public CsvResultSink(Path path) {
    this.path = path;
  }

  @Override
  public void write(List<FactRecord> records, List<String> columns) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(row(columns));
      writer.newLine();
      for (FactRecord record : records) {
        Map<String, String> values = record.asRow();
        writer.write(
            row(columns.stream().map(c -> values.getOrDefault(c, UNSPECIFIED)).toList()));
        writer.newLine();
      }
    }
    log.info("Saved {} entries to {}", records.size(), path);
  }

  public Path path() {
    return path;
  }

  private static String row(List<String> values) {
    return values.stream().map(CsvResultSink::quote).collect(Collectors.joining(","));
  }

  private static String quote(String value) {
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }
}
