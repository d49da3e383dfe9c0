package dev.citecrawl.export;

import dev.citecrawl.document.FactRecord;
import java.io.IOException;
import java.util.List;

/** Persists accumulated fact records as a table. */
public interface ResultSink {

  /**
   * Write records in order with a fixed column order. Fields a record lacks are written as {@link
   * #UNSPECIFIED}.
   *
   * @param records records to write, neither reordered nor dropped
   * @param columns column order
   * @throws IOException if writing fails
   */
  void write(List<FactRecord> records, List<String> columns) throws IOException;

  String UNSPECIFIED = "UNSPECIFIED";
}
