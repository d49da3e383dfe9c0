package dev.citecrawl.export;

import dev.citecrawl.document.FactRecord;
import java.util.List;

/** Column layout of the species table. */
public final class SpeciesColumns {

  public static final List<String> ALL =
      List.of(
          FactRecord.SOURCE_ID_COLUMN,
          "species",
          "abundance_or_biomass",
          "number",
          "location",
          FactRecord.DISTANCE_COLUMN,
          FactRecord.TITLE_COLUMN);

  private SpeciesColumns() {}
}
