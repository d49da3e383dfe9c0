package dev.citecrawl.extraction;

/** Prompt asking the model for the species observations of a paper as a JSON array. */
final class SpeciesPrompt {

  private static final String TEMPLATE =
      """
      Extract species information from this research paper. Return ONLY a JSON array.

      For each species in the study, extract:
      - species: scientific name (Genus species)
      - abundance_or_biomass: population data, density, biomass measurements
      - number: specimen count or sample size
      - location: study location or habitat

      Return format:
      [
        {
          "species": "Genus species",
          "abundance_or_biomass": "density/biomass data or not specified",
          "number": "count or not specified",
          "location": "location"
        }
      ]

      Text: %s
      """;

  private SpeciesPrompt() {}

  static String forText(String text, int maxChars) {
    String truncated = text.length() > maxChars ? text.substring(0, maxChars) : text;
    return TEMPLATE.formatted(truncated);
  }
}
