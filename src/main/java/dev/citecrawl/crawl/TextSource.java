package dev.citecrawl.crawl;

/**
 * Supplies document text. Implementations enforce their own call timeouts.
 *
 * <p>"Not available" is an empty string, never an exception. Genuine transport or authentication
 * failures may surface as {@link CollaboratorException}.
 */
public interface TextSource {

  /**
   * Fetch the text of a discovered document.
   *
   * @param id canonical document identifier
   * @return document text, or an empty string when none is available
   */
  String fetch(String id);

  /**
   * Load the seed document and recover its identifier and title.
   *
   * @param pathOrId a local file path or a document identifier
   * @return the seed; its text is empty when nothing could be read
   */
  SeedDocument fetchSeed(String pathOrId);
}
