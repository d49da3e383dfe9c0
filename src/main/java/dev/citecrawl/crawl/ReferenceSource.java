package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;

/**
 * Bibliographic lookup used for discovery.
 *
 * <p>Both operations return an empty list when nothing is found or the upstream reports that no
 * data is accessible (not found, bad request). Transport and authentication failures are thrown as
 * {@link CollaboratorException} so they stay distinguishable from a legitimately empty answer.
 */
public interface ReferenceSource {

  /** Documents cited by the given document. */
  List<DocumentRef> references(String id);

  /**
   * Documents related to a title, found by keyword search.
   *
   * @param title the title the terms were derived from
   * @param terms significant title words, in first-occurrence order
   * @param limit maximum number of results
   */
  List<DocumentRef> searchByTitle(String title, List<String> terms, int limit);
}
