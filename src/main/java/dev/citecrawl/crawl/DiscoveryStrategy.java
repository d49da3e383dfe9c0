package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;

/** One way of finding documents related to a processed document. */
public interface DiscoveryStrategy {

  CitationDiscovery.DiscoveryMethod method();

  /** Whether this strategy can be attempted for the item at all. */
  boolean appliesTo(WorkItem item);

  /**
   * Find candidate documents for the item.
   *
   * @return candidates in upstream order; empty when nothing was found
   */
  List<DocumentRef> discover(WorkItem item);
}
