package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Secondary discovery: keyword search on the significant words of the document's title. */
public class TitleSearchDiscovery implements DiscoveryStrategy {

  private static final Logger log = LoggerFactory.getLogger(TitleSearchDiscovery.class);

  private final ReferenceSource referenceSource;
  private final int limit;
  private final int termCount;

  public TitleSearchDiscovery(ReferenceSource referenceSource, int limit, int termCount) {
    this.referenceSource = referenceSource;
    this.limit = limit;
    this.termCount = termCount;
  }

  @Override
  public CitationDiscovery.DiscoveryMethod method() {
    return CitationDiscovery.DiscoveryMethod.TITLE_SEARCH;
  }

  @Override
  public boolean appliesTo(WorkItem item) {
    return true;
  }

  @Override
  public List<DocumentRef> discover(WorkItem item) {
    List<String> terms = TitleTerms.significant(item.ref().title(), termCount);
    if (terms.isEmpty()) {
      log.debug("No significant title words for {}, skipping title search", item.id());
      return List.of();
    }
    return referenceSource.searchByTitle(item.ref().title(), terms, limit);
  }
}
