package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.List;

/** Primary discovery: the document's own reference list. Needs a real identifier. */
public class ReferenceListingDiscovery implements DiscoveryStrategy {

  private final ReferenceSource referenceSource;

  public ReferenceListingDiscovery(ReferenceSource referenceSource) {
    this.referenceSource = referenceSource;
  }

  @Override
  public CitationDiscovery.DiscoveryMethod method() {
    return CitationDiscovery.DiscoveryMethod.REFERENCE_LISTING;
  }

  @Override
  public boolean appliesTo(WorkItem item) {
    return item.ref().hasRealId();
  }

  @Override
  public List<DocumentRef> discover(WorkItem item) {
    return referenceSource.references(item.id());
  }
}
