package dev.citecrawl.scopus;

import com.fasterxml.jackson.databind.JsonNode;
import dev.citecrawl.crawl.CollaboratorException;
import dev.citecrawl.crawl.ReferenceSource;
import dev.citecrawl.document.DocumentRef;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

/**
 * {@link ReferenceSource} backed by Scopus. Reference listing resolves the DOI to a Scopus id and
 * reads its references view; title search runs an AND query over the given terms.
 */
@Service
public class ScopusReferenceSource implements ReferenceSource {

  private static final Logger log = LoggerFactory.getLogger(ScopusReferenceSource.class);

  private final ScopusClient client;
  private final ScopusProperties properties;

  public ScopusReferenceSource(ScopusClient client, ScopusProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  @Override
  public List<DocumentRef> references(String id) {
    try {
      Optional<String> scopusId =
          ScopusResponseParser.scopusId(client.search(doiQuery(id), 1, "dc:identifier", null));
      if (scopusId.isEmpty()) {
        log.info("No Scopus record for {}", id);
        return List.of();
      }
      log.info("Found Scopus ID {} for {}", scopusId.get(), id);

      JsonNode response = client.references(scopusId.get(), properties.referencesPageSize());
      List<DocumentRef> references =
          ScopusResponseParser.references(response, properties.minReferenceTitleLength());
      log.info("Extracted {} references for {}", references.size(), id);
      return references.stream().limit(properties.maxReferences()).toList();
    } catch (RestClientException e) {
      throw new CollaboratorException("Scopus references lookup failed for " + id, e);
    }
  }

  @Override
  public List<DocumentRef> searchByTitle(String title, List<String> terms, int limit) {
    if (terms.isEmpty()) {
      return List.of();
    }
    String query =
        terms.stream()
            .map(term -> "TITLE-ABS-KEY(\"" + term + "\")")
            .collect(Collectors.joining(" AND "));
    try {
      log.debug("Title search for '{}': {}", title, query);
      return ScopusResponseParser.documents(
          client.search(query, limit, "dc:title,prism:doi", "relevancy"));
    } catch (RestClientException e) {
      throw new CollaboratorException("Scopus title search failed for " + terms, e);
    }
  }

  /**
   * Look up the indexed title and abstract of a document.
   *
   * @param doi document DOI
   * @return the abstract, or empty if Scopus has no record
   */
  public Optional<ScopusAbstract> findAbstract(String doi) {
    try {
      return ScopusResponseParser.firstAbstract(
          client.search(doiQuery(doi), 1, "dc:title,dc:description,dc:creator", null));
    } catch (RestClientException e) {
      throw new CollaboratorException("Scopus abstract lookup failed for " + doi, e);
    }
  }

  static String doiQuery(String doi) {
    return "DOI(\"" + doi + "\")";
  }
}
