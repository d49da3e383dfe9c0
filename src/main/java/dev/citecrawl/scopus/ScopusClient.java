package dev.citecrawl.scopus;

import com.fasterxml.jackson.databind.JsonNode;
import dev.citecrawl.crawl.CollaboratorException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Thin HTTP client for the two Scopus endpoints the crawler needs: search and the abstract
 * references view. Returns raw JSON trees; {@link ScopusResponseParser} interprets them.
 *
 * <p>Bad-request and not-found responses mean "no accessible data" and yield {@code null}.
 * Rejected credentials raise {@link CollaboratorException}. Connection failures, server errors and
 * rate-limit responses (429) are retried with exponential backoff and then propagate.
 */
@Service
public class ScopusClient {

  private static final Logger log = LoggerFactory.getLogger(ScopusClient.class);

  static final String SEARCH_PATH = "/content/search/scopus";
  static final String REFERENCES_PATH = "/content/abstract/scopus_id/{scopusId}/references";

  private final RestClient restClient;

  public ScopusClient(@Qualifier("scopusRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  /**
   * Run a Scopus search query.
   *
   * @param query Scopus query, e.g. {@code DOI("10.1/x")}
   * @param count maximum number of entries
   * @param fields comma-separated response fields
   * @param sort sort order, or null for the default
   * @return the response tree, or null if Scopus reports no accessible data
   */
  @Retryable(
      retryFor = {
        ResourceAccessException.class,
        HttpServerErrorException.class,
        HttpClientErrorException.TooManyRequests.class
      },
      maxAttemptsExpression = "${citecrawl.scopus.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${citecrawl.scopus.retry.delay-ms:1000}",
              multiplierExpression = "${citecrawl.scopus.retry.multiplier:2.0}"))
  public @Nullable JsonNode search(String query, int count, String fields, @Nullable String sort) {
    try {
      return restClient
          .get()
          .uri(
              uriBuilder -> {
                uriBuilder
                    .path(SEARCH_PATH)
                    .queryParam("query", query)
                    .queryParam("count", count)
                    .queryParam("field", fields);
                if (sort != null) {
                  uriBuilder.queryParam("sort", sort);
                }
                return uriBuilder.build();
              })
          .retrieve()
          .body(JsonNode.class);
    } catch (HttpClientErrorException e) {
      return handleClientError(e, "search " + query);
    }
  }

  /**
   * Fetch the reference list of a document.
   *
   * @param scopusId numeric Scopus id
   * @param count maximum number of references
   * @return the response tree, or null if Scopus reports no accessible data
   */
  @Retryable(
      retryFor = {
        ResourceAccessException.class,
        HttpServerErrorException.class,
        HttpClientErrorException.TooManyRequests.class
      },
      maxAttemptsExpression = "${citecrawl.scopus.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${citecrawl.scopus.retry.delay-ms:1000}",
              multiplierExpression = "${citecrawl.scopus.retry.multiplier:2.0}"))
  public @Nullable JsonNode references(String scopusId, int count) {
    try {
      return restClient
          .get()
          .uri(
              uriBuilder ->
                  uriBuilder.path(REFERENCES_PATH).queryParam("count", count).build(scopusId))
          .retrieve()
          .body(JsonNode.class);
    } catch (HttpClientErrorException e) {
      return handleClientError(e, "references of " + scopusId);
    }
  }

  private @Nullable JsonNode handleClientError(HttpClientErrorException e, String request) {
    HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
    if (status == HttpStatus.BAD_REQUEST) {
      log.info("Bad request for {}: document may not have accessible data", request);
      return null;
    }
    if (status == HttpStatus.NOT_FOUND) {
      log.info("Not found in Scopus: {}", request);
      return null;
    }
    if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
      throw new CollaboratorException("Scopus rejected the API key (" + status + ")", e);
    }
    if (status == HttpStatus.TOO_MANY_REQUESTS) {
      log.warn("Scopus rate limit hit for {}", request);
      throw e;
    }
    throw new CollaboratorException("Scopus " + request + " failed: " + e.getStatusCode(), e);
  }
}
