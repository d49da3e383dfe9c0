package dev.citecrawl.scopus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.citecrawl.crawl.CollaboratorException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;
import org.springframework.web.util.UriComponentsBuilder;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"rawtypes", "unchecked"})
class ScopusClientTest {

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestHeadersUriSpec requestHeadersUriSpec;

  @Mock private RestClient.RequestHeadersSpec requestHeadersSpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private ScopusClient scopusClient;
  private URI requestedUri;

  @BeforeEach
  void setUp() {
    scopusClient = new ScopusClient(restClient);
  }

  private void stubRestClientChain() {
    doReturn(requestHeadersUriSpec).when(restClient).get();
    when(requestHeadersUriSpec.uri(any(Function.class)))
        .thenAnswer(
            invocation -> {
              Function<UriBuilder, URI> uriFunction = invocation.getArgument(0);
              requestedUri =
                  uriFunction.apply(UriComponentsBuilder.fromUriString("https://api.elsevier.com"));
              return requestHeadersSpec;
            });
    when(requestHeadersSpec.retrieve()).thenReturn(responseSpec);
  }

  private static HttpClientErrorException clientError(HttpStatus status) {
    return HttpClientErrorException.create(
        status, status.getReasonPhrase(), HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
  }

  @Test
  void searchSendsQueryCountFieldsAndSort() throws Exception {
    stubRestClientChain();
    JsonNode body = new ObjectMapper().readTree("{\"search-results\": {}}");
    when(responseSpec.body(JsonNode.class)).thenReturn(body);

    JsonNode result = scopusClient.search("DOI(\"10.1/a\")", 15, "dc:title,prism:doi", "relevancy");

    assertThat(result).isSameAs(body);
    assertThat(requestedUri.getPath()).isEqualTo("/content/search/scopus");
    assertThat(requestedUri.getQuery())
        .contains("query=DOI(\"10.1/a\")")
        .contains("count=15")
        .contains("field=dc:title,prism:doi")
        .contains("sort=relevancy");
  }

  @Test
  void searchWithoutSortOmitsSortParameter() {
    stubRestClientChain();

    scopusClient.search("DOI(\"10.1/a\")", 1, "dc:identifier", null);

    assertThat(requestedUri.getQuery()).doesNotContain("sort=");
  }

  @Test
  void referencesExpandsScopusIdIntoPath() {
    stubRestClientChain();

    scopusClient.references("85012345678", 20);

    assertThat(requestedUri.getPath())
        .isEqualTo("/content/abstract/scopus_id/85012345678/references");
    assertThat(requestedUri.getQuery()).isEqualTo("count=20");
  }

  @Test
  void notFoundMeansNoData() {
    stubRestClientChain();
    when(responseSpec.body(JsonNode.class)).thenThrow(clientError(HttpStatus.NOT_FOUND));

    assertThat(scopusClient.references("85012345678", 20)).isNull();
  }

  @Test
  void badRequestMeansNoData() {
    stubRestClientChain();
    when(responseSpec.body(JsonNode.class)).thenThrow(clientError(HttpStatus.BAD_REQUEST));

    assertThat(scopusClient.search("DOI(\"bad\")", 1, "dc:identifier", null)).isNull();
  }

  @Test
  void rejectedApiKeyRaisesCollaboratorException() {
    stubRestClientChain();
    when(responseSpec.body(JsonNode.class)).thenThrow(clientError(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> scopusClient.search("DOI(\"10.1/a\")", 1, "dc:identifier", null))
        .isInstanceOf(CollaboratorException.class)
        .hasMessageContaining("API key");
  }

  @Test
  void rateLimitIsRethrownForRetry() {
    stubRestClientChain();
    when(responseSpec.body(JsonNode.class)).thenThrow(clientError(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> scopusClient.references("85012345678", 20))
        .isInstanceOf(HttpClientErrorException.TooManyRequests.class);
  }

  @Test
  void otherClientErrorsRaiseCollaboratorException() {
    stubRestClientChain();
    when(responseSpec.body(JsonNode.class)).thenThrow(clientError(HttpStatus.CONFLICT));

    assertThatThrownBy(() -> scopusClient.references("85012345678", 20))
        .isInstanceOf(CollaboratorException.class)
        .hasCauseInstanceOf(HttpClientErrorException.class);
  }
}
