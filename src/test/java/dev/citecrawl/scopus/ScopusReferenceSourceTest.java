package dev.citecrawl.scopus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.citecrawl.crawl.CollaboratorException;
import dev.citecrawl.document.DocumentRef;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

@ExtendWith(MockitoExtension.class)
class ScopusReferenceSourceTest {

  private static final ScopusProperties PROPERTIES =
      new ScopusProperties(
          "https://api.elsevier.com",
          "test-key",
          1000,
          1000,
          20,
          2,
          10,
          new ScopusProperties.Retry(3, 10, 2.0));

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private ScopusClient client;

  private ScopusReferenceSource source;

  @BeforeEach
  void setUp() {
    source = new ScopusReferenceSource(client, PROPERTIES);
  }

  private JsonNode identifierResponse() throws Exception {
    return objectMapper.readTree(
        """
        {"search-results": {"entry": [{"dc:identifier": "SCOPUS_ID:777"}]}}
        """);
  }

  private JsonNode referencesResponse() throws Exception {
    return objectMapper.readTree(
        """
        {"abstract-retrieval-response": {"references": {"reference": [
          {"ref-info": {"ref-publicationtitle": {"prism:doi": "10.1/a"},
                        "ref-title": {"ref-titletext": "Canopy arthropods of tropical forests"}}},
          {"ref-info": {"ref-publicationtitle": {"prism:doi": "10.1/b"},
                        "ref-title": {"ref-titletext": "Ground beetles in managed woodland"}}},
          {"ref-info": {"ref-publicationtitle": {"prism:doi": "10.1/c"},
                        "ref-title": {"ref-titletext": "Moth diversity along elevation gradients"}}}
        ]}}}
        """);
  }

  @Test
  void referencesResolveScopusIdAndCapResults() throws Exception {
    when(client.search("DOI(\"10.1/seed\")", 1, "dc:identifier", null))
        .thenReturn(identifierResponse());
    when(client.references("777", 20)).thenReturn(referencesResponse());

    List<DocumentRef> references = source.references("10.1/seed");

    assertThat(references).extracting(DocumentRef::id).containsExactly("10.1/a", "10.1/b");
  }

  @Test
  void unknownDoiYieldsNoReferences() {
    when(client.search("DOI(\"10.1/missing\")", 1, "dc:identifier", null)).thenReturn(null);

    assertThat(source.references("10.1/missing")).isEmpty();
    verify(client, never()).references(anyString(), anyInt());
  }

  @Test
  void transportFailureIsWrapped() {
    when(client.search("DOI(\"10.1/seed\")", 1, "dc:identifier", null))
        .thenThrow(new ResourceAccessException("connection refused"));

    assertThatThrownBy(() -> source.references("10.1/seed"))
        .isInstanceOf(CollaboratorException.class)
        .hasCauseInstanceOf(ResourceAccessException.class);
  }

  @Test
  void exhaustedRateLimitIsWrapped() {
    when(client.search("DOI(\"10.1/seed\")", 1, "dc:identifier", null))
        .thenThrow(
            HttpClientErrorException.create(
                HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Requests",
                HttpHeaders.EMPTY,
                new byte[0],
                StandardCharsets.UTF_8));

    assertThatThrownBy(() -> source.references("10.1/seed"))
        .isInstanceOf(CollaboratorException.class)
        .hasCauseInstanceOf(HttpClientErrorException.TooManyRequests.class);
  }

  @Test
  void titleSearchJoinsTermsWithAnd() throws Exception {
    JsonNode response =
        objectMapper.readTree(
            """
            {"search-results": {"entry": [
              {"dc:title": "Canopy Beetle Survey", "prism:doi": "10.1/x"}
            ]}}
            """);
    when(client.search(
            "TITLE-ABS-KEY(\"forest\") AND TITLE-ABS-KEY(\"canopy\")",
            15,
            "dc:title,prism:doi",
            "relevancy"))
        .thenReturn(response);

    List<DocumentRef> found =
        source.searchByTitle("Forest Canopy", List.of("forest", "canopy"), 15);

    assertThat(found).containsExactly(new DocumentRef("10.1/x", "Canopy Beetle Survey"));
  }

  @Test
  void titleSearchWithoutTermsDoesNotCallScopus() {
    assertThat(source.searchByTitle("A", List.of(), 15)).isEmpty();
    verify(client, never()).search(anyString(), anyInt(), anyString(), anyString());
  }

  @Test
  void findAbstractReadsFirstEntry() throws Exception {
    JsonNode response =
        objectMapper.readTree(
            """
            {"search-results": {"entry": [{"dc:title": "T", "dc:description": "D"}]}}
            """);
    when(client.search("DOI(\"10.1/a\")", 1, "dc:title,dc:description,dc:creator", null))
        .thenReturn(response);

    assertThat(source.findAbstract("10.1/a"))
        .hasValueSatisfying(found -> assertThat(found.description()).isEqualTo("D"));
  }
}
