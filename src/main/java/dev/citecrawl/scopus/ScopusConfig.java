package dev.citecrawl.scopus;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the Elsevier Scopus APIs.
 *
 * <p>Timeouts and the API key come from {@code citecrawl.scopus.*} properties. Every request
 * carries the {@code X-ELS-APIKey} header and asks for JSON. The client is qualified as {@code
 * "scopusRestClient"}.
 */
@Configuration
public class ScopusConfig {

  static final String API_KEY_HEADER = "X-ELS-APIKey";

  /**
   * Creates a pre-configured {@link RestClient} targeting the Scopus API.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties Scopus connection settings
   * @return a named REST client bean for injection into {@link ScopusClient}
   */
  @Bean
  public RestClient scopusRestClient(RestClient.Builder builder, ScopusProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(API_KEY_HEADER, properties.apiKey())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
