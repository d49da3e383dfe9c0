package dev.citecrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the citation crawler.
 *
 * <p>Runs a single crawl configured through {@code citecrawl.*} properties and exits with the run's
 * exit code. No web server is started.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class CitecrawlApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(CitecrawlApplication.class, args)));
  }
}
