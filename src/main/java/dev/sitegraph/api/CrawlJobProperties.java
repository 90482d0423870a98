package dev.sitegraph.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Background job settings bound from {@code sitegraph.jobs.*}.
 *
 * @param maxRetained finished jobs kept for polling; the oldest are forgotten beyond this
 */
@ConfigurationProperties(prefix = "sitegraph.jobs")
public record CrawlJobProperties(@DefaultValue("50") int maxRetained) {

  public CrawlJobProperties {
    if (maxRetained < 1) {
      throw new IllegalStateException(
          "sitegraph.jobs.max-retained must be >= 1, got: " + maxRetained);
    }
  }

  public static CrawlJobProperties defaults() {
    return new CrawlJobProperties(50);
  }
}
