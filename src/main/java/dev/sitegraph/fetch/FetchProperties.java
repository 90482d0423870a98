package dev.sitegraph.fetch;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * HTTP fetch settings bound from {@code sitegraph.fetch.*}.
 *
 * @param timeout per-page deadline covering connect, redirect hops and the body download
 * @param userAgent value of the {@code User-Agent} request header
 * @param maxRedirects redirects followed before giving up
 * @param linkCheckTimeout deadline of a single link status check
 * @param maxBodySize bytes of a response body kept; the rest is discarded
 */
@ConfigurationProperties(prefix = "sitegraph.fetch")
public record FetchProperties(
    @DefaultValue("30s") Duration timeout,
    @DefaultValue("Mozilla/5.0 (compatible; SiteGraph-Bot/1.0)") String userAgent,
    @DefaultValue("10") int maxRedirects,
    @DefaultValue("10s") Duration linkCheckTimeout,
    @DefaultValue("5MB") DataSize maxBodySize) {

  public FetchProperties {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException("sitegraph.fetch.timeout must be positive, got: " + timeout);
    }
    if (maxRedirects < 0) {
      throw new IllegalStateException(
          "sitegraph.fetch.max-redirects must be >= 0, got: " + maxRedirects);
    }
    if (linkCheckTimeout == null || linkCheckTimeout.isZero() || linkCheckTimeout.isNegative()) {
      throw new IllegalStateException(
          "sitegraph.fetch.link-check-timeout must be positive, got: " + linkCheckTimeout);
    }
    if (maxBodySize == null || maxBodySize.toBytes() < 1) {
      throw new IllegalStateException(
          "sitegraph.fetch.max-body-size must be positive, got: " + maxBodySize);
    }
  }

  public static FetchProperties defaults() {
    return new FetchProperties(
        Duration.ofSeconds(30),
        "Mozilla/5.0 (compatible; SiteGraph-Bot/1.0)",
        10,
        Duration.ofSeconds(10),
        DataSize.ofMegabytes(5));
  }
}
