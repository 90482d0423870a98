package dev.sitegraph.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Crawl scheduler settings bound from {@code sitegraph.crawl.*}.
 *
 * <ul>
 *   <li>{@code fan-out-limit} - internal links of a single page admitted to the frontier (default
 *       10)
 *   <li>{@code concurrency} - fetches in flight at once (default 4; 1 gives a strict BFS order)
 *   <li>{@code default-max-pages} / {@code max-pages-cap} - page budget default and upper bound
 *   <li>{@code default-max-depth} / {@code max-depth-cap} - depth default and upper bound
 * </ul>
 */
@ConfigurationProperties(prefix = "sitegraph.crawl")
public record CrawlProperties(
    @DefaultValue("10") int fanOutLimit,
    @DefaultValue("4") int concurrency,
    @DefaultValue("20") int defaultMaxPages,
    @DefaultValue("3") int defaultMaxDepth,
    @DefaultValue("100") int maxPagesCap,
    @DefaultValue("5") int maxDepthCap) {

  public CrawlProperties {
    if (fanOutLimit < 1) {
      throw new IllegalStateException(
          "sitegraph.crawl.fan-out-limit must be >= 1, got: " + fanOutLimit);
    }
    if (concurrency < 1) {
      throw new IllegalStateException(
          "sitegraph.crawl.concurrency must be >= 1, got: " + concurrency);
    }
    if (maxPagesCap < 1 || defaultMaxPages < 1 || defaultMaxPages > maxPagesCap) {
      throw new IllegalStateException(
          "sitegraph.crawl.default-max-pages must be in [1, max-pages-cap], got: "
              + defaultMaxPages);
    }
    if (maxDepthCap < 0 || defaultMaxDepth < 0 || defaultMaxDepth > maxDepthCap) {
      throw new IllegalStateException(
          "sitegraph.crawl.default-max-depth must be in [0, max-depth-cap], got: "
              + defaultMaxDepth);
    }
  }

  public static CrawlProperties defaults() {
    return new CrawlProperties(10, 4, 20, 3, 100, 5);
  }

  /** Resolve the effective limits of a request: defaults for missing values, caps applied. */
  public CrawlLimits limitsFor(CrawlRequest request) {
    int maxPages = request.maxPages() == null ? defaultMaxPages : request.maxPages();
    int maxDepth = request.maxDepth() == null ? defaultMaxDepth : request.maxDepth();
    return new CrawlLimits(
        Math.max(1, Math.min(maxPages, maxPagesCap)), Math.max(0, Math.min(maxDepth, maxDepthCap)));
  }

  /**
   * Effective limits of one run.
   *
   * @param maxPages pages recorded at most
   * @param maxDepth deepest frontier distance fetched
   */
  public record CrawlLimits(int maxPages, int maxDepth) {}
}
