package dev.sitegraph.crawl;

import java.util.List;

/** Static utility reducing crawled pages to {@link CrawlStatistics}. */
public final class CrawlStatisticsAggregator {

  private CrawlStatisticsAggregator() {
    // utility class
  }

  /**
   * Aggregate a run.
   *
   * @param pages recorded pages
   * @param fetchErrors fetch attempts that produced no page
   * @return summary statistics
   */
  public static CrawlStatistics aggregate(List<CrawledPage> pages, int fetchErrors) {
    int successful = 0;
    int broken = 0;
    int redirected = 0;
    long loadTime = 0;
    int internal = 0;
    int external = 0;
    int brokenLinks = 0;
    for (CrawledPage page : pages) {
      if (page.isSuccess()) {
        successful++;
      }
      if (page.isBroken()) {
        broken++;
      }
      if (page.isRedirected()) {
        redirected++;
      }
      loadTime += page.loadTimeMs();
      internal += page.internalLinkCount();
      external += page.externalLinkCount();
      brokenLinks += page.brokenLinks().size();
    }
    double averageLoadTime = pages.isEmpty() ? 0.0 : (double) loadTime / pages.size();
    return new CrawlStatistics(
        pages.size(),
        successful,
        broken + fetchErrors,
        redirected,
        fetchErrors,
        averageLoadTime,
        internal,
        external,
        brokenLinks);
  }
}
