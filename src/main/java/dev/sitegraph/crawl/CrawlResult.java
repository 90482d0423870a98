package dev.sitegraph.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Terminal output of a crawl run. Always returned, even when every fetch failed: a partial result
 * with a list of errors is the normal outcome against an imperfect site.
 *
 * @param startUrl normalized seed URL
 * @param pages recorded pages in crawl (completion) order
 * @param robotsFound whether robots.txt exists
 * @param robotsContent robots.txt body, empty when absent
 * @param sitemapFound whether a sitemap exists at a well-known location
 * @param sitemapUrl location of the sitemap, null when absent
 * @param sitemapEntryCount entries in the sitemap
 * @param totalPages number of recorded pages
 * @param totalLinks sum of every page's outgoing link count, duplicates included
 * @param statistics aggregate statistics
 * @param errors non-fatal failures, one line each
 * @param visitedCount URLs dequeued for fetching, failed ones included
 * @param cancelled whether the run was stopped before the frontier drained
 */
public record CrawlResult(
    String startUrl,
    List<CrawledPage> pages,
    boolean robotsFound,
    String robotsContent,
    boolean sitemapFound,
    @Nullable String sitemapUrl,
    int sitemapEntryCount,
    int totalPages,
    int totalLinks,
    CrawlStatistics statistics,
    List<String> errors,
    int visitedCount,
    boolean cancelled) {

  public CrawlResult {
    pages = pages == null ? List.of() : List.copyOf(pages);
    robotsContent = robotsContent == null ? "" : robotsContent;
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
