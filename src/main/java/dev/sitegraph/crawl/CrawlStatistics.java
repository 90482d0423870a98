package dev.sitegraph.crawl;

/**
 * Summary of a crawl run.
 *
 * @param totalPages recorded pages
 * @param successfulPages pages with a 2xx status
 * @param failedPages pages with status &gt;= 400 plus fetches that failed outright
 * @param redirectedPages pages with a 3xx status or whose final URL differs from the requested one
 * @param fetchErrors fetches that failed outright and produced no page
 * @param averageLoadTimeMs mean load time over recorded pages, 0 when there are none
 * @param totalInternalLinks sum of distinct internal links per page
 * @param totalExternalLinks sum of distinct external links per page
 * @param totalBrokenLinks checked link targets that answered with a status &gt;= 400 or not at all
 */
public record CrawlStatistics(
    int totalPages,
    int successfulPages,
    int failedPages,
    int redirectedPages,
    int fetchErrors,
    double averageLoadTimeMs,
    int totalInternalLinks,
    int totalExternalLinks,
    int totalBrokenLinks) {}
