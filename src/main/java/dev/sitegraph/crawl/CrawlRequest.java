package dev.sitegraph.crawl;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;

/**
 * Input of a crawl run. Missing limits fall back to the configured defaults; values above the
 * configured caps are clamped (see {@link CrawlProperties#limitsFor(CrawlRequest)}).
 *
 * @param startUrl seed URL
 * @param maxPages maximum number of pages to record
 * @param maxDepth maximum link distance from the seed
 */
public record CrawlRequest(
    @NotBlank String startUrl,
    @Nullable @Positive Integer maxPages,
    @Nullable @PositiveOrZero Integer maxDepth) {

  public static CrawlRequest of(String startUrl) {
    return new CrawlRequest(startUrl, null, null);
  }
}
