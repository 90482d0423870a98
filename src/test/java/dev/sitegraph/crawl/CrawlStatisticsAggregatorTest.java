package dev.sitegraph.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sitegraph.fixture.CrawledPageBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrawlStatisticsAggregatorTest {

  @Test
  void emptyCrawlHasZeroAverage() {
    CrawlStatistics stats = CrawlStatisticsAggregator.aggregate(List.of(), 0);

    assertThat(stats).isEqualTo(new CrawlStatistics(0, 0, 0, 0, 0, 0.0, 0, 0, 0));
  }

  @Test
  void countsStatusClassesAndRedirects() {
    List<CrawledPage> pages =
        List.of(
            new CrawledPageBuilder().url("/").loadTimeMs(100).build(),
            new CrawledPageBuilder().url("/missing").statusCode(404).loadTimeMs(50).build(),
            new CrawledPageBuilder().url("/down").statusCode(500).loadTimeMs(30).build(),
            new CrawledPageBuilder().url("/new").requestedUrl("/old").loadTimeMs(20).build(),
            new CrawledPageBuilder().url("/moved").statusCode(304).loadTimeMs(0).build());

    CrawlStatistics stats = CrawlStatisticsAggregator.aggregate(pages, 2);

    assertThat(stats.totalPages()).isEqualTo(5);
    assertThat(stats.successfulPages()).isEqualTo(2);
    assertThat(stats.failedPages()).isEqualTo(4);
    assertThat(stats.fetchErrors()).isEqualTo(2);
    assertThat(stats.redirectedPages()).isEqualTo(2);
    assertThat(stats.averageLoadTimeMs()).isEqualTo(40.0);
  }

  @Test
  void sumsDistinctLinkCounts() {
    List<CrawledPage> pages =
        List.of(
            new CrawledPageBuilder()
                .url("/")
                .internalLink("/a")
                .internalLink("/a")
                .internalLink("/b")
                .externalLink("https://other.org/")
                .build(),
            new CrawledPageBuilder().url("/a").internalLink("/").build());

    CrawlStatistics stats = CrawlStatisticsAggregator.aggregate(pages, 0);

    assertThat(stats.totalInternalLinks()).isEqualTo(3);
    assertThat(stats.totalExternalLinks()).isEqualTo(1);
  }

  @Test
  void countsBrokenLinkChecks() {
    List<CrawledPage> pages =
        List.of(
            new CrawledPageBuilder()
                .url("/")
                .linkCheck("/ok", 200)
                .linkCheck("/gone", 404)
                .linkCheck("/down", 0)
                .build(),
            new CrawledPageBuilder().url("/a").linkCheck("/error", 500).build());

    CrawlStatistics stats = CrawlStatisticsAggregator.aggregate(pages, 0);

    assertThat(stats.totalBrokenLinks()).isEqualTo(3);
    assertThat(pages.get(0).brokenLinks())
        .extracting(LinkCheck::url)
        .containsExactly("https://example.com/gone", "https://example.com/down");
  }
}
