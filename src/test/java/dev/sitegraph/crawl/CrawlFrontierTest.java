package dev.sitegraph.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CrawlFrontierTest {

  private static final String SEED = "https://example.com/";

  @Test
  void pollHandsOutEntriesInFifoOrderAndMarksThemVisited() {
    CrawlFrontier frontier = new CrawlFrontier(10, 3);
    frontier.seed(SEED);
    frontier.offer("https://example.com/a", 1, SEED);
    frontier.offer("https://example.com/b", 1, SEED);

    assertThat(frontier.poll()).contains(new FrontierEntry(SEED, 0, null));
    assertThat(frontier.poll()).contains(new FrontierEntry("https://example.com/a", 1, SEED));
    assertThat(frontier.isVisited("https://example.com/a")).isTrue();
    assertThat(frontier.isVisited("https://example.com/b")).isFalse();
    assertThat(frontier.inFlight()).isEqualTo(2);
  }

  @Test
  void duplicateQueuedUrlIsHandedOutOnce() {
    CrawlFrontier frontier = new CrawlFrontier(10, 3);
    frontier.offer("https://example.com/a", 1, SEED);
    frontier.offer("https://example.com/a", 1, "https://example.com/other");

    assertThat(frontier.poll()).isPresent();
    assertThat(frontier.poll()).isEmpty();
    assertThat(frontier.visitedCount()).isEqualTo(1);
  }

  @Test
  void offerRejectsVisitedUrl() {
    CrawlFrontier frontier = new CrawlFrontier(10, 3);
    frontier.seed(SEED);
    frontier.poll();

    assertThat(frontier.offer(SEED, 1, SEED)).isFalse();
    assertThat(frontier.poll()).isEmpty();
  }

  @Test
  void entriesDeeperThanMaxDepthAreSkippedWithoutBeingVisited() {
    CrawlFrontier frontier = new CrawlFrontier(10, 1);
    frontier.offer("https://example.com/deep", 2, SEED);
    frontier.offer("https://example.com/ok", 1, SEED);

    assertThat(frontier.poll()).map(FrontierEntry::url).contains("https://example.com/ok");
    assertThat(frontier.isVisited("https://example.com/deep")).isFalse();
  }

  @Test
  void budgetCountsRecordedPagesAndFetchesInFlight() {
    CrawlFrontier frontier = new CrawlFrontier(2, 3);
    frontier.seed(SEED);
    frontier.offer("https://example.com/a", 1, SEED);
    frontier.offer("https://example.com/b", 1, SEED);

    assertThat(frontier.poll()).isPresent();
    assertThat(frontier.poll()).isPresent();
    assertThat(frontier.poll()).isEmpty();

    frontier.complete(true);
    assertThat(frontier.poll()).isEmpty();

    frontier.complete(false);
    assertThat(frontier.poll()).map(FrontierEntry::url).contains("https://example.com/b");
  }

  @Test
  void failedFetchGivesItsSlotBack() {
    CrawlFrontier frontier = new CrawlFrontier(1, 3);
    frontier.seed(SEED);
    frontier.offer("https://example.com/a", 1, SEED);

    assertThat(frontier.poll()).isPresent();
    frontier.complete(false);

    assertThat(frontier.poll()).map(FrontierEntry::url).contains("https://example.com/a");
    frontier.complete(true);
    assertThat(frontier.hasBudget()).isFalse();
  }

  @Test
  void markVisitedReportsFirstMarkOnly() {
    CrawlFrontier frontier = new CrawlFrontier(5, 2);

    assertThat(frontier.markVisited("https://example.com/final")).isTrue();
    assertThat(frontier.markVisited("https://example.com/final")).isFalse();
    assertThat(frontier.isVisited("https://example.com/final")).isTrue();
    assertThat(frontier.visitedCount()).isEqualTo(1);
  }

  @Test
  void completeWithoutPollIsRejected() {
    CrawlFrontier frontier = new CrawlFrontier(5, 2);

    assertThatThrownBy(() -> frontier.complete(true)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsInvalidLimits() {
    assertThatThrownBy(() -> new CrawlFrontier(0, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new CrawlFrontier(1, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
