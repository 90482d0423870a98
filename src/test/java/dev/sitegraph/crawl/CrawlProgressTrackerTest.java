package dev.sitegraph.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CrawlProgressTrackerTest {

    private CrawlProgressTracker tracker;
    private UUID crawlId;

    @BeforeEach
    void setUp() {
        tracker = new CrawlProgressTracker();
        crawlId = UUID.randomUUID();
    }

    private static CrawlProgress crawling(int current, String url) {
        return new CrawlProgress(current, 10, url, CrawlProgress.Status.CRAWLING);
    }

    @Test
    void startCrawlCreatesIdleProgress() {
        tracker.startCrawl(crawlId);

        CrawlProgress progress = tracker.getProgress(crawlId).orElseThrow();

        assertThat(progress.status()).isEqualTo(CrawlProgress.Status.IDLE);
        assertThat(progress.current()).isZero();
        assertThat(progress.total()).isZero();
        assertThat(progress.currentUrl()).isEmpty();
    }

    @Test
    void listenerStoresLatestSnapshot() {
        tracker.startCrawl(crawlId);
        CrawlProgressListener listener = tracker.listenerFor(crawlId);

        listener.onProgress(crawling(1, "https://example.com/"));
        listener.onProgress(crawling(2, "https://example.com/a"));

        CrawlProgress progress = tracker.getProgress(crawlId).orElseThrow();
        assertThat(progress.current()).isEqualTo(2);
        assertThat(progress.currentUrl()).isEqualTo("https://example.com/a");
    }

    @Test
    void listenerIgnoresSnapshotsAfterRemoval() {
        tracker.startCrawl(crawlId);
        CrawlProgressListener listener = tracker.listenerFor(crawlId);
        tracker.removeCrawl(crawlId);

        listener.onProgress(crawling(1, "https://example.com/"));

        assertThat(tracker.getProgress(crawlId)).isEmpty();
    }

    @Test
    void failCrawlKeepsCountersAndSetsError() {
        tracker.startCrawl(crawlId);
        tracker.listenerFor(crawlId).onProgress(crawling(3, "https://example.com/c"));

        tracker.failCrawl(crawlId);

        CrawlProgress progress = tracker.getProgress(crawlId).orElseThrow();
        assertThat(progress.status()).isEqualTo(CrawlProgress.Status.ERROR);
        assertThat(progress.current()).isEqualTo(3);
        assertThat(progress.isFinished()).isTrue();
    }

    @Test
    void cancelFlipsTheTokenHandedOutAtStart() {
        CancellationToken token = tracker.startCrawl(crawlId);

        assertThat(token.isCancelled()).isFalse();
        assertThat(tracker.cancel(crawlId)).isTrue();

        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void cancelUnknownCrawlReturnsFalse() {
        assertThat(tracker.cancel(UUID.randomUUID())).isFalse();
    }

    @Test
    void getProgressReturnsEmptyForUnknownCrawl() {
        assertThat(tracker.getProgress(UUID.randomUUID())).isEmpty();
    }

    @Test
    void removeCrawlStopsTracking() {
        tracker.startCrawl(crawlId);

        tracker.removeCrawl(crawlId);

        assertThat(tracker.getProgress(crawlId)).isEmpty();
        assertThat(tracker.cancel(crawlId)).isFalse();
    }
}
