package dev.sitegraph.crawl;

/**
 * Immutable snapshot of a crawl's progress.
 *
 * <p>Emitted by {@link CrawlService} through a {@link CrawlProgressListener} on start, once per
 * fetch attempt, and when the run ends. Each emission is a new record (value semantics for thread
 * safety).
 *
 * @param current    fetch attempts dispatched so far
 * @param total      page budget of the run
 * @param currentUrl URL of the latest fetch attempt, empty before the first one
 * @param status     current crawl status
 */
public record CrawlProgress(
        int current,
        int total,
        String currentUrl,
        Status status
) {

    public CrawlProgress {
        currentUrl = currentUrl == null ? "" : currentUrl;
    }

    public static CrawlProgress idle() {
        return new CrawlProgress(0, 0, "", Status.IDLE);
    }

    /**
     * Copy of this snapshot with another status.
     */
    public CrawlProgress withStatus(Status newStatus) {
        return new CrawlProgress(current, total, currentUrl, newStatus);
    }

    public boolean isFinished() {
        return status == Status.COMPLETED || status == Status.ERROR;
    }

    /**
     * Crawl progress status.
     */
    public enum Status {
        IDLE,
        CRAWLING,
        COMPLETED,
        ERROR
    }
}
