package dev.sitegraph.crawl;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for crawl jobs.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of the latest {@link CrawlProgress} snapshot and a
 * {@link CancellationToken} per crawl ID. The listener returned by {@link #listenerFor(UUID)}
 * writes every snapshot it receives back into the map.
 *
 * <p>This is a singleton Spring bean. Progress data is transient (in-memory only) and lost
 * on restart.
 */
@Component
public class CrawlProgressTracker {

    private final ConcurrentHashMap<UUID, CrawlProgress> activeCrawls = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();

    /**
     * Start tracking a new crawl.
     *
     * @param crawlId the crawl job
     * @return the token that cancels this crawl
     */
    public CancellationToken startCrawl(UUID crawlId) {
        CancellationToken token = new CancellationToken();
        tokens.put(crawlId, token);
        activeCrawls.put(crawlId, CrawlProgress.idle());
        return token;
    }

    /**
     * Listener recording snapshots for a tracked crawl. Snapshots arriving after
     * {@link #removeCrawl(UUID)} are dropped.
     *
     * @param crawlId the crawl job
     * @return progress listener
     */
    public CrawlProgressListener listenerFor(UUID crawlId) {
        return progress -> activeCrawls.computeIfPresent(crawlId, (id, previous) -> progress);
    }

    /**
     * Mark a crawl as failed, keeping its last counters.
     *
     * @param crawlId the crawl whose run failed
     */
    public void failCrawl(UUID crawlId) {
        activeCrawls.computeIfPresent(crawlId, (id, progress) ->
                progress.withStatus(CrawlProgress.Status.ERROR));
    }

    /**
     * Get the current progress snapshot for a crawl.
     *
     * @param crawlId the crawl to check
     * @return progress snapshot, or empty if not tracking this crawl
     */
    public Optional<CrawlProgress> getProgress(UUID crawlId) {
        return Optional.ofNullable(activeCrawls.get(crawlId));
    }

    /**
     * Request cooperative cancellation.
     *
     * @param crawlId the crawl to cancel
     * @return false if the crawl is not tracked
     */
    public boolean cancel(UUID crawlId) {
        CancellationToken token = tokens.get(crawlId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    /**
     * Remove a crawl from tracking.
     *
     * @param crawlId the crawl to stop tracking
     */
    public void removeCrawl(UUID crawlId) {
        activeCrawls.remove(crawlId);
        tokens.remove(crawlId);
    }
}
