package dev.sitegraph.api;

import dev.sitegraph.crawl.CrawlProgress;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * State of an asynchronous crawl job.
 *
 * @param crawlId job identifier
 * @param progress latest progress snapshot
 * @param report the report once the crawl has completed, null before
 * @param error failure message if the crawl failed, null otherwise
 */
public record CrawlJobStatus(
    UUID crawlId, CrawlProgress progress, @Nullable CrawlReport report, @Nullable String error) {}
