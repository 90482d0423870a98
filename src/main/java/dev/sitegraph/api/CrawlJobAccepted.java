package dev.sitegraph.api;

import java.util.UUID;

/** Response body of a crawl job submission. */
public record CrawlJobAccepted(UUID crawlId) {}
