package dev.sitegraph.crawl;

import org.jspecify.annotations.Nullable;

/**
 * A pending visit.
 *
 * @param url normalized URL to fetch
 * @param depth link distance from the seed at enqueue time
 * @param parentUrl page the link was discovered on, null for the seed
 */
public record FrontierEntry(String url, int depth, @Nullable String parentUrl) {}
