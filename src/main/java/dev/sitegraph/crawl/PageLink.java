package dev.sitegraph.crawl;

/**
 * One outgoing anchor of a crawled page.
 *
 * @param url normalized absolute target
 * @param anchorText visible anchor text
 * @param internal whether the target is on the seed's host
 * @param nofollow whether the anchor carries {@code rel="nofollow"}
 */
public record PageLink(String url, String anchorText, boolean internal, boolean nofollow) {}
