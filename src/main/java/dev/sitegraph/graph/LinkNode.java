package dev.sitegraph.graph;

/**
 * A crawled page in the link graph.
 *
 * @param url normalized final URL
 * @param title page title, empty if absent
 * @param depth link distance from the seed
 * @param statusCode HTTP status of the page
 * @param incomingLinks internal edges from other pages
 * @param outgoingLinks internal edges to other pages
 * @param orphan no incoming internal edge and not the seed
 * @param pageType category guessed from the URL
 */
public record LinkNode(
    String url,
    String title,
    int depth,
    int statusCode,
    int incomingLinks,
    int outgoingLinks,
    boolean orphan,
    PageType pageType) {}
