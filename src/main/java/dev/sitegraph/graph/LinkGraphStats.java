package dev.sitegraph.graph;

/**
 * @param totalPages nodes in the graph
 * @param totalLinks internal edges
 * @param avgLinksPerPage internal edges per node, rounded to one decimal
 * @param maxDepth deepest crawled page
 */
public record LinkGraphStats(int totalPages, int totalLinks, double avgLinksPerPage, int maxDepth) {

  public static LinkGraphStats empty() {
    return new LinkGraphStats(0, 0, 0.0, 0);
  }
}
