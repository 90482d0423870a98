package dev.sitegraph.graph;

import java.util.List;

/**
 * Internal link structure of a crawl.
 *
 * @param nodes one node per crawled page, in crawl order
 * @param edges one edge per source page and distinct target
 * @param orphanPages URLs of nodes without incoming internal edges, the seed excepted
 * @param referencedNotCrawled internal targets with no node, most linked first
 * @param stats summary figures
 */
public record LinkGraph(
    List<LinkNode> nodes,
    List<LinkEdge> edges,
    List<String> orphanPages,
    List<DanglingTarget> referencedNotCrawled,
    LinkGraphStats stats) {

  public LinkGraph {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
    orphanPages = orphanPages == null ? List.of() : List.copyOf(orphanPages);
    referencedNotCrawled =
        referencedNotCrawled == null ? List.of() : List.copyOf(referencedNotCrawled);
  }

  public static LinkGraph empty() {
    return new LinkGraph(List.of(), List.of(), List.of(), List.of(), LinkGraphStats.empty());
  }
}
