package dev.sitegraph.graph;

import java.util.List;

/**
 * Pages grouped by how their link counts compare with the site average. A page may appear in
 * several groups.
 *
 * @param wellLinked incoming at least half the average, outgoing between half and twice the average
 * @param underLinked incoming below 30% of the average
 * @param overLinked outgoing above three times the average
 * @param hubs outgoing above twice the average
 * @param authorities incoming above twice the average
 */
public record LinkDistribution(
    List<LinkNode> wellLinked,
    List<LinkNode> underLinked,
    List<LinkNode> overLinked,
    List<LinkNode> hubs,
    List<LinkNode> authorities) {

  public static LinkDistribution empty() {
    return new LinkDistribution(List.of(), List.of(), List.of(), List.of(), List.of());
  }
}
