package dev.sitegraph.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/** Link distribution and internal-linking suggestions over the nodes of a {@link LinkGraph}. */
@Component
public class LinkGraphAnalyzer {

  static final int MAX_SUGGESTIONS = 10;
  static final int HUB_MIN_OUTGOING = 5;
  static final int UNDER_LINKED_MAX_INCOMING = 2;

  /**
   * Group pages by their link counts relative to the mean incoming and outgoing counts.
   *
   * @param nodes graph nodes
   * @return the groups, all empty when there are no nodes
   */
  public LinkDistribution distribution(List<LinkNode> nodes) {
    if (nodes.isEmpty()) {
      return LinkDistribution.empty();
    }
    double avgIncoming = nodes.stream().mapToInt(LinkNode::incomingLinks).average().orElse(0);
    double avgOutgoing = nodes.stream().mapToInt(LinkNode::outgoingLinks).average().orElse(0);

    return new LinkDistribution(
        filter(
            nodes,
            n ->
                n.incomingLinks() >= avgIncoming * 0.5
                    && n.outgoingLinks() >= avgOutgoing * 0.5
                    && n.outgoingLinks() <= avgOutgoing * 2),
        filter(nodes, n -> n.incomingLinks() < avgIncoming * 0.3),
        filter(nodes, n -> n.outgoingLinks() > avgOutgoing * 3),
        filter(nodes, n -> n.outgoingLinks() > avgOutgoing * 2),
        filter(nodes, n -> n.incomingLinks() > avgIncoming * 2));
  }

  /**
   * Suggest internal links: every orphan gets a link from a linked page of the same type, then
   * under-linked pages (other than the homepage) get a link from a hub page.
   *
   * @param nodes graph nodes in crawl order
   * @return at most {@value #MAX_SUGGESTIONS} suggestions, orphans first
   */
  public List<LinkSuggestion> suggest(List<LinkNode> nodes) {
    List<LinkSuggestion> suggestions = new ArrayList<>();

    for (LinkNode orphan : filter(nodes, LinkNode::orphan)) {
      firstMatch(nodes, n -> isSameTypeLinkedPage(n, orphan))
          .ifPresent(
              from ->
                  suggestions.add(
                      new LinkSuggestion(
                          from.url(),
                          orphan.url(),
                          "Link to orphan page from similar "
                              + orphan.pageType().label()
                              + " page",
                          LinkSuggestion.Priority.HIGH)));
    }

    List<LinkNode> underLinked =
        filter(
            nodes,
            n ->
                n.incomingLinks() < UNDER_LINKED_MAX_INCOMING
                    && !n.orphan()
                    && n.pageType() != PageType.HOMEPAGE);
    for (LinkNode page : underLinked) {
      firstMatch(
              nodes, n -> n.outgoingLinks() > HUB_MIN_OUTGOING && !n.url().equals(page.url()))
          .ifPresent(
              hub ->
                  suggestions.add(
                      new LinkSuggestion(
                          hub.url(),
                          page.url(),
                          "Increase visibility of under-linked " + page.pageType().label(),
                          LinkSuggestion.Priority.MEDIUM)));
    }

    return suggestions.size() > MAX_SUGGESTIONS
        ? List.copyOf(suggestions.subList(0, MAX_SUGGESTIONS))
        : List.copyOf(suggestions);
  }

  private static List<LinkNode> filter(List<LinkNode> nodes, Predicate<LinkNode> predicate) {
    return nodes.stream().filter(predicate).toList();
  }

  private static Optional<LinkNode> firstMatch(
      List<LinkNode> nodes, Predicate<LinkNode> predicate) {
    return nodes.stream().filter(predicate).findFirst();
  }

  private static boolean isSameTypeLinkedPage(LinkNode candidate, LinkNode orphan) {
    return candidate.pageType() == orphan.pageType()
        && !candidate.url().equals(orphan.url())
        && !candidate.orphan();
  }
}
