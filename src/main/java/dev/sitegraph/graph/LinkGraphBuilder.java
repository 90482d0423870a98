package dev.sitegraph.graph;

import dev.sitegraph.crawl.CrawledPage;
import dev.sitegraph.crawl.LinkCheck;
import dev.sitegraph.crawl.PageLink;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link LinkGraph} of a finished crawl.
 *
 * <p>Each page contributes one edge per distinct target; the anchor text of the first anchor wins.
 * A page reached through a redirect is known by its final URL, so links to the URL it was
 * requested as are credited to the final URL. Self-links are kept as edges but never count as
 * incoming or outgoing links. Internal targets that were never crawled still receive incoming
 * counts and are listed in {@link LinkGraph#referencedNotCrawled()}, with the status of their link
 * check when one was made.
 */
@Component
public class LinkGraphBuilder {

  private static final Logger log = LoggerFactory.getLogger(LinkGraphBuilder.class);

  /**
   * Build the graph, taking the depth-0 page as the seed.
   *
   * @param pages crawled pages in crawl order
   * @return nodes, edges, orphans and dangling targets
   */
  public LinkGraph buildGraph(List<CrawledPage> pages) {
    return buildGraph(pages, null);
  }

  /**
   * Build the graph.
   *
   * @param pages crawled pages in crawl order
   * @param seedUrl URL the crawl started from (requested or final form), or null to take the
   *     depth-0 page
   * @return nodes, edges, orphans and dangling targets
   */
  public LinkGraph buildGraph(List<CrawledPage> pages, @Nullable String seedUrl) {
    if (pages.isEmpty()) {
      return LinkGraph.empty();
    }

    Map<String, CrawledPage> pagesByUrl = new LinkedHashMap<>();
    Map<String, String> aliases = new HashMap<>();
    Map<String, Integer> checkedStatus = new HashMap<>();
    for (CrawledPage page : pages) {
      for (LinkCheck check : page.linkChecks()) {
        checkedStatus.putIfAbsent(check.url(), check.statusCode());
      }
      pagesByUrl.putIfAbsent(page.url(), page);
      aliases.putIfAbsent(page.requestedUrl(), page.url());
      for (String hop : page.redirectChain()) {
        aliases.putIfAbsent(hop, page.url());
      }
    }

    List<LinkEdge> edges = new ArrayList<>();
    Map<String, Integer> incoming = new HashMap<>();
    Map<String, Integer> outgoing = new HashMap<>();
    for (CrawledPage page : pagesByUrl.values()) {
      Map<String, PageLink> firstByTarget = new LinkedHashMap<>();
      for (PageLink link : page.links()) {
        firstByTarget.putIfAbsent(aliases.getOrDefault(link.url(), link.url()), link);
      }
      for (Map.Entry<String, PageLink> entry : firstByTarget.entrySet()) {
        String target = entry.getKey();
        PageLink link = entry.getValue();
        LinkEdge edge =
            new LinkEdge(
                page.url(),
                target,
                link.anchorText(),
                link.internal() ? LinkEdge.EdgeType.INTERNAL : LinkEdge.EdgeType.EXTERNAL);
        edges.add(edge);
        if (edge.isInternal() && !edge.isSelfLink()) {
          incoming.merge(target, 1, Integer::sum);
          outgoing.merge(page.url(), 1, Integer::sum);
        }
      }
    }

    String seed = resolveSeed(pages, seedUrl, aliases);
    List<LinkNode> nodes = new ArrayList<>(pagesByUrl.size());
    List<String> orphans = new ArrayList<>();
    for (CrawledPage page : pagesByUrl.values()) {
      int incomingLinks = incoming.getOrDefault(page.url(), 0);
      boolean orphan = incomingLinks == 0 && !page.url().equals(seed);
      if (orphan) {
        orphans.add(page.url());
      }
      nodes.add(
          new LinkNode(
              page.url(),
              page.title(),
              page.depth(),
              page.statusCode(),
              incomingLinks,
              outgoing.getOrDefault(page.url(), 0),
              orphan,
              PageType.classify(page.url())));
    }

    List<DanglingTarget> dangling =
        incoming.entrySet().stream()
            .filter(entry -> !pagesByUrl.containsKey(entry.getKey()))
            .map(
                entry ->
                    new DanglingTarget(
                        entry.getKey(), entry.getValue(), checkedStatus.get(entry.getKey())))
            .sorted(
                Comparator.comparingInt(DanglingTarget::incomingLinks)
                    .reversed()
                    .thenComparing(DanglingTarget::url))
            .toList();

    LinkGraphStats stats = stats(nodes, edges);
    log.debug(
        "Link graph: {} nodes, {} internal edges, {} orphans, {} referenced but not crawled",
        nodes.size(),
        stats.totalLinks(),
        orphans.size(),
        dangling.size());
    return new LinkGraph(nodes, edges, orphans, dangling, stats);
  }

  private static String resolveSeed(
      List<CrawledPage> pages, @Nullable String seedUrl, Map<String, String> aliases) {
    if (seedUrl != null) {
      return aliases.getOrDefault(seedUrl, seedUrl);
    }
    return pages.stream()
        .filter(page -> page.depth() == 0)
        .map(CrawledPage::url)
        .findFirst()
        .orElse(pages.get(0).url());
  }

  private static LinkGraphStats stats(List<LinkNode> nodes, List<LinkEdge> edges) {
    int internalEdges = (int) edges.stream().filter(LinkEdge::isInternal).count();
    double average = nodes.isEmpty() ? 0.0 : (double) internalEdges / nodes.size();
    int maxDepth = nodes.stream().mapToInt(LinkNode::depth).max().orElse(0);
    return new LinkGraphStats(
        nodes.size(), internalEdges, Math.round(average * 10) / 10.0, maxDepth);
  }
}
