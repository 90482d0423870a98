package dev.sitegraph.api;

import dev.sitegraph.crawl.CrawlResult;
import dev.sitegraph.graph.LinkDistribution;
import dev.sitegraph.graph.LinkGraph;
import dev.sitegraph.graph.LinkSuggestion;
import java.util.List;

/**
 * Everything known about a finished crawl.
 *
 * @param result pages, probe findings, statistics and errors
 * @param graph internal link graph of the crawled pages
 * @param distribution pages grouped by link counts
 * @param suggestions internal links worth adding
 */
public record CrawlReport(
    CrawlResult result,
    LinkGraph graph,
    LinkDistribution distribution,
    List<LinkSuggestion> suggestions) {

  public CrawlReport {
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }
}
