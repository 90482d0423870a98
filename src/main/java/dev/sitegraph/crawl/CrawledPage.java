package dev.sitegraph.crawl;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * One fetched and parsed page. Created by {@link CrawlService} when a fetch succeeds at the
 * transport level (any HTTP status), immutable afterwards.
 *
 * @param url normalized final URL after redirects
 * @param requestedUrl normalized URL taken from the frontier
 * @param title page title, empty if absent
 * @param statusCode HTTP status of the final response
 * @param depth link distance from the seed
 * @param parentUrl page that first linked here, null for the seed
 * @param links outgoing anchors in document order, duplicates included
 * @param internalLinkCount distinct internal targets
 * @param externalLinkCount distinct external targets
 * @param imageCount number of images
 * @param headingCounts heading elements per level 1-6
 * @param metaDescription meta description, empty if absent
 * @param wordCount visible words
 * @param issues on-page findings
 * @param loadTimeMs fetch duration including redirects
 * @param redirectChain URLs that redirected before reaching {@code url}
 * @param linkChecks status checks of internal targets not yet crawled, in document order
 * @param crawledAt when the page was recorded
 */
public record CrawledPage(
    String url,
    String requestedUrl,
    String title,
    int statusCode,
    int depth,
    @Nullable String parentUrl,
    List<PageLink> links,
    int internalLinkCount,
    int externalLinkCount,
    int imageCount,
    Map<Integer, Integer> headingCounts,
    String metaDescription,
    int wordCount,
    Set<PageIssue> issues,
    long loadTimeMs,
    List<String> redirectChain,
    List<LinkCheck> linkChecks,
    Instant crawledAt) {

  public CrawledPage {
    links = links == null ? List.of() : List.copyOf(links);
    headingCounts = headingCounts == null ? Map.of() : Map.copyOf(headingCounts);
    issues =
        issues == null || issues.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
    linkChecks = linkChecks == null ? List.of() : List.copyOf(linkChecks);
  }

  /** Outgoing link targets in document order. */
  public List<String> outgoingLinks() {
    return links.stream().map(PageLink::url).toList();
  }

  /** Checked links that answered with an error status or not at all. */
  public List<LinkCheck> brokenLinks() {
    return linkChecks.stream().filter(LinkCheck::isBroken).toList();
  }

  public int h1Count() {
    return headingCounts.getOrDefault(1, 0);
  }

  public boolean isSeed() {
    return parentUrl == null;
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isBroken() {
    return statusCode >= 400;
  }

  /** 3xx final status, or the final URL differs from the requested one. */
  public boolean isRedirected() {
    return (statusCode >= 300 && statusCode < 400) || !url.equals(requestedUrl);
  }
}
