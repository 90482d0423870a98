package dev.sitegraph.crawl;

import dev.sitegraph.fetch.FetchException;
import dev.sitegraph.fetch.FetchProperties;
import dev.sitegraph.fetch.FetchResult;
import dev.sitegraph.fetch.PageFetcher;
import dev.sitegraph.link.ClassifiedLinks;
import dev.sitegraph.link.LinkClassifier;
import dev.sitegraph.parse.ExtractedLink;
import dev.sitegraph.parse.PageFacts;
import dev.sitegraph.parse.PageParser;
import dev.sitegraph.probe.SiteProbe;
import dev.sitegraph.probe.SiteProbeResult;
import dev.sitegraph.url.InvalidUrlException;
import dev.sitegraph.url.UrlNormalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Crawl orchestrator: breadth-first traversal of same-host links from a seed URL, bounded by page
 * count and depth. Probes robots.txt and sitemaps, fetches up to {@code concurrency} pages at a
 * time, and reports progress through a {@link CrawlProgressListener}.
 *
 * <p>Only the calling thread mutates the frontier and the page list. Worker threads fetch, parse,
 * status-check internal links not crawled yet and build a {@link CrawledPage}; the calling thread
 * collects their outcomes through an {@link ExecutorCompletionService}, records them and enqueues
 * the discovered links. All state lives in the call; nothing is shared between runs.
 */
@Service
public class CrawlService {

  private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

  private final PageFetcher pageFetcher;
  private final PageParser pageParser;
  private final SiteProbe siteProbe;
  private final FetchProperties fetchProperties;
  private final CrawlProperties crawlProperties;
  private final Clock clock;

  public CrawlService(
      PageFetcher pageFetcher,
      PageParser pageParser,
      SiteProbe siteProbe,
      FetchProperties fetchProperties,
      CrawlProperties crawlProperties,
      Clock clock) {
    this.pageFetcher = pageFetcher;
    this.pageParser = pageParser;
    this.siteProbe = siteProbe;
    this.fetchProperties = fetchProperties;
    this.crawlProperties = crawlProperties;
    this.clock = clock;
  }

  /**
   * Crawl a site without progress reporting or cancellation.
   *
   * @param request seed URL and optional limits
   * @return pages, probe findings, statistics and non-fatal errors
   * @throws InvalidSeedException if the start URL cannot be normalized
   */
  public CrawlResult crawl(CrawlRequest request) {
    return crawl(request, CrawlProgressListener.NOOP, CancellationToken.none());
  }

  /**
   * Crawl a site from a seed URL. Per-page failures never abort the run; they are collected in
   * {@link CrawlResult#errors()}.
   *
   * @param request seed URL and optional limits
   * @param listener receives progress snapshots
   * @param token stops the run before the next fetch is handed out
   * @return pages, probe findings, statistics and non-fatal errors
   * @throws InvalidSeedException if the start URL cannot be normalized; no fetch is made
   */
  public CrawlResult crawl(
      CrawlRequest request, CrawlProgressListener listener, CancellationToken token) {
    String seed;
    try {
      seed = UrlNormalizer.normalize(request.startUrl());
    } catch (InvalidUrlException e) {
      publish(listener, new CrawlProgress(0, 0, request.startUrl(), CrawlProgress.Status.ERROR));
      throw new InvalidSeedException(request.startUrl(), e);
    }

    CrawlProperties.CrawlLimits limits = crawlProperties.limitsFor(request);
    log.info(
        "Starting crawl of {} (maxPages={}, maxDepth={}, concurrency={})",
        seed,
        limits.maxPages(),
        limits.maxDepth(),
        crawlProperties.concurrency());
    publish(listener, new CrawlProgress(0, limits.maxPages(), seed, CrawlProgress.Status.CRAWLING));

    try {
      SiteProbeResult probe = probeSite(seed);
      Run run = new Run(seed, limits, listener, token);
      run.execute();
      return run.toResult(probe);
    } catch (RuntimeException e) {
      log.error("Crawl of {} failed: {}", seed, e.getMessage());
      publish(listener, new CrawlProgress(0, limits.maxPages(), seed, CrawlProgress.Status.ERROR));
      throw e;
    }
  }

  private SiteProbeResult probeSite(String seed) {
    try {
      return siteProbe.probe(UrlNormalizer.normalizeToBase(seed));
    } catch (RuntimeException e) {
      log.warn("Site probe for {} failed: {}", seed, e.getMessage());
      return SiteProbeResult.nothingFound();
    }
  }

  /**
   * Fetch, parse and classify one frontier entry. Runs on a worker thread and never throws: every
   * failure becomes a failed {@link PageOutcome}.
   */
  private PageOutcome fetchPage(
      FrontierEntry entry, String siteHost, Predicate<String> alreadyCrawled) {
    String url = entry.url();
    FetchResult fetched;
    try {
      fetched = pageFetcher.fetch(url, fetchProperties.timeout());
    } catch (FetchException e) {
      return PageOutcome.failed(
          entry, "Failed to fetch " + url + ": " + e.getKind() + " (" + e.getMessage() + ")", true);
    } catch (RuntimeException e) {
      return PageOutcome.failed(entry, "Error crawling " + url + ": " + e.getMessage(), true);
    }

    try {
      String finalUrl = UrlNormalizer.tryNormalize(fetched.finalUrl(), url).orElse(url);
      PageFacts facts =
          isHtml(fetched) ? pageParser.parse(fetched.html(), finalUrl) : PageFacts.empty();

      List<PageLink> links = new ArrayList<>(facts.links().size());
      for (ExtractedLink link : facts.links()) {
        UrlNormalizer.tryNormalize(link.href(), finalUrl)
            .ifPresent(
                target ->
                    links.add(
                        new PageLink(
                            target,
                            link.anchorText(),
                            LinkClassifier.isInternal(target, siteHost),
                            link.nofollow())));
      }
      ClassifiedLinks classified =
          LinkClassifier.classify(links.stream().map(PageLink::url).toList(), siteHost);
      List<LinkCheck> linkChecks = checkLinks(finalUrl, classified.internal(), alreadyCrawled);

      CrawledPage page =
          new CrawledPage(
              finalUrl,
              url,
              facts.title(),
              fetched.status(),
              entry.depth(),
              entry.parentUrl(),
              links,
              classified.internal().size(),
              classified.external().size(),
              facts.imageCount(),
              facts.headingCounts(),
              facts.metaDescription(),
              facts.wordCount(),
              PageIssue.detect(facts, classified.internal().size()),
              fetched.loadTimeMs(),
              fetched.redirectChain(),
              linkChecks,
              Instant.now(clock));
      return new PageOutcome(entry, page, classified.internal(), null, false);
    } catch (RuntimeException e) {
      return PageOutcome.failed(entry, "Error crawling " + url + ": " + e.getMessage(), false);
    }
  }

  /**
   * Status-check the first {@code fanOutLimit} internal targets of a page that have not been
   * crawled yet.
   */
  private List<LinkCheck> checkLinks(
      String pageUrl, List<String> internalLinks, Predicate<String> alreadyCrawled) {
    int limit = Math.min(internalLinks.size(), crawlProperties.fanOutLimit());
    List<LinkCheck> checks = new ArrayList<>();
    for (String target : internalLinks.subList(0, limit)) {
      if (target.equals(pageUrl) || alreadyCrawled.test(target)) {
        continue;
      }
      LinkCheck check = checkLink(target);
      if (check.isBroken()) {
        log.info("Broken link on {}: {} ({})", pageUrl, target, describe(check));
      }
      checks.add(check);
    }
    return checks;
  }

  private LinkCheck checkLink(String url) {
    try {
      return new LinkCheck(
          url, pageFetcher.checkStatus(url, fetchProperties.linkCheckTimeout()), null);
    } catch (FetchException e) {
      return LinkCheck.unreachable(url, e.getKind() + " (" + e.getMessage() + ")");
    } catch (RuntimeException e) {
      return LinkCheck.unreachable(url, String.valueOf(e.getMessage()));
    }
  }

  private static String describe(LinkCheck check) {
    return check.error() != null ? check.error() : "status " + check.statusCode();
  }

  private static boolean isHtml(FetchResult fetched) {
    String contentType = fetched.contentType();
    if (contentType == null || contentType.isBlank()) {
      return true;
    }
    String type = contentType.toLowerCase(Locale.ROOT);
    return type.contains("html") || type.startsWith("text/");
  }

  private static void publish(CrawlProgressListener listener, CrawlProgress progress) {
    try {
      listener.onProgress(progress);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed on {}: {}", progress.status(), e.getMessage());
    }
  }

  /**
   * Result of one worker task.
   *
   * @param entry frontier entry that was fetched
   * @param page the crawled page, null on failure
   * @param internalLinks distinct internal links of the page in document order
   * @param error error line for the run, null on success
   * @param fetchError whether the failure happened before a response was received
   */
  private record PageOutcome(
      FrontierEntry entry,
      @Nullable CrawledPage page,
      List<String> internalLinks,
      @Nullable String error,
      boolean fetchError) {

    static PageOutcome failed(FrontierEntry entry, String error, boolean fetchError) {
      return new PageOutcome(entry, null, List.of(), error, fetchError);
    }
  }

  /** Mutable state of one crawl call, confined to the calling thread. */
  private final class Run {

    private final String seed;
    private final String siteHost;
    private final CrawlProperties.CrawlLimits limits;
    private final CrawlProgressListener listener;
    private final CancellationToken token;
    private final CrawlFrontier frontier;
    private final List<CrawledPage> pages = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int fetchErrors;
    private int attempts;
    private String lastUrl;
    private boolean cancelled;

    Run(
        String seed,
        CrawlProperties.CrawlLimits limits,
        CrawlProgressListener listener,
        CancellationToken token) {
      this.seed = seed;
      this.siteHost = UrlNormalizer.hostOf(seed);
      this.limits = limits;
      this.listener = listener;
      this.token = token;
      this.frontier = new CrawlFrontier(limits.maxPages(), limits.maxDepth());
      this.lastUrl = seed;
      frontier.seed(seed);
    }

    void execute() {
      int concurrency = crawlProperties.concurrency();
      ExecutorService pool =
          Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("crawl-fetch-"));
      CompletionService<PageOutcome> completion = new ExecutorCompletionService<>(pool);
      try {
        while (true) {
          dispatch(completion, concurrency);
          if (frontier.inFlight() == 0) {
            break;
          }
          record(awaitNext(completion));
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.info("Crawl of {} interrupted", seed);
        cancelled = true;
      } finally {
        pool.shutdownNow();
      }
    }

    private void dispatch(CompletionService<PageOutcome> completion, int concurrency) {
      while (!cancelled && frontier.inFlight() < concurrency) {
        if (token.isCancelled()) {
          log.info("Crawl of {} cancelled", seed);
          cancelled = true;
          return;
        }
        Optional<FrontierEntry> next = frontier.poll();
        if (next.isEmpty()) {
          return;
        }
        FrontierEntry entry = next.get();
        attempts++;
        lastUrl = entry.url();
        log.info("Crawling [{}/{}]: {}", attempts, limits.maxPages(), entry.url());
        publish(
            listener,
            new CrawlProgress(
                attempts, limits.maxPages(), entry.url(), CrawlProgress.Status.CRAWLING));
        completion.submit(() -> fetchPage(entry, siteHost, frontier::isVisited));
      }
    }

    private PageOutcome awaitNext(CompletionService<PageOutcome> completion)
        throws InterruptedException {
      try {
        return completion.take().get();
      } catch (ExecutionException e) {
        // fetchPage catches everything it can recover from
        throw new IllegalStateException("Crawl worker failed", e.getCause());
      }
    }

    private void record(PageOutcome outcome) {
      CrawledPage page = outcome.page();
      if (page == null) {
        log.warn("{}", outcome.error());
        errors.add(outcome.error());
        if (outcome.fetchError()) {
          fetchErrors++;
        }
        frontier.complete(false);
        return;
      }

      if (!page.url().equals(page.requestedUrl()) && !frontier.markVisited(page.url())) {
        log.debug("{} redirects to already visited {}, skipping", page.requestedUrl(), page.url());
        frontier.complete(false);
        return;
      }

      pages.add(page);
      frontier.complete(true);

      if (page.depth() < limits.maxDepth() && frontier.hasBudget()) {
        enqueueLinks(page, outcome.internalLinks());
      }
    }

    private void enqueueLinks(CrawledPage page, List<String> internalLinks) {
      int limit = Math.min(internalLinks.size(), crawlProperties.fanOutLimit());
      int queued = 0;
      for (String link : internalLinks.subList(0, limit)) {
        if (frontier.offer(link, page.depth() + 1, page.url())) {
          queued++;
        }
      }
      log.debug("Queued {} of {} internal links from {}", queued, internalLinks.size(), page.url());
    }

    CrawlResult toResult(SiteProbeResult probe) {
      int totalLinks = pages.stream().mapToInt(page -> page.links().size()).sum();
      CrawlStatistics statistics = CrawlStatisticsAggregator.aggregate(pages, fetchErrors);
      log.info(
          "Crawl complete: {} pages crawled from {} ({} errors{})",
          pages.size(),
          seed,
          errors.size(),
          cancelled ? ", cancelled" : "");
      publish(
          listener,
          new CrawlProgress(
              attempts, limits.maxPages(), lastUrl, CrawlProgress.Status.COMPLETED));
      return new CrawlResult(
          seed,
          pages,
          probe.robotsFound(),
          probe.robotsContent(),
          probe.sitemapFound(),
          probe.sitemapUrl(),
          probe.sitemapEntryCount(),
          pages.size(),
          totalLinks,
          statistics,
          errors,
          frontier.visitedCount(),
          cancelled);
    }
  }
}
