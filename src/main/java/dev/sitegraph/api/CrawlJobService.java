package dev.sitegraph.api;

import dev.sitegraph.crawl.CancellationToken;
import dev.sitegraph.crawl.CrawlProgress;
import dev.sitegraph.crawl.CrawlProgressListener;
import dev.sitegraph.crawl.CrawlProgressTracker;
import dev.sitegraph.crawl.CrawlRequest;
import dev.sitegraph.crawl.CrawlResult;
import dev.sitegraph.crawl.CrawlService;
import dev.sitegraph.crawl.InvalidSeedException;
import dev.sitegraph.crawl.UnknownCrawlJobException;
import dev.sitegraph.graph.LinkGraph;
import dev.sitegraph.graph.LinkGraphAnalyzer;
import dev.sitegraph.graph.LinkGraphBuilder;
import dev.sitegraph.url.InvalidUrlException;
import dev.sitegraph.url.UrlNormalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs crawls for the HTTP API, either inline or as background jobs tracked by {@link
 * CrawlProgressTracker}. Finished jobs stay in memory until they are discarded or until more than
 * {@code sitegraph.jobs.max-retained} newer jobs have finished.
 */
@Service
public class CrawlJobService {

  private static final Logger log = LoggerFactory.getLogger(CrawlJobService.class);

  private final CrawlService crawlService;
  private final LinkGraphBuilder graphBuilder;
  private final LinkGraphAnalyzer graphAnalyzer;
  private final CrawlProgressTracker progressTracker;
  private final TaskExecutor taskExecutor;
  private final ConcurrentHashMap<UUID, CrawlReport> reports = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, String> failures = new ConcurrentHashMap<>();
  private final Deque<UUID> finished = new ArrayDeque<>();
  private final int maxRetained;

  public CrawlJobService(
      CrawlService crawlService,
      LinkGraphBuilder graphBuilder,
      LinkGraphAnalyzer graphAnalyzer,
      CrawlProgressTracker progressTracker,
      TaskExecutor applicationTaskExecutor,
      CrawlJobProperties jobProperties) {
    this.crawlService = crawlService;
    this.graphBuilder = graphBuilder;
    this.graphAnalyzer = graphAnalyzer;
    this.progressTracker = progressTracker;
    this.taskExecutor = applicationTaskExecutor;
    this.maxRetained = jobProperties.maxRetained();
  }

  /** Crawl on the calling thread and build the full report. */
  public CrawlReport crawlAndReport(CrawlRequest request) {
    return report(crawlService.crawl(request));
  }

  /** Crawl on the calling thread and build the link graph only. */
  public LinkGraph linkMap(CrawlRequest request) {
    CrawlResult result = crawlService.crawl(request);
    return graphBuilder.buildGraph(result.pages(), result.startUrl());
  }

  /**
   * Start a background crawl. The start URL is checked before the job is created.
   *
   * @param request seed URL and optional limits
   * @return the ID to poll with {@link #status(UUID)}
   * @throws InvalidSeedException if the start URL cannot be normalized
   */
  public UUID submit(CrawlRequest request) {
    try {
      UrlNormalizer.normalize(request.startUrl());
    } catch (InvalidUrlException e) {
      throw new InvalidSeedException(request.startUrl(), e);
    }

    UUID crawlId = UUID.randomUUID();
    CancellationToken token = progressTracker.startCrawl(crawlId);
    try {
      taskExecutor.execute(() -> runJob(crawlId, request, token));
    } catch (TaskRejectedException e) {
      progressTracker.removeCrawl(crawlId);
      throw e;
    }
    log.info("Submitted crawl job {} for {}", crawlId, request.startUrl());
    return crawlId;
  }

  /**
   * Current state of a job.
   *
   * @throws UnknownCrawlJobException if no job has this ID
   */
  public CrawlJobStatus status(UUID crawlId) {
    CrawlProgress progress =
        progressTracker
            .getProgress(crawlId)
            .orElseThrow(() -> new UnknownCrawlJobException(crawlId));
    return new CrawlJobStatus(crawlId, progress, reports.get(crawlId), failures.get(crawlId));
  }

  /**
   * Request cooperative cancellation of a running job. Pages already fetched are kept in its
   * report. A job that has already finished is discarded instead.
   *
   * @throws UnknownCrawlJobException if no job has this ID
   */
  public void cancel(UUID crawlId) {
    CrawlProgress progress =
        progressTracker
            .getProgress(crawlId)
            .orElseThrow(() -> new UnknownCrawlJobException(crawlId));
    if (progress.isFinished()) {
      remove(crawlId);
      log.info("Discarded finished crawl job {}", crawlId);
      return;
    }
    if (!progressTracker.cancel(crawlId)) {
      throw new UnknownCrawlJobException(crawlId);
    }
    log.info("Cancellation requested for crawl job {}", crawlId);
  }

  /** Forget a job and its report. */
  public void remove(UUID crawlId) {
    synchronized (finished) {
      finished.remove(crawlId);
    }
    progressTracker.removeCrawl(crawlId);
    reports.remove(crawlId);
    failures.remove(crawlId);
  }

  CrawlReport report(CrawlResult result) {
    LinkGraph graph = graphBuilder.buildGraph(result.pages(), result.startUrl());
    return new CrawlReport(
        result,
        graph,
        graphAnalyzer.distribution(graph.nodes()),
        graphAnalyzer.suggest(graph.nodes()));
  }

  private void runJob(UUID crawlId, CrawlRequest request, CancellationToken token) {
    CrawlProgressListener tracked = progressTracker.listenerFor(crawlId);
    AtomicReference<CrawlProgress> completed = new AtomicReference<>();
    // COMPLETED is published only once the report is stored
    CrawlProgressListener listener =
        progress -> {
          if (progress.status() == CrawlProgress.Status.COMPLETED) {
            completed.set(progress);
          } else {
            tracked.onProgress(progress);
          }
        };
    try {
      CrawlResult result = crawlService.crawl(request, listener, token);
      reports.put(crawlId, report(result));
      CrawlProgress last = completed.get();
      tracked.onProgress(
          last != null
              ? last
              : new CrawlProgress(
                  result.visitedCount(), 0, result.startUrl(), CrawlProgress.Status.COMPLETED));
    } catch (RuntimeException e) {
      log.error("Crawl job {} failed: {}", crawlId, e.getMessage(), e);
      failures.put(crawlId, Objects.requireNonNullElse(e.getMessage(), e.getClass().getName()));
      progressTracker.failCrawl(crawlId);
    } finally {
      retain(crawlId);
    }
  }

  private void retain(UUID crawlId) {
    List<UUID> evicted = new ArrayList<>();
    synchronized (finished) {
      finished.addLast(crawlId);
      while (finished.size() > maxRetained) {
        evicted.add(finished.removeFirst());
      }
    }
    for (UUID oldest : evicted) {
      progressTracker.removeCrawl(oldest);
      reports.remove(oldest);
      failures.remove(oldest);
      log.debug("Evicted finished crawl job {}", oldest);
    }
  }
}
