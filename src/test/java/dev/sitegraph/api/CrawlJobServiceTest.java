package dev.sitegraph.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.sitegraph.crawl.CancellationToken;
import dev.sitegraph.crawl.CrawlProgress;
import dev.sitegraph.crawl.CrawlProgressListener;
import dev.sitegraph.crawl.CrawlProgressTracker;
import dev.sitegraph.crawl.CrawlRequest;
import dev.sitegraph.crawl.CrawlResult;
import dev.sitegraph.crawl.CrawlService;
import dev.sitegraph.crawl.CrawlStatisticsAggregator;
import dev.sitegraph.crawl.CrawledPage;
import dev.sitegraph.crawl.InvalidSeedException;
import dev.sitegraph.crawl.UnknownCrawlJobException;
import dev.sitegraph.fixture.CrawledPageBuilder;
import dev.sitegraph.graph.LinkGraph;
import dev.sitegraph.graph.LinkGraphAnalyzer;
import dev.sitegraph.graph.LinkGraphBuilder;
import dev.sitegraph.graph.LinkNode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class CrawlJobServiceTest {

  private static final String SEED = "https://example.com/";

  @Mock private CrawlService crawlService;

  private final CrawlProgressTracker tracker = new CrawlProgressTracker();
  private CrawlJobService service;

  @BeforeEach
  void setUp() {
    service = jobService(Runnable::run);
  }

  private CrawlJobService jobService(TaskExecutor executor) {
    return jobService(executor, CrawlJobProperties.defaults());
  }

  private CrawlJobService jobService(TaskExecutor executor, CrawlJobProperties properties) {
    return new CrawlJobService(
        crawlService,
        new LinkGraphBuilder(),
        new LinkGraphAnalyzer(),
        tracker,
        executor,
        properties);
  }

  private static CrawlResult result(boolean cancelled) {
    List<CrawledPage> pages =
        List.of(
            new CrawledPageBuilder().url("/").internalLink("/a").build(),
            new CrawledPageBuilder().url("/a").depth(1).parentUrl("/").build());
    return new CrawlResult(
        SEED,
        pages,
        false,
        "",
        false,
        null,
        0,
        pages.size(),
        1,
        CrawlStatisticsAggregator.aggregate(pages, 0),
        List.of(),
        pages.size(),
        cancelled);
  }

  @Test
  void crawlAndReportBuildsGraphAndAnalysis() {
    CrawlRequest request = CrawlRequest.of(SEED);
    when(crawlService.crawl(request)).thenReturn(result(false));

    CrawlReport report = service.crawlAndReport(request);

    assertThat(report.result().totalPages()).isEqualTo(2);
    assertThat(report.graph().nodes()).hasSize(2);
    assertThat(report.graph().orphanPages()).isEmpty();
    assertThat(report.distribution().underLinked()).extracting(LinkNode::url).containsExactly(SEED);
    assertThat(report.suggestions()).isEmpty();
  }

  @Test
  void linkMapReturnsGraphOnly() {
    CrawlRequest request = CrawlRequest.of(SEED);
    when(crawlService.crawl(request)).thenReturn(result(false));

    LinkGraph graph = service.linkMap(request);

    assertThat(graph.edges()).hasSize(1);
    assertThat(graph.stats().totalPages()).isEqualTo(2);
  }

  @Test
  void submitRunsJobAndStoresReport() {
    CrawlRequest request = CrawlRequest.of(SEED);
    when(crawlService.crawl(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              CrawlProgressListener listener = invocation.getArgument(1);
              listener.onProgress(new CrawlProgress(1, 20, SEED, CrawlProgress.Status.CRAWLING));
              listener.onProgress(new CrawlProgress(2, 20, SEED, CrawlProgress.Status.COMPLETED));
              return result(false);
            });

    UUID crawlId = service.submit(request);
    CrawlJobStatus status = service.status(crawlId);

    assertThat(status.progress().status()).isEqualTo(CrawlProgress.Status.COMPLETED);
    assertThat(status.progress().current()).isEqualTo(2);
    assertThat(status.report()).isNotNull();
    assertThat(status.report().graph().nodes()).hasSize(2);
    assertThat(status.error()).isNull();
  }

  @Test
  void failedJobRecordsErrorStatus() {
    when(crawlService.crawl(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

    UUID crawlId = service.submit(CrawlRequest.of(SEED));
    CrawlJobStatus status = service.status(crawlId);

    assertThat(status.progress().status()).isEqualTo(CrawlProgress.Status.ERROR);
    assertThat(status.report()).isNull();
    assertThat(status.error()).isEqualTo("boom");
  }

  @Test
  void submitRejectsInvalidSeedWithoutCreatingJob() {
    assertThatThrownBy(() -> service.submit(CrawlRequest.of("not a url")))
        .isInstanceOf(InvalidSeedException.class);

    verifyNoInteractions(crawlService);
  }

  @Test
  void rejectedTaskIsNotTracked() {
    CrawlJobService rejecting =
        jobService(
            task -> {
              throw new TaskRejectedException("queue full");
            });

    assertThatThrownBy(() -> rejecting.submit(CrawlRequest.of(SEED)))
        .isInstanceOf(TaskRejectedException.class);
  }

  @Test
  void cancelFlipsTokenOfRunningJob() {
    List<Runnable> queued = new ArrayList<>();
    CrawlJobService deferred = jobService(queued::add);
    UUID crawlId = deferred.submit(CrawlRequest.of(SEED));
    when(crawlService.crawl(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              CancellationToken token = invocation.getArgument(2);
              assertThat(token.isCancelled()).isTrue();
              return result(true);
            });

    deferred.cancel(crawlId);
    queued.get(0).run();

    CrawlJobStatus status = deferred.status(crawlId);
    assertThat(status.report()).isNotNull();
    assertThat(status.report().result().cancelled()).isTrue();
    verify(crawlService).crawl(any(), any(), any());
  }

  @Test
  void unknownJobsAreReported() {
    UUID unknown = UUID.randomUUID();

    assertThatThrownBy(() -> service.status(unknown))
        .isInstanceOf(UnknownCrawlJobException.class)
        .hasMessageContaining(unknown.toString());
    assertThatThrownBy(() -> service.cancel(unknown))
        .isInstanceOf(UnknownCrawlJobException.class);
  }

  @Test
  void removeForgetsJob() {
    when(crawlService.crawl(any(), any(), any())).thenReturn(result(false));
    UUID crawlId = service.submit(CrawlRequest.of(SEED));

    service.remove(crawlId);

    assertThatThrownBy(() -> service.status(crawlId))
        .isInstanceOf(UnknownCrawlJobException.class);
  }

  @Test
  void cancellingFinishedJobDiscardsIt() {
    when(crawlService.crawl(any(), any(), any())).thenReturn(result(false));
    UUID crawlId = service.submit(CrawlRequest.of(SEED));

    service.cancel(crawlId);

    assertThat(tracker.getProgress(crawlId)).isEmpty();
    assertThatThrownBy(() -> service.status(crawlId))
        .isInstanceOf(UnknownCrawlJobException.class);
  }

  @Test
  void oldestFinishedJobsAreEvictedBeyondRetentionLimit() {
    CrawlJobService retainingTwo = jobService(Runnable::run, new CrawlJobProperties(2));
    when(crawlService.crawl(any(), any(), any()))
        .thenReturn(result(false))
        .thenThrow(new IllegalStateException("boom"))
        .thenReturn(result(false));

    UUID first = retainingTwo.submit(CrawlRequest.of(SEED));
    UUID second = retainingTwo.submit(CrawlRequest.of(SEED));
    UUID third = retainingTwo.submit(CrawlRequest.of(SEED));

    assertThatThrownBy(() -> retainingTwo.status(first))
        .isInstanceOf(UnknownCrawlJobException.class);
    assertThat(tracker.getProgress(first)).isEmpty();
    assertThat(retainingTwo.status(second).error()).isEqualTo("boom");
    assertThat(retainingTwo.status(third).report()).isNotNull();
  }

  @Test
  void runningJobsAreNeverEvicted() {
    List<Runnable> queued = new ArrayList<>();
    CrawlJobService deferred = jobService(queued::add, new CrawlJobProperties(1));
    when(crawlService.crawl(any(), any(), any())).thenReturn(result(false));

    UUID running = deferred.submit(CrawlRequest.of(SEED));
    UUID done = deferred.submit(CrawlRequest.of(SEED));
    queued.get(1).run();

    assertThat(deferred.status(running).progress().status())
        .isEqualTo(CrawlProgress.Status.IDLE);
    assertThat(deferred.status(done).report()).isNotNull();
  }

  @Test
  void retentionLimitMustBePositive() {
    assertThatThrownBy(() -> new CrawlJobProperties(0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("max-retained");
  }
}
