package dev.sitegraph.api;

import dev.sitegraph.crawl.CrawlRequest;
import dev.sitegraph.graph.LinkGraph;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON API over the crawler.
 *
 * <ul>
 *   <li>{@code POST /api/crawl} - crawl synchronously, return the full {@link CrawlReport}
 *   <li>{@code POST /api/link-map} - crawl synchronously, return the {@link LinkGraph}
 *   <li>{@code POST /api/crawls} - start a background crawl job
 *   <li>{@code GET /api/crawls/{id}} - job progress, and its report once complete
 *   <li>{@code DELETE /api/crawls/{id}} - cancel a running job, or discard a finished one
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class CrawlController {

  private final CrawlJobService crawlJobService;

  public CrawlController(CrawlJobService crawlJobService) {
    this.crawlJobService = crawlJobService;
  }

  @PostMapping("/crawl")
  public CrawlReport crawl(@Valid @RequestBody CrawlRequest request) {
    return crawlJobService.crawlAndReport(request);
  }

  @PostMapping("/link-map")
  public LinkGraph linkMap(@Valid @RequestBody CrawlRequest request) {
    return crawlJobService.linkMap(request);
  }

  @PostMapping("/crawls")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public CrawlJobAccepted submit(@Valid @RequestBody CrawlRequest request) {
    return new CrawlJobAccepted(crawlJobService.submit(request));
  }

  @GetMapping("/crawls/{crawlId}")
  public CrawlJobStatus status(@PathVariable UUID crawlId) {
    return crawlJobService.status(crawlId);
  }

  @DeleteMapping("/crawls/{crawlId}")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public void cancel(@PathVariable UUID crawlId) {
    crawlJobService.cancel(crawlId);
  }
}
