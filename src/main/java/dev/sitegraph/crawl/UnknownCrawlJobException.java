package dev.sitegraph.crawl;

import java.util.UUID;

/** No crawl job is tracked under the given ID. */
public class UnknownCrawlJobException extends RuntimeException {

  private final UUID crawlId;

  public UnknownCrawlJobException(UUID crawlId) {
    super("Unknown crawl job: " + crawlId);
    this.crawlId = crawlId;
  }

  public UUID getCrawlId() {
    return crawlId;
  }
}
