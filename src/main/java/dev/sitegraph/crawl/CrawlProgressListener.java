package dev.sitegraph.crawl;

/**
 * Side channel receiving {@link CrawlProgress} snapshots. Called from the thread running the
 * crawl; implementations must be quick and must not throw. A throwing listener is logged and
 * ignored.
 */
@FunctionalInterface
public interface CrawlProgressListener {

  CrawlProgressListener NOOP = progress -> {};

  void onProgress(CrawlProgress progress);
}
