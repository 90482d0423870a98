package dev.sitegraph.fetch;

import java.time.Duration;

/**
 * The only network capability the crawler depends on. Implementations follow redirects, report the
 * final URL, and return non-2xx responses as regular results.
 */
@FunctionalInterface
public interface PageFetcher {

  /**
   * GET a URL.
   *
   * @param url absolute URL to fetch
   * @param timeout upper bound for the whole exchange, redirects and body included
   * @return the response of the last hop
   * @throws FetchException on timeout, connection failure or an unusable response
   */
  FetchResult fetch(String url, Duration timeout) throws FetchException;

  /**
   * HTTP status of a URL after redirects, without keeping its body. Used to check links that are
   * not crawled. The default implementation performs a full {@link #fetch}.
   *
   * @param url absolute URL to check
   * @param timeout upper bound for the whole exchange
   * @return status of the last hop
   * @throws FetchException on timeout, connection failure or an unusable response
   */
  default int checkStatus(String url, Duration timeout) throws FetchException {
    return fetch(url, timeout).status();
  }
}
