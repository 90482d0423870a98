package dev.sitegraph.crawl;

import org.jspecify.annotations.Nullable;

/**
 * Status check of an internal link target that had not been crawled when its page was.
 *
 * @param url normalized target
 * @param statusCode HTTP status after redirects, 0 when no response was received
 * @param error why no response was received, null otherwise
 */
public record LinkCheck(String url, int statusCode, @Nullable String error) {

  public static LinkCheck unreachable(String url, String error) {
    return new LinkCheck(url, 0, error);
  }

  /** No response, or a status of 400 and above. */
  public boolean isBroken() {
    return statusCode == 0 || statusCode >= 400;
  }
}
