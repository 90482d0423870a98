package dev.sitegraph.graph;

import org.jspecify.annotations.Nullable;

/**
 * Internal URL that crawled pages link to but that was never crawled, typically because a page,
 * depth or fan-out limit was reached first.
 *
 * @param url normalized target URL
 * @param incomingLinks internal edges pointing at it
 * @param statusCode status from a link check, 0 when it did not answer, null when never checked
 */
public record DanglingTarget(String url, int incomingLinks, @Nullable Integer statusCode) {

  /** Checked and answered with a status of 400 and above, or not at all. */
  public boolean isBroken() {
    return statusCode != null && (statusCode == 0 || statusCode >= 400);
  }
}
