package dev.sitegraph.fetch;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a completed HTTP exchange, whatever its status code.
 *
 * @param html response body decoded as text (empty for bodiless responses)
 * @param finalUrl URL of the last hop, after following redirects
 * @param status HTTP status of the last hop
 * @param loadTimeMs wall time from the first request to the last body byte
 * @param redirectChain URLs that answered with a redirect, in order; empty if none
 * @param contentType the {@code Content-Type} header of the last hop, if any
 */
public record FetchResult(
    String html,
    String finalUrl,
    int status,
    long loadTimeMs,
    List<String> redirectChain,
    @Nullable String contentType) {

  public FetchResult {
    html = html == null ? "" : html;
    redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
  }

  /** Convenience for a single-hop response. */
  public static FetchResult of(String html, String url, int status, long loadTimeMs) {
    return new FetchResult(html, url, status, loadTimeMs, List.of(), "text/html");
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public boolean wasRedirected() {
    return !redirectChain.isEmpty();
  }
}
