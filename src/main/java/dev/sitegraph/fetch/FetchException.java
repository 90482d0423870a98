package dev.sitegraph.fetch;

/**
 * Network-level failure while fetching a page. HTTP error statuses are not failures; they come back
 * as a regular {@link FetchResult}.
 */
public class FetchException extends Exception {

  /** Failure category. */
  public enum Kind {
    /** Connect or read timeout, or the overall deadline elapsed across redirect hops. */
    TIMEOUT,
    /** DNS failure, connection refused or reset. */
    CONNECTION_FAILED,
    /** The server answered with something that is not a usable HTTP response. */
    MALFORMED_RESPONSE,
    /** Redirect chain longer than the configured maximum, or a redirect loop. */
    TOO_MANY_REDIRECTS
  }

  private final String url;
  private final Kind kind;

  public FetchException(String url, Kind kind, String message) {
    super(message);
    this.url = url;
    this.kind = kind;
  }

  public FetchException(String url, Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.kind = kind;
  }

  public String getUrl() {
    return url;
  }

  public Kind getKind() {
    return kind;
  }
}
