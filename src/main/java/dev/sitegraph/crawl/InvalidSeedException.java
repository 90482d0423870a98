package dev.sitegraph.crawl;

/** The start URL of a crawl cannot be normalized; the run aborts before any fetch. */
public class InvalidSeedException extends IllegalArgumentException {

  public InvalidSeedException(String startUrl, Throwable cause) {
    super("Invalid start URL: " + startUrl, cause);
  }
}
