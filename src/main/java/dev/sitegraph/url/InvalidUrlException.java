package dev.sitegraph.url;

/**
 * Thrown when a string cannot be turned into an absolute http(s) URL with a host.
 *
 * <p>Per-link occurrences are non-fatal: callers that process page links drop the link and move
 * on.
 */
public class InvalidUrlException extends IllegalArgumentException {

  private final String input;

  public InvalidUrlException(String input, String reason) {
    super("Invalid URL '" + input + "': " + reason);
    this.input = input;
  }

  public InvalidUrlException(String input, String reason, Throwable cause) {
    super("Invalid URL '" + input + "': " + reason, cause);
    this.input = input;
  }

  public String getInput() {
    return input;
  }
}
