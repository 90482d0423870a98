package dev.sitegraph.graph;

/**
 * A proposed internal link.
 *
 * @param fromPage page that should carry the link
 * @param toPage page that should receive it
 * @param reason human-readable explanation
 * @param priority how urgent the link is
 */
public record LinkSuggestion(String fromPage, String toPage, String reason, Priority priority) {

  public enum Priority {
    HIGH,
    MEDIUM,
    LOW
  }
}
