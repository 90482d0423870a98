package dev.sitegraph.parse;

/**
 * An anchor found in a document.
 *
 * @param href absolute URL, resolved against the page URL but not normalized
 * @param anchorText visible text of the anchor, whitespace-collapsed
 * @param nofollow whether the anchor carries {@code rel="nofollow"}
 */
public record ExtractedLink(String href, String anchorText, boolean nofollow) {

  public ExtractedLink {
    anchorText = anchorText == null ? "" : anchorText;
  }
}
