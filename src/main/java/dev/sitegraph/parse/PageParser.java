package dev.sitegraph.parse;

/**
 * HTML parsing capability injected into the crawler. Implementations are pure: the same input
 * always yields the same facts, and malformed markup degrades to empty defaults instead of failing.
 */
public interface PageParser {

  /**
   * Extract structural facts from a document.
   *
   * @param html raw document markup, possibly empty or malformed
   * @param pageUrl absolute URL the document was served from; relative links resolve against it
   * @return the extracted facts, never null
   */
  PageFacts parse(String html, String pageUrl);
}
