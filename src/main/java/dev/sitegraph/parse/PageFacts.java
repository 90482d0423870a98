package dev.sitegraph.parse;

import java.util.List;
import java.util.Map;

/**
 * Structural facts extracted from one HTML document. Missing elements are represented by empty
 * strings and zero counts.
 *
 * @param title text of the first {@code <title>}, trimmed
 * @param metaDescription content of {@code <meta name="description">}
 * @param headingCounts number of {@code h1}..{@code h6} elements keyed by level (1-6, always all
 *     six keys)
 * @param imageCount number of {@code <img>} elements
 * @param wordCount whitespace-separated words of the visible body text
 * @param links every {@code a[href]} in document order, duplicates included
 */
public record PageFacts(
    String title,
    String metaDescription,
    Map<Integer, Integer> headingCounts,
    int imageCount,
    int wordCount,
    List<ExtractedLink> links) {

  public PageFacts {
    title = title == null ? "" : title;
    metaDescription = metaDescription == null ? "" : metaDescription;
    headingCounts = headingCounts == null ? Map.of() : Map.copyOf(headingCounts);
    links = links == null ? List.of() : List.copyOf(links);
  }

  public static PageFacts empty() {
    return new PageFacts("", "", Map.of(), 0, 0, List.of());
  }

  public int h1Count() {
    return headingCounts.getOrDefault(1, 0);
  }

  /** Link targets in document order. */
  public List<String> hrefs() {
    return links.stream().map(ExtractedLink::href).toList();
  }
}
