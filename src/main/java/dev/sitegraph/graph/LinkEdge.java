package dev.sitegraph.graph;

/**
 * A link from one crawled page to a target URL. At most one edge per source and target.
 *
 * @param source URL of the linking page
 * @param target normalized target URL; a redirected page is referenced by its final URL
 * @param anchorText text of the first anchor pointing at the target
 * @param type whether the target is on the site host
 */
public record LinkEdge(String source, String target, String anchorText, EdgeType type) {

  public enum EdgeType {
    INTERNAL,
    EXTERNAL
  }

  public boolean isInternal() {
    return type == EdgeType.INTERNAL;
  }

  public boolean isSelfLink() {
    return source.equals(target);
  }
}
