package dev.sitegraph.link;

import java.util.List;

/**
 * Normalized, deduplicated links of a page split by host.
 *
 * @param internal links on the site host, first-occurrence order
 * @param external links on any other host, first-occurrence order
 */
public record ClassifiedLinks(List<String> internal, List<String> external) {

  public ClassifiedLinks {
    internal = internal == null ? List.of() : List.copyOf(internal);
    external = external == null ? List.of() : List.copyOf(external);
  }

  public static ClassifiedLinks empty() {
    return new ClassifiedLinks(List.of(), List.of());
  }
}
