package dev.sitegraph.graph;

import dev.sitegraph.url.UrlNormalizer;
import java.util.Locale;

/** Coarse page category guessed from URL path segments. */
public enum PageType {
  HOMEPAGE("homepage"),
  BLOG("blog"),
  PRODUCT("product"),
  CATEGORY("category"),
  INFORMATION("information"),
  PAGE("page");

  private final String label;

  PageType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Classify a normalized URL. Path markers win over the homepage check, so {@code /blog/} style
   * URLs are never homepages.
   *
   * @param url normalized absolute URL
   * @return the page type, {@link #PAGE} when nothing matches
   */
  public static PageType classify(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    if (lower.contains("/blog/") || lower.contains("/article/")) {
      return BLOG;
    }
    if (lower.contains("/product/") || lower.contains("/shop/")) {
      return PRODUCT;
    }
    if (lower.contains("/category/")) {
      return CATEGORY;
    }
    if (lower.contains("/about") || lower.contains("/contact")) {
      return INFORMATION;
    }
    if (lower.endsWith("/") || lower.equals(originOf(lower))) {
      return HOMEPAGE;
    }
    return PAGE;
  }

  private static String originOf(String url) {
    return UrlNormalizer.tryNormalize(url, null).map(UrlNormalizer::normalizeToBase).orElse("");
  }
}
