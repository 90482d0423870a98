package dev.sitegraph.probe;

import org.jspecify.annotations.Nullable;

/**
 * What the site root exposes for crawlers.
 *
 * @param robotsFound whether {@code /robots.txt} answered 2xx
 * @param robotsContent body of robots.txt, empty when not found
 * @param sitemapFound whether {@code /sitemap.xml} or {@code /sitemap_index.xml} answered 2xx
 * @param sitemapUrl the sitemap location that answered, null when not found
 * @param sitemapEntryCount page URLs in a sitemap, or child sitemaps in an index; 0 if unparseable
 */
public record SiteProbeResult(
    boolean robotsFound,
    String robotsContent,
    boolean sitemapFound,
    @Nullable String sitemapUrl,
    int sitemapEntryCount) {

  public SiteProbeResult {
    robotsContent = robotsContent == null ? "" : robotsContent;
  }

  public static SiteProbeResult nothingFound() {
    return new SiteProbeResult(false, "", false, null, 0);
  }
}
