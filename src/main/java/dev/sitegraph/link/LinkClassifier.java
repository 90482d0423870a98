package dev.sitegraph.link;

import dev.sitegraph.url.InvalidUrlException;
import dev.sitegraph.url.UrlNormalizer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static utility that partitions page links into internal and external sets relative to the site
 * host. Hosts must match exactly: {@code blog.example.com} is external to {@code example.com}.
 * Links that cannot be normalized (mailto:, javascript:, garbage) are dropped.
 */
public final class LinkClassifier {

  private LinkClassifier() {
    // utility class
  }

  /**
   * Classify and deduplicate links.
   *
   * @param links absolute link URLs in document order
   * @param siteHost host of the crawl seed
   * @return normalized links split by host, each list in first-occurrence order
   */
  public static ClassifiedLinks classify(List<String> links, String siteHost) {
    String host = siteHost.toLowerCase(Locale.ROOT);
    Set<String> internal = new LinkedHashSet<>();
    Set<String> external = new LinkedHashSet<>();
    for (String link : links) {
      Optional<String> normalized = UrlNormalizer.tryNormalize(link, null);
      if (normalized.isEmpty()) {
        continue;
      }
      String url = normalized.get();
      if (host.equals(UrlNormalizer.hostOf(url))) {
        internal.add(url);
      } else {
        external.add(url);
      }
    }
    return new ClassifiedLinks(List.copyOf(internal), List.copyOf(external));
  }

  /**
   * Check whether a single URL is on the site host.
   *
   * @return false for URLs that cannot be normalized
   */
  public static boolean isInternal(String url, String siteHost) {
    try {
      return siteHost.toLowerCase(Locale.ROOT).equals(UrlNormalizer.hostOf(url));
    } catch (InvalidUrlException e) {
      return false;
    }
  }
}
