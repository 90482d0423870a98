package dev.sitegraph.probe;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import dev.sitegraph.fetch.FetchException;
import dev.sitegraph.fetch.FetchProperties;
import dev.sitegraph.fetch.FetchResult;
import dev.sitegraph.fetch.PageFetcher;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks a site root for {@code robots.txt} and a sitemap at the well-known locations. Robots
 * directives are only reported, never enforced. Every failure maps to "not found".
 */
@Component
public class SiteProbe {

  private static final Logger log = LoggerFactory.getLogger(SiteProbe.class);

  private final PageFetcher pageFetcher;
  private final FetchProperties fetchProperties;

  public SiteProbe(PageFetcher pageFetcher, FetchProperties fetchProperties) {
    this.pageFetcher = pageFetcher;
    this.fetchProperties = fetchProperties;
  }

  /**
   * Probe a site origin.
   *
   * @param siteOrigin scheme://host[:port], with or without a trailing slash
   * @return presence flags, robots.txt content and sitemap details
   */
  public SiteProbeResult probe(String siteOrigin) {
    String origin = siteOrigin.endsWith("/")
        ? siteOrigin.substring(0, siteOrigin.length() - 1)
        : siteOrigin;

    Optional<FetchResult> robots = fetchIfFound(origin + "/robots.txt");
    String robotsContent = robots.map(FetchResult::html).orElse("");

    for (String sitemapUrl : List.of(origin + "/sitemap.xml", origin + "/sitemap_index.xml")) {
      Optional<FetchResult> sitemap = fetchIfFound(sitemapUrl);
      if (sitemap.isPresent()) {
        int entries = countEntries(sitemapUrl, sitemap.get().html());
        log.info("Found sitemap at {} ({} entries)", sitemapUrl, entries);
        return new SiteProbeResult(robots.isPresent(), robotsContent, true, sitemapUrl, entries);
      }
    }
    return new SiteProbeResult(robots.isPresent(), robotsContent, false, null, 0);
  }

  private Optional<FetchResult> fetchIfFound(String url) {
    try {
      FetchResult result = pageFetcher.fetch(url, fetchProperties.timeout());
      if (result.isSuccess()) {
        return Optional.of(result);
      }
      log.debug("{} answered {}", url, result.status());
    } catch (FetchException e) {
      log.debug("Could not fetch {}: {}", url, e.getMessage());
    }
    return Optional.empty();
  }

  private static int countEntries(String sitemapUrl, String content) {
    if (content.isBlank()) {
      return 0;
    }
    try {
      SiteMapParser parser = new SiteMapParser(false);
      AbstractSiteMap parsed =
          parser.parseSiteMap(
              content.getBytes(StandardCharsets.UTF_8), URI.create(sitemapUrl).toURL());
      if (parsed instanceof SiteMapIndex index) {
        return index.getSitemaps().size();
      } else if (parsed instanceof SiteMap siteMap) {
        return siteMap.getSiteMapUrls().size();
      }
    } catch (Exception e) {
      log.debug("Sitemap at {} is not parseable: {}", sitemapUrl, e.getMessage());
    }
    return 0;
  }
}
