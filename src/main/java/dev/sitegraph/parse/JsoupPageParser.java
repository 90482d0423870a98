package dev.sitegraph.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * {@link PageParser} built on jsoup's lenient HTML5 tree builder, which never rejects input.
 * Relative hrefs are resolved with {@code absUrl}, so a {@code <base href>} in the document is
 * honoured.
 */
@Component
public class JsoupPageParser implements PageParser {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public PageFacts parse(String html, String pageUrl) {
    Document doc = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl);

    Element titleElement = doc.selectFirst("title");
    String title = titleElement == null ? "" : titleElement.text().trim();

    Element description = doc.selectFirst("meta[name=description]");
    String metaDescription = description == null ? "" : description.attr("content").trim();

    Map<Integer, Integer> headingCounts = new LinkedHashMap<>();
    for (int level = 1; level <= 6; level++) {
      headingCounts.put(level, doc.select("h" + level).size());
    }

    return new PageFacts(
        title,
        metaDescription,
        headingCounts,
        doc.select("img").size(),
        countWords(doc),
        extractLinks(doc));
  }

  private static int countWords(Document doc) {
    Element body = doc.body().clone();
    body.select("script, style").remove();
    String text = body.text().trim();
    if (text.isEmpty()) {
      return 0;
    }
    return WHITESPACE.split(text).length;
  }

  private static List<ExtractedLink> extractLinks(Document doc) {
    List<ExtractedLink> links = new ArrayList<>();
    for (Element anchor : doc.select("a[href]")) {
      String href = anchor.absUrl("href");
      if (href.isEmpty()) {
        // unresolvable relative href
        continue;
      }
      links.add(new ExtractedLink(href, anchorText(anchor), isNofollow(anchor)));
    }
    return links;
  }

  private static String anchorText(Element anchor) {
    String text = anchor.text().trim();
    if (!text.isEmpty()) {
      return text;
    }
    Element image = anchor.selectFirst("img[alt]");
    return image == null ? "" : image.attr("alt").trim();
  }

  private static boolean isNofollow(Element anchor) {
    String rel = anchor.attr("rel").toLowerCase(Locale.ROOT);
    for (String token : WHITESPACE.split(rel)) {
      if (token.equals("nofollow")) {
        return true;
      }
    }
    return false;
  }
}
