package dev.sitegraph.crawl;

import dev.sitegraph.parse.PageFacts;
import java.util.EnumSet;
import java.util.Set;

/** On-page findings recorded for every crawled page. */
public enum PageIssue {
  MISSING_TITLE("Missing title"),
  MISSING_META_DESCRIPTION("Missing meta description"),
  NO_H1("No H1 tag"),
  MULTIPLE_H1("Multiple H1 tags"),
  THIN_CONTENT("Thin content"),
  NO_INTERNAL_LINKS("No internal links");

  /** Pages with fewer words than this are thin. */
  public static final int THIN_CONTENT_WORDS = 300;

  private final String label;

  PageIssue(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Findings for a parsed page.
   *
   * @param facts parser output
   * @param internalLinkCount distinct internal links on the page
   */
  public static Set<PageIssue> detect(PageFacts facts, int internalLinkCount) {
    Set<PageIssue> issues = EnumSet.noneOf(PageIssue.class);
    if (facts.title().isBlank()) {
      issues.add(MISSING_TITLE);
    }
    if (facts.metaDescription().isBlank()) {
      issues.add(MISSING_META_DESCRIPTION);
    }
    if (facts.h1Count() == 0) {
      issues.add(NO_H1);
    } else if (facts.h1Count() > 1) {
      issues.add(MULTIPLE_H1);
    }
    if (facts.wordCount() < THIN_CONTENT_WORDS) {
      issues.add(THIN_CONTENT);
    }
    if (internalLinkCount == 0) {
      issues.add(NO_INTERNAL_LINKS);
    }
    return issues;
  }
}
