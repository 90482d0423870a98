package dev.sitegraph.link;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class LinkClassifierTest {

  @Test
  void splitsByExactHost() {
    ClassifiedLinks links =
        LinkClassifier.classify(
            List.of(
                "https://example.com/a",
                "https://blog.example.com/post",
                "https://other.org/",
                "https://EXAMPLE.com/b/"),
            "example.com");

    assertThat(links.internal()).containsExactly("https://example.com/a", "https://example.com/b");
    assertThat(links.external())
        .containsExactly("https://blog.example.com/post", "https://other.org/");
  }

  @Test
  void deduplicatesAfterNormalizationKeepingFirstOccurrence() {
    ClassifiedLinks links =
        LinkClassifier.classify(
            List.of(
                "https://example.com/b",
                "https://example.com/a#top",
                "https://example.com/b/",
                "https://example.com/a"),
            "example.com");

    assertThat(links.internal()).containsExactly("https://example.com/b", "https://example.com/a");
  }

  @Test
  void dropsLinksThatCannotBeNormalized() {
    ClassifiedLinks links =
        LinkClassifier.classify(
            List.of(
                "mailto:hi@example.com", "javascript:void(0)", "tel:123", "https://example.com/"),
            "example.com");

    assertThat(links.internal()).containsExactly("https://example.com/");
    assertThat(links.external()).isEmpty();
  }

  @Test
  void emptyInputGivesEmptyLists() {
    assertThat(LinkClassifier.classify(List.of(), "example.com"))
        .isEqualTo(ClassifiedLinks.empty());
  }

  @Test
  void isInternalComparesHostsCaseInsensitively() {
    assertThat(LinkClassifier.isInternal("https://example.com/x", "Example.com")).isTrue();
    assertThat(LinkClassifier.isInternal("https://www.example.com/x", "example.com")).isFalse();
    assertThat(LinkClassifier.isInternal("mailto:x@example.com", "example.com")).isFalse();
  }
}
