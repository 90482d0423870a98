package dev.sitegraph.url;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link UrlNormalizer}: normalizing twice gives the same result as
 * normalizing once, and the output is always a canonical http(s) URL.
 */
class UrlNormalizerPropertyTest {

  @Provide
  Arbitrary<String> urls() {
    Arbitrary<String> scheme = Arbitraries.of("http", "https", "HTTP", "Https");
    Arbitrary<String> host =
        Arbitraries.of("example.com", "Example.COM", "docs.example.org", "localhost");
    Arbitrary<String> port = Arbitraries.of("", ":80", ":443", ":8080");
    Arbitrary<String> path =
        Arbitraries.strings()
            .withChars("abc/.-_~")
            .ofMaxLength(20)
            .map(p -> p.isEmpty() ? "" : "/" + p);
    Arbitrary<String> query =
        Arbitraries.of("", "?a=1", "?b=2&a=1", "?q=hello%20world", "?");
    Arbitrary<String> fragment = Arbitraries.of("", "#top", "#");
    return Combinators.combine(scheme, host, port, path, query, fragment)
        .as((s, h, p, pa, q, f) -> s + "://" + h + p + pa + q + f);
  }

  @Provide
  Arbitrary<String> references() {
    return Arbitraries.of(
        "", "#x", "?p=1", "a", "a/", "./a", "../a", "/", "/x/y/", "//cdn.example.org/z", "b?c=d");
  }

  @Property
  void normalizeIsIdempotent(@ForAll("urls") String url) {
    Optional<String> once = UrlNormalizer.tryNormalize(url, null);
    once.ifPresent(
        normalized -> assertThat(UrlNormalizer.normalize(normalized)).isEqualTo(normalized));
  }

  @Property
  void resolvedReferencesAreIdempotent(
      @ForAll("references") String reference, @ForAll("urls") String base) {
    Optional<String> once = UrlNormalizer.tryNormalize(reference, base);
    once.ifPresent(
        normalized -> assertThat(UrlNormalizer.normalize(normalized)).isEqualTo(normalized));
  }

  @Property
  void outputIsCanonical(@ForAll("urls") String url) {
    UrlNormalizer.tryNormalize(url, null)
        .ifPresent(
            normalized -> {
              assertThat(normalized).startsWith("http");
              assertThat(normalized).doesNotContain("#");
              if (normalized.startsWith("http://")) {
                assertThat(normalized).doesNotContain(":80/");
              } else {
                assertThat(normalized).doesNotContain(":443/");
              }
              String path =
                  normalized.replaceFirst("^https?://[^/]+", "").replaceFirst("\\?.*$", "");
              assertThat(path).startsWith("/");
              if (path.length() > 1) {
                assertThat(path).doesNotEndWith("/");
              }
            });
  }
}
