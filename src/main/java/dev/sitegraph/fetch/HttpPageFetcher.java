package dev.sitegraph.fetch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link PageFetcher} backed by Spring's {@link RestClient}.
 *
 * <p>Automatic redirects are disabled on the underlying connection so that every hop is observed:
 * the fetcher follows {@code Location} headers itself, records the chain, and detects loops. HTTP
 * error statuses are returned as results; only transport failures raise {@link FetchException}.
 *
 * <p>The timeout is one deadline for the whole fetch. Each hop gets the time left as its connect
 * and read timeout, and the body is read in blocks with the deadline checked after each block, so
 * a server trickling its response cannot hold the fetch open. Bodies are cut at {@link
 * FetchProperties#maxBodySize()}.
 */
@Service
public class HttpPageFetcher implements PageFetcher {

  private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

  private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
  private static final Set<Integer> HEAD_REFUSED_STATUSES = Set.of(405, 501);
  private static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
  private static final int BUFFER_SIZE = 8192;
  private static final int CHARSET_SNIFF_BYTES = 4096;

  private final RestClient.Builder restClientBuilder;
  private final FetchProperties properties;

  public HttpPageFetcher(RestClient.Builder restClientBuilder, FetchProperties properties) {
    this.restClientBuilder = restClientBuilder;
    this.properties = properties;
  }

  @Override
  public FetchResult fetch(String url, Duration timeout) throws FetchException {
    return follow(url, HttpMethod.GET, timeout);
  }

  /** HEAD request; servers that refuse HEAD are asked again with GET. */
  @Override
  public int checkStatus(String url, Duration timeout) throws FetchException {
    int status = follow(url, HttpMethod.HEAD, timeout).status();
    if (HEAD_REFUSED_STATUSES.contains(status)) {
      log.debug("{} refused HEAD with {}, retrying with GET", url, status);
      return fetch(url, timeout).status();
    }
    return status;
  }

  private FetchResult follow(String url, HttpMethod method, Duration timeout)
      throws FetchException {
    long start = System.nanoTime();
    long deadline = start + timeout.toNanos();

    List<String> chain = new ArrayList<>();
    String current = url;
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new FetchException(
            url, FetchException.Kind.TIMEOUT, "Timed out after " + timeout.toMillis() + " ms");
      }
      Hop hop = exchange(url, current, method, new Deadline(deadline, remaining, timeout));
      if (!REDIRECT_STATUSES.contains(hop.status())) {
        long loadTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        log.debug(
            "{} {} -> {} ({} in {} ms)", method, url, current, hop.status(), loadTimeMs);
        return new FetchResult(
            hop.body(), current, hop.status(), loadTimeMs, chain, hop.contentType());
      }
      if (hop.location() == null || hop.location().isBlank()) {
        throw new FetchException(
            url,
            FetchException.Kind.MALFORMED_RESPONSE,
            "Redirect " + hop.status() + " from " + current + " has no Location header");
      }

      chain.add(current);
      String next = resolveLocation(url, current, hop.location());
      if (chain.contains(next)) {
        throw new FetchException(
            url, FetchException.Kind.TOO_MANY_REDIRECTS, "Redirect loop at " + next);
      }
      if (chain.size() > properties.maxRedirects()) {
        throw new FetchException(
            url,
            FetchException.Kind.TOO_MANY_REDIRECTS,
            "More than " + properties.maxRedirects() + " redirects");
      }
      current = next;
    }
  }

  private Hop exchange(String requestedUrl, String url, HttpMethod method, Deadline deadline)
      throws FetchException {
    try {
      return clientFor(deadline.remainingNanos())
          .method(method)
          .uri(URI.create(url))
          .header(HttpHeaders.USER_AGENT, properties.userAgent())
          .header(HttpHeaders.ACCEPT, ACCEPT)
          .exchange((request, response) -> readHop(response, method, deadline));
    } catch (ResourceAccessException e) {
      throw classify(requestedUrl, e);
    } catch (RestClientException | IllegalArgumentException e) {
      throw new FetchException(
          requestedUrl, FetchException.Kind.MALFORMED_RESPONSE, describe(e), e);
    }
  }

  private Hop readHop(ClientHttpResponse response, HttpMethod method, Deadline deadline)
      throws IOException {
    int status = response.getStatusCode().value();
    HttpHeaders headers = response.getHeaders();
    String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
    if (REDIRECT_STATUSES.contains(status)) {
      return new Hop(status, "", headers.getFirst(HttpHeaders.LOCATION), contentType);
    }
    if (method == HttpMethod.HEAD) {
      return new Hop(status, "", null, contentType);
    }
    byte[] body = readBody(response.getBody(), deadline);
    return new Hop(status, new String(body, charsetOf(contentType, body)), null, contentType);
  }

  /**
   * Read at most {@code maxBodySize} bytes before the deadline. The stream is closed here rather
   * than by the client, which would drain whatever the server still has to send.
   */
  private byte[] readBody(InputStream in, Deadline deadline) throws IOException {
    long limit = properties.maxBodySize().toBytes();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[BUFFER_SIZE];
    try (in) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        if (deadline.isPast()) {
          throw new SocketTimeoutException(
              "Body not received within " + deadline.timeout().toMillis() + " ms");
        }
        int kept = (int) Math.min(read, limit - out.size());
        out.write(buffer, 0, kept);
        if (out.size() >= limit) {
          log.debug("Response body cut at {} bytes", limit);
          break;
        }
      }
    }
    return out.toByteArray();
  }

  /**
   * Charset from the {@code Content-Type} header, else from a {@code <meta>} declaration near the
   * top of the document, else UTF-8.
   */
  static Charset charsetOf(@Nullable String contentType, byte[] body) {
    Charset declared = charsetParameter(contentType);
    if (declared != null) {
      return declared;
    }
    Charset sniffed = metaCharset(body);
    return sniffed != null ? sniffed : StandardCharsets.UTF_8;
  }

  private static @Nullable Charset metaCharset(byte[] body) {
    int length = Math.min(body.length, CHARSET_SNIFF_BYTES);
    String head = new String(body, 0, length, StandardCharsets.ISO_8859_1);
    for (Element meta : Jsoup.parse(head).select("meta[charset], meta[http-equiv=content-type]")) {
      Charset charset =
          meta.hasAttr("charset")
              ? charsetNamed(meta.attr("charset"))
              : charsetParameter(meta.attr("content"));
      if (charset != null) {
        return charset;
      }
    }
    return null;
  }

  private static @Nullable Charset charsetParameter(@Nullable String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return null;
    }
    try {
      return MediaType.parseMediaType(contentType).getCharset();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static @Nullable Charset charsetNamed(String name) {
    try {
      return Charset.isSupported(name.trim()) ? Charset.forName(name.trim()) : null;
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String resolveLocation(String requestedUrl, String current, String location)
      throws FetchException {
    try {
      return URI.create(current).resolve(location.trim()).toString();
    } catch (IllegalArgumentException e) {
      throw new FetchException(
          requestedUrl,
          FetchException.Kind.MALFORMED_RESPONSE,
          "Invalid redirect location '" + location + "'",
          e);
    }
  }

  private static FetchException classify(String url, ResourceAccessException e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
        return new FetchException(url, FetchException.Kind.TIMEOUT, describe(cause), e);
      }
      if (cause instanceof UnknownHostException
          || cause instanceof ConnectException
          || cause instanceof NoRouteToHostException
          || cause instanceof SocketException) {
        return new FetchException(url, FetchException.Kind.CONNECTION_FAILED, describe(cause), e);
      }
    }
    return new FetchException(url, FetchException.Kind.MALFORMED_RESPONSE, describe(e), e);
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null ? t.getClass().getSimpleName() : message;
  }

  /** Client whose connect and read timeouts are the time left; 0 would mean no timeout. */
  private RestClient clientFor(long remainingNanos) {
    Duration budget = Duration.ofMillis(Math.max(1, TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
    var requestFactory = new NoRedirectRequestFactory();
    requestFactory.setConnectTimeout(budget);
    requestFactory.setReadTimeout(budget);
    return restClientBuilder.clone().requestFactory(requestFactory).build();
  }

  /** {@link SimpleClientHttpRequestFactory} turns on redirect following for GET; undo that. */
  private static final class NoRedirectRequestFactory extends SimpleClientHttpRequestFactory {
    @Override
    protected void prepareConnection(HttpURLConnection connection, String httpMethod)
        throws IOException {
      super.prepareConnection(connection, httpMethod);
      connection.setInstanceFollowRedirects(false);
    }
  }

  private record Deadline(long atNanos, long remainingNanos, Duration timeout) {
    boolean isPast() {
      return System.nanoTime() - atNanos > 0;
    }
  }

  private record Hop(
      int status, String body, @Nullable String location, @Nullable String contentType) {}
}
