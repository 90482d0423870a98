package dev.sitegraph.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Utility class that canonicalizes URLs so that equivalent URLs deduplicate during crawling.
 * Resolves relative references, removes fragments, normalizes trailing slashes, host casing and
 * default ports. The query string is kept exactly as written.
 */
public final class UrlNormalizer {

    // letters, digits, hyphens and underscores in dot-separated labels
    private static final Pattern REGISTERED_NAME =
            Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*\\.?");

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize an absolute URL.
     *
     * @param url the URL to normalize
     * @return the canonical form
     * @throws InvalidUrlException if the input is not an absolute http(s) URL with a host
     */
    public static String normalize(String url) {
        return normalize(url, null);
    }

    /**
     * Resolve {@code raw} against {@code base} (when relative) and normalize the result:
     * <ul>
     *   <li>Remove the fragment (#section)</li>
     *   <li>Remove trailing slashes unless the path is the root {@code /}; an empty path becomes
     *       {@code /}</li>
     *   <li>Lowercase scheme and host (path and query are case-sensitive)</li>
     *   <li>Omit default ports (80 for http, 443 for https)</li>
     *   <li>Keep the query string as-is (no reordering, no parameter removal)</li>
     * </ul>
     *
     * @param raw the URL or reference to normalize
     * @param base the URL of the document the reference appeared in, or null for absolute input
     * @return the canonical form
     * @throws InvalidUrlException if the result is not an absolute http(s) URL with a host
     */
    public static String normalize(@Nullable String raw, @Nullable String base) {
        if (raw == null) {
            throw new InvalidUrlException("null", "URL is null");
        }
        String candidate = raw.trim().replace(" ", "%20");
        if (candidate.isEmpty() || candidate.startsWith("#")) {
            // same-document reference
            if (base == null) {
                throw new InvalidUrlException(raw, "empty reference without a base URL");
            }
            return normalize(base, null);
        }

        URI uri;
        try {
            uri = new URI(candidate);
            if (!uri.isAbsolute()) {
                if (base == null) {
                    throw new InvalidUrlException(raw, "relative URL without a base URL");
                }
                uri = resolve(baseUri(base), candidate);
            }
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(raw, e.getReason(), e);
        }
        return canonical(uri.normalize(), raw);
    }

    /**
     * Non-throwing variant of {@link #normalize(String, String)}.
     *
     * @return the canonical form, or empty if the input cannot be normalized
     */
    public static Optional<String> tryNormalize(@Nullable String raw, @Nullable String base) {
        try {
            return Optional.of(normalize(raw, base));
        } catch (InvalidUrlException e) {
            return Optional.empty();
        }
    }

    /**
     * Extract the site origin (scheme://host[:port]) from a URL.
     * Non-default ports are preserved; default ports (80 for HTTP, 443 for HTTPS) are omitted.
     *
     * @param url the URL to extract the origin from
     * @return the origin without a trailing slash
     * @throws InvalidUrlException if the URL is not valid
     */
    public static String normalizeToBase(String url) {
        String normalized = normalize(url);
        URI uri = URI.create(normalized);
        Authority authority = authorityOf(uri, normalized);
        if (authority.port() == -1) {
            return uri.getScheme() + "://" + authority.host();
        }
        return uri.getScheme() + "://" + authority.host() + ":" + authority.port();
    }

    /**
     * Lower-cased host of a URL.
     *
     * @throws InvalidUrlException if the URL is not valid
     */
    public static String hostOf(String url) {
        String normalized = normalize(url);
        return authorityOf(URI.create(normalized), normalized).host();
    }

    /**
     * Java's {@link URI#resolve(URI)} follows RFC 2396 for query-only references and drops the
     * last path segment; RFC 3986 keeps it.
     */
    private static URI resolve(URI base, String reference) throws URISyntaxException {
        if (reference.startsWith("?")) {
            return new URI(base.getScheme() + "://" + base.getRawAuthority()
                    + base.getRawPath() + reference);
        }
        return base.resolve(new URI(reference));
    }

    private static URI baseUri(String base) throws URISyntaxException {
        URI uri = new URI(base.trim().replace(" ", "%20"));
        if (!uri.isAbsolute() || uri.getRawAuthority() == null) {
            throw new InvalidUrlException(base, "base URL must be absolute");
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            // "https://host" + "page" would otherwise resolve to "https://hostpage"
            String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
            return new URI(uri.getScheme() + "://" + uri.getRawAuthority() + "/" + query);
        }
        return uri;
    }

    private static String canonical(URI uri, String original) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new InvalidUrlException(original, "missing scheme");
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidUrlException(original, "unsupported scheme '" + scheme + "'");
        }
        Authority authority = authorityOf(uri, original);
        String host = authority.host().toLowerCase(Locale.ROOT);
        int port = authority.port();
        String path = uri.getRawPath();
        String query = uri.getRawQuery();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Host and port of a URI. {@link URI#getHost()} is null for host names that are not valid
     * RFC 2396 host names, such as {@code my_site.example.com}; those are read from the raw
     * authority instead.
     */
    private static Authority authorityOf(URI uri, String original) {
        if (uri.getHost() != null && !uri.getHost().isEmpty()) {
            return new Authority(uri.getHost(), uri.getPort());
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            throw new InvalidUrlException(original, "missing host");
        }
        authority = authority.substring(authority.lastIndexOf('@') + 1);
        String host = authority;
        int port = -1;
        int colon = authority.lastIndexOf(':');
        if (colon >= 0) {
            host = authority.substring(0, colon);
            port = parsePort(authority.substring(colon + 1), original);
        }
        if (host.isEmpty() || !REGISTERED_NAME.matcher(host).matches()) {
            throw new InvalidUrlException(original, "missing host");
        }
        return new Authority(host, port);
    }

    private static int parsePort(String digits, String original) {
        if (digits.isEmpty()) {
            return -1;
        }
        try {
            int port = Integer.parseInt(digits);
            if (port > 65535) {
                throw new InvalidUrlException(original, "invalid port " + digits);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new InvalidUrlException(original, "invalid port " + digits, e);
        }
    }

    private record Authority(String host, int port) {
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
