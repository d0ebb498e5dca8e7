package org.netpreserve.sweeper.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    public static Url orNull(String url) {
        if (url == null || url.isBlank()) return null;
        return new Url(url.strip());
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    private URI parse() {
        try {
            return toURI();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
    }

    public String host() {
        return parse().getHost();
    }

    public String scheme() {
        return parse().getScheme();
    }

    public String path() {
        String path = parse().getRawPath();
        return path == null ? "" : path;
    }

    /**
     * Non-empty path segments, e.g. ["@user", "video", "123"] for "/@user/video/123/".
     */
    public List<String> pathSegments() {
        var segments = new ArrayList<String>();
        for (String segment : path().split("/")) {
            if (!segment.isEmpty()) segments.add(segment);
        }
        return segments;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    public Url withoutQuery() {
        Url url = withoutFragment();
        int i = url.url.indexOf('?');
        if (i == -1) {
            return url;
        }
        return new Url(url.url.substring(0, i));
    }

    /**
     * Canonical form used as an identity key: lowercase scheme and host, no query, no fragment and no trailing
     * slash on a non-root path.
     */
    public Url canonical() {
        URI parsed = withoutQuery().parse();
        String scheme = parsed.getScheme() == null ? "https" : parsed.getScheme().toLowerCase(Locale.ROOT);
        String host = parsed.getHost() == null ? "" : parsed.getHost().toLowerCase(Locale.ROOT);
        String port = parsed.getPort() == -1 ? "" : ":" + parsed.getPort();
        String path = parsed.getRawPath() == null || parsed.getRawPath().isEmpty() ? "/" : parsed.getRawPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return new Url(scheme + "://" + host + port + path);
    }

    public Url resolve(String reference) {
        return new Url(parse().resolve(reference).toString());
    }

    public Url withPath(String path) {
        URI parsed = parse();
        String port = parsed.getPort() == -1 ? "" : ":" + parsed.getPort();
        return new Url(parsed.getScheme() + "://" + parsed.getHost() + port + path);
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
