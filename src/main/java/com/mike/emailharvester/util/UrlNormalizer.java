package com.mike.emailharvester.util;

import com.mike.emailharvester.exception.InvalidUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * User input: a missing scheme defaults to https ("example.com" -> "https://example.com/").
     */
    public static String normalizeStartUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidUrlException(String.valueOf(raw), "Start URL is required");
        }
        String url = raw.trim();
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            url = "https://" + url;
        }
        return normalize(url);
    }

    /**
     * Canonical form used for frontier and visited-set membership:
     * lowercase scheme and host, no fragment, no default port, "/" for an empty path.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException(String.valueOf(url), "URL is blank");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(url, e);
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new InvalidUrlException(url, "URL is not absolute");
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException(url, "Unsupported scheme");
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new InvalidUrlException(url, "URL has no host");
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(host.toLowerCase(Locale.ROOT));

        int port = uri.getPort();
        boolean defaultPort = (port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"));
        if (port != -1 && !defaultPort) {
            sb.append(':').append(port);
        }

        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);

        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * Lowercased host, or null when the URL cannot be parsed.
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Exact host match; "www.example.com" and "example.com" are different hosts.
     */
    public static boolean isSameHost(String url, String host) {
        String other = hostOf(url);
        return other != null && Objects.equals(other, host == null ? null : host.toLowerCase(Locale.ROOT));
    }
}
