package org.smileyface.botview.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

public final class UrlUtils {

    private static final Pattern CACHE_BUSTER = Pattern.compile("([?&])_cb=\\d+&?");

    private UrlUtils() {
        // No instanciation
    }

    /**
     * Canonical form of an absolute http(s) URL: lower-cased scheme and host, default port removed,
     * fragment dropped, empty path replaced by "/". Returns null for anything that is not a
     * syntactically valid absolute http(s) URL.
     */
    public static String normalizeUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase();
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null;
            }
            String host = uri.getHost();
            if (host == null || host.isBlank()) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase());
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isBlank()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Host of the URL, or null when it cannot be parsed.
     */
    public static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Appends a throw-away query parameter so intermediate caches do not serve a stale copy.
     */
    public static String withCacheBuster(String url) {
        String token = "_cb=" + System.currentTimeMillis() / 1000 + ThreadLocalRandom.current().nextInt(1000, 10000);
        return url.contains("?") ? url + "&" + token : url + "?" + token;
    }

    /**
     * Removes the parameter added by {@link #withCacheBuster(String)}.
     */
    public static String stripCacheBuster(String url) {
        if (url == null) return null;
        String out = CACHE_BUSTER.matcher(url).replaceFirst("$1");
        return (out.endsWith("?") || out.endsWith("&")) ? out.substring(0, out.length() - 1) : out;
    }

    /**
     * SHA-256 of the value as lowercase hex, truncated to {@code length} characters
     * (64 or more returns the full digest).
     */
    public static String sha256Hex(String value, int length) {
        byte[] data = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            String hex = toHex(md.digest(data));
            return length >= hex.length() ? hex : hex.substring(0, Math.max(0, length));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed to exist on all Java platforms
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
