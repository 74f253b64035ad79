package org.smileyface.botview.model;

import org.smileyface.botview.util.UrlUtils;

import java.util.Objects;

/**
 * A validated acquisition request. The URL is normalized on construction; invalid or
 * non-http(s) URLs are rejected.
 */
public final class FetchRequest {

    private final String url;
    private final String normalizedUrl;
    private final Identity identity;
    private final FetchOptions options;

    public FetchRequest(String url, Identity identity, FetchOptions options) {
        String normalized = UrlUtils.normalizeUrl(url);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid URL (absolute http/https required): " + url);
        }
        this.url = url.trim();
        this.normalizedUrl = normalized;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.options = options == null ? FetchOptions.defaults() : options;
    }

    public FetchRequest(String url, Identity identity) {
        this(url, identity, FetchOptions.defaults());
    }

    /** The URL as given by the caller (trimmed), echoed back in outcomes. */
    public String getUrl() { return url; }

    /** Canonical form, fetched by the strategies and used for cache keys. */
    public String getNormalizedUrl() { return normalizedUrl; }

    public Identity getIdentity() { return identity; }

    public FetchOptions getOptions() { return options; }

    @Override
    public String toString() {
        return "FetchRequest{" +
                "url='" + url + '\'' +
                ", identity=" + identity +
                ", options=" + options +
                '}';
    }
}
