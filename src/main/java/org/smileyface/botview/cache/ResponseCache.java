package org.smileyface.botview.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.model.CacheEntry;
import org.smileyface.botview.util.UrlUtils;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Short-lived cache of fetched documents keyed by normalized URL.
 *
 * <p>When a shared store (Redis) is configured it is consulted first; on a miss or any error the
 * process-local store answers. Writes go to both, so a shared-store outage degrades to local
 * caching instead of no caching. Backend errors are logged and treated as misses, never thrown.</p>
 *
 * <p>Entries are stored as JSON carrying the document and its provenance. A stored value that is
 * not such a JSON object is read back as a bare document.</p>
 */
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final int KEY_HASH_LENGTH = 32;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HtmlStore shared;          // nullable
    private final InMemoryHtmlStore local;
    private final String namespace;
    private final Duration ttl;

    public ResponseCache(HtmlStore shared, InMemoryHtmlStore local, String namespace, Duration ttl) {
        this.shared = shared;
        this.local = Objects.requireNonNull(local, "local");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Cache key for a URL: namespace followed by the first 32 hex chars of SHA-256 of the
     * normalized URL.
     */
    public String key(String url) {
        String normalized = UrlUtils.normalizeUrl(url);
        String basis = normalized != null ? normalized : (url == null ? "" : url.trim());
        return namespace + ":" + UrlUtils.sha256Hex(basis, KEY_HASH_LENGTH);
    }

    public Optional<String> get(String url) {
        return lookup(url).map(CacheEntry::html);
    }

    /**
     * The cached document with the provenance it was stored with.
     */
    public Optional<CacheEntry> lookup(String url) {
        String key = key(url);
        if (shared != null) {
            try {
                Optional<CacheEntry> hit = shared.get(key).flatMap(this::decode);
                if (hit.isPresent()) {
                    log.debug("Cache hit ({}) for {}", shared.type(), url);
                    return hit;
                }
            } catch (Exception e) {
                log.warn("Cache read from {} failed for {}: {}", shared.type(), url, e.getMessage());
            }
        }
        Optional<CacheEntry> hit = local.get(key).flatMap(this::decode);
        if (hit.isPresent()) {
            log.debug("Cache hit (memory) for {}", url);
        }
        return hit;
    }

    public void set(String url, String html) {
        if (html == null || html.isEmpty()) return;
        set(url, CacheEntry.of(html));
    }

    public void set(String url, CacheEntry entry) {
        if (entry == null || entry.html().isEmpty()) return;
        String key = key(url);
        String value;
        try {
            value = MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize cache entry for {}: {}", url, e.getMessage());
            return;
        }
        if (shared != null) {
            try {
                shared.put(key, value, ttl);
            } catch (Exception e) {
                log.warn("Cache write to {} failed for {}: {}", shared.type(), url, e.getMessage());
            }
        }
        local.put(key, value, ttl);
    }

    private Optional<CacheEntry> decode(String value) {
        if (value.isEmpty()) return Optional.empty();
        if (value.startsWith("{")) {
            try {
                CacheEntry entry = MAPPER.readValue(value, CacheEntry.class);
                return entry.html().isEmpty() ? Optional.empty() : Optional.of(entry);
            } catch (JsonProcessingException e) {
                log.debug("Stored value is not a cache entry, reading it as a document: {}", e.getMessage());
            }
        }
        return Optional.of(CacheEntry.of(value));
    }

    /** "redis" when a shared store is attached, "memory" otherwise. */
    public String backendType() {
        return shared != null ? shared.type() : local.type();
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void clearLocal() {
        local.clear();
    }
}
