package org.smileyface.botview.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value storage backend for cached documents.
 */
public interface HtmlStore {

    /**
     * Look up a stored document.
     * @param key fully namespaced cache key
     * @return the document, or empty when absent or expired
     */
    Optional<String> get(String key);

    /**
     * Store a document, replacing any previous value. The entry is not visible after {@code ttl}.
     */
    void put(String key, String html, Duration ttl);

    /**
     * Short label of the backend, used by health reporting.
     */
    String type();
}
