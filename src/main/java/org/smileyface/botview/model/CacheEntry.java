package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Cached document together with how it was obtained, so a cache hit reports the same
 * provenance as the fetch that filled it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheEntry(String html, boolean cloakedProvenance, Integer httpStatus) {

    public CacheEntry {
        Objects.requireNonNull(html, "html");
    }

    public static CacheEntry of(String html) {
        return new CacheEntry(html, false, null);
    }
}
