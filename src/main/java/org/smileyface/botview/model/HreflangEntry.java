package org.smileyface.botview.model;

/**
 * One {@code <link rel="alternate" hreflang="...">} entry.
 */
public record HreflangEntry(String lang, String url) {
}
