package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Crawler view of a page next to the optional visitor view. {@code success} and {@code strategy}
 * follow the crawler view.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviewResponse(boolean success,
                              String url,
                              PreviewView crawler,
                              PreviewView user,
                              long totalTimeMs,
                              String strategy,
                              String error) {
}
