package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One side of a preview: the document as one identity received it, with its title and canonical.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviewView(boolean success,
                          String html,
                          String title,
                          String canonical,
                          long fetchTimeMs,
                          String strategy,
                          boolean cached,
                          String error) {

    public static PreviewView of(FetchOutcome outcome, SeoData seo) {
        return new PreviewView(true, outcome.getHtml(), seo.getTitle(), seo.getCanonical(),
                outcome.getElapsedMs(), outcome.getStrategy(), outcome.isCached(), null);
    }

    public static PreviewView failed(FetchOutcome outcome) {
        String error = outcome.getError() != null ? outcome.getError() : "Fetch failed";
        return new PreviewView(false, null, null, null, outcome.getElapsedMs(), null, false, error);
    }
}
