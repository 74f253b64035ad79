package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON view of a single acquisition for the public API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GooglebotViewResponse(boolean success,
                                    String url,
                                    String mode,
                                    String html,
                                    long fetchTimeMs,
                                    String strategy,
                                    boolean cached,
                                    boolean cloakedProvenance,
                                    String finalUrl,
                                    String error) {

    public static GooglebotViewResponse from(FetchOutcome outcome) {
        return new GooglebotViewResponse(
                outcome.isSuccess(),
                outcome.getUrl(),
                outcome.getIdentity().mode(),
                outcome.getHtml(),
                outcome.getElapsedMs(),
                outcome.getStrategy(),
                outcome.isCached(),
                outcome.isCloakedProvenance(),
                outcome.getFinalUrl(),
                outcome.getError());
    }
}
