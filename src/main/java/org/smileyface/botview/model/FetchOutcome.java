package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Final answer of the acquisition engine for one request.
 * A successful outcome always carries non-empty HTML; a failed one never does.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FetchOutcome {

    public static final String CACHE_STRATEGY = "cache";

    private final boolean success;
    private final String url;
    private final Identity identity;
    private final String html;
    private final long elapsedMs;
    private final String strategy;          // name of the strategy that produced the html
    private final boolean cloakedProvenance;
    private final boolean cached;
    private final Integer httpStatus;
    private final String finalUrl;
    private final FailureKind failureKind;
    private final String error;

    private FetchOutcome(boolean success, String url, Identity identity, String html, long elapsedMs,
                         String strategy, boolean cloakedProvenance, boolean cached, Integer httpStatus,
                         String finalUrl, FailureKind failureKind, String error) {
        this.success = success;
        this.url = url;
        this.identity = identity;
        this.html = html;
        this.elapsedMs = elapsedMs;
        this.strategy = strategy;
        this.cloakedProvenance = cloakedProvenance;
        this.cached = cached;
        this.httpStatus = httpStatus;
        this.finalUrl = finalUrl;
        this.failureKind = failureKind;
        this.error = error;
    }

    public static FetchOutcome fromCache(FetchRequest request, CacheEntry entry, long elapsedMs) {
        requireHtml(entry.html());
        return new FetchOutcome(true, request.getUrl(), request.getIdentity(), entry.html(), elapsedMs,
                CACHE_STRATEGY, entry.cloakedProvenance(), true, entry.httpStatus(), request.getUrl(), null, null);
    }

    public static FetchOutcome accepted(FetchRequest request, String strategy, RawResult.Fetched result, long elapsedMs) {
        requireHtml(result.body());
        String finalUrl = result.finalUrl() != null ? result.finalUrl() : request.getUrl();
        return new FetchOutcome(true, request.getUrl(), request.getIdentity(), result.body(), elapsedMs,
                strategy, result.cloakedProvenance(), false, result.status(), finalUrl, null, null);
    }

    public static FetchOutcome exhausted(FetchRequest request, String lastError, long elapsedMs) {
        String message = (lastError == null || lastError.isBlank())
                ? "All fetch strategies failed"
                : "All fetch strategies failed: " + lastError;
        return new FetchOutcome(false, request.getUrl(), request.getIdentity(), null, elapsedMs,
                null, false, false, null, null, FailureKind.EXHAUSTION, message);
    }

    private static void requireHtml(String html) {
        if (html == null || html.isEmpty()) {
            throw new IllegalArgumentException("successful outcome requires non-empty html");
        }
    }

    public boolean isSuccess() { return success; }
    public String getUrl() { return url; }
    public Identity getIdentity() { return identity; }
    public String getHtml() { return html; }
    public long getElapsedMs() { return elapsedMs; }
    public String getStrategy() { return strategy; }
    public boolean isCloakedProvenance() { return cloakedProvenance; }
    public boolean isCached() { return cached; }
    public Integer getHttpStatus() { return httpStatus; }
    public String getFinalUrl() { return finalUrl; }
    public FailureKind getFailureKind() { return failureKind; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "FetchOutcome{" +
                "success=" + success +
                ", url='" + url + '\'' +
                ", identity=" + identity +
                ", strategy='" + strategy + '\'' +
                ", cached=" + cached +
                ", cloakedProvenance=" + cloakedProvenance +
                ", htmlLength=" + (html != null ? html.length() : 0) +
                ", elapsedMs=" + elapsedMs +
                ", failureKind=" + failureKind +
                ", error='" + error + '\'' +
                '}';
    }
}
