package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of the analyze operation: SEO fields as the crawler sees them, optional cloaking
 * report and fetch metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyzeResponse {

    private boolean success;
    private String url;
    private String finalUrl;
    private List<String> redirects = new ArrayList<>();
    private SeoData seoData;
    private CloakingReport cloaking;
    private long fetchTimeMs;
    private String strategy;
    private boolean cached;
    private boolean cloakedProvenance;
    private String error;
    private String html;               // only when explicitly requested

    public AnalyzeResponse() {
        // default
    }

    public static AnalyzeResponse failure(String url, String error, long fetchTimeMs) {
        AnalyzeResponse r = new AnalyzeResponse();
        r.setSuccess(false);
        r.setUrl(url);
        r.setError(error);
        r.setFetchTimeMs(fetchTimeMs);
        return r;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getFinalUrl() { return finalUrl; }
    public void setFinalUrl(String finalUrl) { this.finalUrl = finalUrl; }

    public List<String> getRedirects() { return redirects; }
    public void setRedirects(List<String> redirects) {
        this.redirects = redirects != null ? new ArrayList<>(redirects) : new ArrayList<>();
    }

    public SeoData getSeoData() { return seoData; }
    public void setSeoData(SeoData seoData) { this.seoData = seoData; }

    public CloakingReport getCloaking() { return cloaking; }
    public void setCloaking(CloakingReport cloaking) { this.cloaking = cloaking; }

    public long getFetchTimeMs() { return fetchTimeMs; }
    public void setFetchTimeMs(long fetchTimeMs) { this.fetchTimeMs = fetchTimeMs; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public boolean isCached() { return cached; }
    public void setCached(boolean cached) { this.cached = cached; }

    public boolean isCloakedProvenance() { return cloakedProvenance; }
    public void setCloakedProvenance(boolean cloakedProvenance) { this.cloakedProvenance = cloakedProvenance; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getHtml() { return html; }
    public void setHtml(String html) { this.html = html; }
}
