package org.smileyface.botview.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.compare.CloakingComparator;
import org.smileyface.botview.engine.ContentAcquisitionEngine;
import org.smileyface.botview.extractor.SeoMetadataExtractor;
import org.smileyface.botview.model.AnalyzeResponse;
import org.smileyface.botview.model.CloakingReport;
import org.smileyface.botview.model.FetchOptions;
import org.smileyface.botview.model.FetchOutcome;
import org.smileyface.botview.model.FetchRequest;
import org.smileyface.botview.model.HealthResponse;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.model.PreviewResponse;
import org.smileyface.botview.model.PreviewView;
import org.smileyface.botview.model.SeoData;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SEO analysis of a page as the crawler sees it, optionally compared with the visitor view to
 * detect cloaking.
 */
@Service
public class SeoAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SeoAnalysisService.class);

    private final ContentAcquisitionEngine engine;
    private final SeoMetadataExtractor extractor;
    private final CloakingComparator comparator;

    public SeoAnalysisService(ContentAcquisitionEngine engine,
                              SeoMetadataExtractor extractor,
                              CloakingComparator comparator) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    /**
     * Acquire the page under the given identity.
     * @throws IllegalArgumentException when {@code url} is not an absolute http(s) URL
     */
    public FetchOutcome view(String url, Identity identity) {
        log.info("View request: url={}, identity={}", url, identity);
        return engine.acquire(new FetchRequest(url, identity, FetchOptions.defaults()));
    }

    /**
     * Acquire the crawler view, extract its SEO metadata and, when requested, compare it with the
     * visitor view. A failed visitor acquisition leaves the cloaking report out instead of failing
     * the analysis.
     *
     * @throws IllegalArgumentException when {@code url} is not an absolute http(s) URL
     */
    public AnalyzeResponse analyze(String url, boolean detectCloaking, boolean includeHtml) {
        FetchRequest crawlerRequest = new FetchRequest(url, Identity.CRAWLER, FetchOptions.defaults());
        log.info("Analyze request: url={}, cloaking={}", crawlerRequest.getUrl(), detectCloaking);

        FetchOutcome crawler = engine.acquire(crawlerRequest);
        if (!crawler.isSuccess()) {
            return AnalyzeResponse.failure(crawlerRequest.getUrl(),
                    crawler.getError() != null ? crawler.getError() : "Failed to fetch",
                    crawler.getElapsedMs());
        }

        String finalUrl = crawler.getFinalUrl() != null ? crawler.getFinalUrl() : crawlerRequest.getUrl();
        SeoData seo = extractor.extract(crawler.getHtml(), finalUrl);

        CloakingReport cloaking = null;
        if (detectCloaking) {
            log.info("Running cloaking detection for {}", crawlerRequest.getUrl());
            FetchOutcome visitor = engine.acquire(
                    new FetchRequest(crawlerRequest.getUrl(), Identity.VISITOR, FetchOptions.defaults()));
            if (visitor.isSuccess()) {
                cloaking = comparator.compare(crawler.getHtml(), visitor.getHtml());
                log.info("Cloaking detection for {}: detected={}", crawlerRequest.getUrl(), cloaking.detected());
            } else {
                log.warn("Visitor view unavailable for {}, skipping cloaking detection: {}",
                        crawlerRequest.getUrl(), visitor.getError());
            }
        }

        List<String> redirects = new ArrayList<>();
        if (!finalUrl.equals(crawlerRequest.getUrl()) && !finalUrl.equals(crawlerRequest.getNormalizedUrl())) {
            redirects.add(crawlerRequest.getUrl() + " -> " + finalUrl);
        }

        AnalyzeResponse response = new AnalyzeResponse();
        response.setSuccess(true);
        response.setUrl(crawlerRequest.getUrl());
        response.setFinalUrl(finalUrl);
        response.setRedirects(redirects);
        response.setSeoData(seo);
        response.setCloaking(cloaking);
        response.setFetchTimeMs(crawler.getElapsedMs());
        response.setStrategy(crawler.getStrategy());
        response.setCached(crawler.isCached());
        response.setCloakedProvenance(crawler.isCloakedProvenance());
        if (includeHtml) {
            response.setHtml(crawler.getHtml());
        }
        return response;
    }

    /**
     * Crawler view of the page and, when {@code includeUser} is set, the visitor view, each with
     * its title and canonical. A failed view is reported inside the response, not thrown.
     *
     * @throws IllegalArgumentException when {@code url} is not an absolute http(s) URL
     */
    public PreviewResponse preview(String url, boolean includeUser) {
        long start = System.nanoTime();
        FetchRequest crawlerRequest = new FetchRequest(url, Identity.CRAWLER, FetchOptions.defaults());
        log.info("Preview request: url={}, includeUser={}", crawlerRequest.getUrl(), includeUser);

        FetchOutcome crawler = engine.acquire(crawlerRequest);
        PreviewView crawlerView = toView(crawler);

        PreviewView userView = null;
        if (includeUser) {
            userView = toView(engine.acquire(
                    new FetchRequest(crawlerRequest.getUrl(), Identity.VISITOR, FetchOptions.defaults())));
        }

        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        return new PreviewResponse(crawler.isSuccess(), crawlerRequest.getUrl(), crawlerView, userView,
                totalMs, crawler.getStrategy(), crawler.isSuccess() ? null : crawlerView.error());
    }

    private PreviewView toView(FetchOutcome outcome) {
        if (!outcome.isSuccess()) {
            return PreviewView.failed(outcome);
        }
        String baseUrl = outcome.getFinalUrl() != null ? outcome.getFinalUrl() : outcome.getUrl();
        return PreviewView.of(outcome, extractor.extract(outcome.getHtml(), baseUrl));
    }

    /**
     * Cache backend and strategy availability. Availability checks may call out (FlareSolverr health, browser launch).
     */
    public HealthResponse health() {
        String cacheType = engine.getContext().cacheFor(Identity.CRAWLER).backendType();
        return new HealthResponse("ok", cacheType,
                engine.availability(Identity.CRAWLER),
                engine.availability(Identity.VISITOR));
    }
}
