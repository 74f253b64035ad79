package org.smileyface.botview.strategy;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.model.StrategyDescriptor;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.EnumSet;

/**
 * Fetches the crawler view through the affiliate.fm provenance service.
 *
 * The service requests the page from address ranges that origins verify as genuine crawler
 * traffic, so the returned document is what the site serves to the real crawler.
 * Requires a bearer token; without one the strategy reports itself unavailable.
 */
public class AffiliateFmStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(AffiliateFmStrategy.class);

    static final String VIEW_PATH = "/googlebot-view";

    private final String baseUrl;
    private final String token;
    private final String lang;
    private final int requestTimeoutMs;

    public AffiliateFmStrategy(String baseUrl, String token, String lang, int requestTimeoutMs, Duration attemptTimeout) {
        super(StrategyNames.AFFILIATE_FM,
                new StrategyDescriptor(EnumSet.of(CapabilityTag.PROVENANCE_SERVICE), true, attemptTimeout));
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.token = token;
        this.lang = isBlank(lang) ? "en" : lang;
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
    }

    @Override
    public boolean isAvailable() {
        return !isBlank(token) && !isBlank(baseUrl);
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        if (!isAvailable()) {
            return RawResult.failed(FailureKind.CONFIGURATION, "Affiliate.fm token not configured", 0);
        }
        try {
            log.info("Affiliate.fm: fetching crawler view for {}", url);
            Connection.Response res = Jsoup.connect(baseUrl + VIEW_PATH)
                    .method(Connection.Method.GET)
                    .data("url", url)
                    .data("lang", lang)
                    .header("Authorization", "Bearer " + token)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .maxBodySize(0)
                    .timeout(requestTimeoutMs)
                    .execute();
            int status = res.statusCode();
            long elapsed = elapsedMs(start);
            if (status == 200) {
                String body = res.body();
                log.info("Affiliate.fm: success for {}, got {} chars", url, body.length());
                return RawResult.fetched(body, 200, elapsed, url, true);
            }
            String error = switch (status) {
                case 401 -> "Affiliate.fm: Token expired or invalid";
                case 403 -> "Affiliate.fm: Subscription required";
                case 429 -> "Affiliate.fm: Rate limit exceeded";
                default -> "Affiliate.fm error: HTTP " + status;
            };
            log.warn("{} ({})", error, url);
            return RawResult.failed(FailureKind.TRANSPORT, error, status, null, elapsed);
        } catch (SocketTimeoutException e) {
            log.warn("Affiliate.fm timeout for {}", url);
            return RawResult.failed(FailureKind.TRANSPORT, "Affiliate.fm timeout", elapsedMs(start));
        } catch (IOException e) {
            log.warn("Affiliate.fm error for {}: {}", url, e.getMessage());
            return RawResult.failed(FailureKind.TRANSPORT, "Affiliate.fm error: " + e.getMessage(), elapsedMs(start));
        }
    }

    static String trimTrailingSlash(String url) {
        if (url == null) return null;
        String t = url.trim();
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }
}
