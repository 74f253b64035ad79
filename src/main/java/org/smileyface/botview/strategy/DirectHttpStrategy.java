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
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;

/**
 * Plain HTTP GET with a configured User-Agent, no script execution.
 * Cheapest technique, and the only one that works without a browser or a remote service.
 */
public class DirectHttpStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(DirectHttpStrategy.class);

    private final String userAgent;
    private final int requestTimeoutMs;

    public DirectHttpStrategy(String name, String userAgent, int requestTimeoutMs, Duration attemptTimeout) {
        super(name,
                new StrategyDescriptor(EnumSet.of(CapabilityTag.PLAIN_HTTP), false, attemptTimeout));
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        try {
            Connection.Response res = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .header("Cache-Control", "no-cache")
                    .timeout(requestTimeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .execute();
            String finalUrl = res.url() != null ? res.url().toString() : url;
            return RawResult.fetched(res.body(), res.statusCode(), elapsedMs(start), finalUrl, false);
        } catch (IOException e) {
            log.debug("Direct fetch failed for {}: {}", url, e.getMessage());
            return RawResult.failed(FailureKind.TRANSPORT, "Direct fetch error: " + e.getMessage(), elapsedMs(start));
        }
    }
}
