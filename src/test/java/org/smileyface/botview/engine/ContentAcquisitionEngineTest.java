package org.smileyface.botview.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.botview.cache.InMemoryHtmlStore;
import org.smileyface.botview.cache.ResponseCache;
import org.smileyface.botview.detector.BlockDetector;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.FetchOptions;
import org.smileyface.botview.model.FetchOutcome;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.testutil.FakeStrategy;
import org.smileyface.botview.testutil.MutableClock;
import org.smileyface.botview.testutil.Pages;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class ContentAcquisitionEngineTest {

    private static final String URL = "https://example.com/page";

    private MutableClock clock;
    private ResponseCache crawlerCache;
    private ResponseCache visitorCache;
    private ContentAcquisitionEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        InMemoryHtmlStore local = new InMemoryHtmlStore(clock);
        crawlerCache = new ResponseCache(null, local, "seo:html:crawler", Duration.ofSeconds(3600));
        visitorCache = new ResponseCache(null, local, "seo:html:visitor", Duration.ofSeconds(3600));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    private ContentAcquisitionEngine engine(List<FakeStrategy> crawler, List<FakeStrategy> visitor) {
        return engine(crawler, visitor, 500);
    }

    private ContentAcquisitionEngine engine(List<FakeStrategy> crawler, List<FakeStrategy> visitor, int minHtmlLength) {
        AcquisitionContext ctx = AcquisitionContext.builder()
                .strategies(Identity.CRAWLER, crawler)
                .strategies(Identity.VISITOR, visitor)
                .cache(Identity.CRAWLER, crawlerCache)
                .cache(Identity.VISITOR, visitorCache)
                .detector(new BlockDetector())
                .minHtmlLength(minHtmlLength)
                .build();
        engine = new ContentAcquisitionEngine(ctx, 4);
        return engine;
    }

    private ContentAcquisitionEngine engine(FakeStrategy... crawler) {
        return engine(List.of(crawler), List.of());
    }

    @Test
    void firstStrategySucceeds_resultIsReturnedAndCached() {
        String page = Pages.page("Real", 5000);
        FakeStrategy first = FakeStrategy.returning("first", 200, page);
        FakeStrategy second = FakeStrategy.returning("second", 200, page);
        engine(first, second);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getStrategy()).isEqualTo("first");
        assertThat(outcome.getHtml()).isEqualTo(page);
        assertThat(outcome.isCached()).isFalse();
        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        assertThat(second.calls()).isZero();
        assertThat(crawlerCache.get(URL)).contains(page);
    }

    @Test
    void blockedStatus_fallsThroughToNextStrategy() {
        String page = Pages.page("Real", 2000);
        FakeStrategy blocked = FakeStrategy.returning("blocked", 403, Pages.page("Real", 2000));
        FakeStrategy good = FakeStrategy.returning("good", 200, page);
        engine(blocked, good);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getStrategy()).isEqualTo("good");
        assertThat(blocked.calls()).isEqualTo(1);
    }

    @Test
    void challengePageAndShortDocument_areRejected() {
        String challenge = "<html><head><title>Just a moment...</title></head><body>" + "x".repeat(1000) + "</body></html>";
        FakeStrategy challenged = FakeStrategy.returning("challenged", 200, challenge);
        FakeStrategy tooShort = FakeStrategy.returning("short", 200, "<html><body>tiny</body></html>");
        engine(challenged, tooShort);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.EXHAUSTION);
        assertThat(outcome.getError()).startsWith("All fetch strategies failed: short: html too short");
        assertThat(outcome.getHtml()).isNull();
        assertThat(challenged.calls()).isEqualTo(1);
        assertThat(crawlerCache.get(URL)).isEmpty();
    }

    @Test
    void documentExactlyAtMinimumLength_isRejected_oneMoreCharIsAccepted() {
        String page = Pages.page("Edge", 100);
        String atMinimum = page + " ".repeat(500 - page.length());
        FakeStrategy edge = FakeStrategy.returning("edge", 200, atMinimum);
        FakeStrategy longer = FakeStrategy.returning("longer", 200, atMinimum + " ");
        engine(edge, longer);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(atMinimum).hasSize(500);
        assertThat(edge.calls()).isEqualTo(1);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getStrategy()).isEqualTo("longer");
        assertThat(outcome.getHtml()).hasSize(501);
    }

    @Test
    void emptyBody_withZeroMinimum_isRejectedInsteadOfThrowing() {
        FakeStrategy empty = FakeStrategy.returning("empty", 200, "");
        engine(List.of(empty), List.of(), 0);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.EXHAUSTION);
        assertThat(outcome.getError()).contains("empty: html too short (0 chars)");
        assertThat(crawlerCache.get(URL)).isEmpty();
    }

    @Test
    void cacheHit_invokesNoStrategy() {
        String page = Pages.page("Cached", 1000);
        crawlerCache.set(URL, page);
        FakeStrategy s = FakeStrategy.returning("s", 200, Pages.page("Fresh", 1000));
        engine(s);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isCached()).isTrue();
        assertThat(outcome.getStrategy()).isEqualTo(FetchOutcome.CACHE_STRATEGY);
        assertThat(outcome.getHtml()).isEqualTo(page);
        assertThat(s.calls()).isZero();
    }

    @Test
    void secondRequest_isServedFromCache_untilTtlExpires() {
        FakeStrategy s = FakeStrategy.returning("s", 200, Pages.page("Page", 1000));
        engine(s);

        engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        FetchOutcome again = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        assertThat(again.isCached()).isTrue();
        assertThat(s.calls()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(3600));
        FetchOutcome afterExpiry = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        assertThat(afterExpiry.isCached()).isFalse();
        assertThat(s.calls()).isEqualTo(2);
    }

    @Test
    void identities_useSeparateCachesAndStrategies() {
        FakeStrategy bot = FakeStrategy.returning("bot", 200, Pages.page("Bot", 1000));
        FakeStrategy user = FakeStrategy.returning("user", 200, Pages.page("User", 1000));
        engine(List.of(bot), List.of(user));

        FetchOutcome crawler = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        FetchOutcome visitor = engine.acquire(URL, Identity.VISITOR, FetchOptions.defaults());

        assertThat(crawler.getStrategy()).isEqualTo("bot");
        assertThat(visitor.getStrategy()).isEqualTo("user");
        assertThat(visitor.isCached()).isFalse();
        assertThat(visitor.getIdentity()).isEqualTo(Identity.VISITOR);
    }

    @Test
    void unavailableStrategy_isSkippedWithoutCountingAsFailure() {
        FakeStrategy off = FakeStrategy.returning("off", 200, Pages.page("Off", 1000)).unavailable();
        FakeStrategy failing = FakeStrategy.failing("failing", "connection reset");
        engine(failing, off);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(off.calls()).isZero();
        assertThat(outcome.getError()).isEqualTo("All fetch strategies failed: failing: connection reset");
    }

    @Test
    void configurationFailure_isSkippedLikeUnavailable() {
        FakeStrategy misconfigured = new FakeStrategy("misconfigured",
                url -> RawResult.failed(FailureKind.CONFIGURATION, "token missing", 0));
        FakeStrategy failing = FakeStrategy.failing("failing", "boom");
        engine(failing, misconfigured);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(misconfigured.calls()).isEqualTo(1);
        assertThat(outcome.getError()).endsWith("failing: boom");
    }

    @Test
    void noStrategies_exhaustsWithGenericMessage() {
        engine();

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).isEqualTo("All fetch strategies failed");
    }

    @Test
    void slowStrategy_timesOutAsTransportFailure_andNextOneRuns() {
        FakeStrategy slow = new FakeStrategy("slow", Duration.ofMillis(200),
                url -> RawResult.fetched(Pages.page("Slow", 1000), 200, 1, url, false)).withDelay(3000);
        FakeStrategy fast = FakeStrategy.returning("fast", 200, Pages.page("Fast", 1000));
        engine(slow, fast);

        long start = System.nanoTime();
        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(outcome.getStrategy()).isEqualTo("fast");
        assertThat(elapsedMs).isLessThan(2500);
    }

    @Test
    void timeoutMessage_isReportedWhenEverythingTimesOut() {
        FakeStrategy slow = new FakeStrategy("slow", Duration.ofMillis(100),
                url -> RawResult.fetched("late", 200, 1, url, false)).withDelay(2000);
        engine(slow);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.getError()).isEqualTo("All fetch strategies failed: slow: Timed out after 100 ms");
    }

    @Test
    void throwingStrategy_isContained() {
        FakeStrategy throwing = new FakeStrategy("throwing", url -> {
            throw new IllegalStateException("unexpected");
        });
        engine(throwing);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).contains("throwing: IllegalStateException: unexpected");
    }

    @Test
    void requestOptions_filterStrategiesByNameAndTag() {
        String page = Pages.page("Page", 1000);
        FakeStrategy provenance = new FakeStrategy("provenance",
                url -> RawResult.fetched(page, 200, 1, url, true), CapabilityTag.PROVENANCE_SERVICE);
        FakeStrategy proxy = new FakeStrategy("proxy",
                url -> RawResult.fetched(page, 200, 1, url, true), CapabilityTag.TRUSTED_PROXY);
        FakeStrategy named = FakeStrategy.returning("named", 200, page);
        FakeStrategy last = FakeStrategy.returning("last", 200, page);
        engine(provenance, proxy, named, last);

        FetchOptions options = new FetchOptions(true, false, Set.of("named"));
        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, options);

        assertThat(outcome.getStrategy()).isEqualTo("last");
        assertThat(provenance.calls() + proxy.calls() + named.calls()).isZero();
    }

    @Test
    void cloakedProvenance_isCarriedFromTheAcceptedResult() {
        FakeStrategy provenance = new FakeStrategy("provenance",
                url -> RawResult.fetched(Pages.page("P", 1000), 200, 1, "https://example.com/final", true),
                CapabilityTag.PROVENANCE_SERVICE);
        engine(provenance);

        FetchOutcome outcome = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(outcome.isCloakedProvenance()).isTrue();
        assertThat(outcome.getFinalUrl()).isEqualTo("https://example.com/final");
    }

    @Test
    void cacheHit_reportsProvenanceAndStatusOfTheOriginalFetch() {
        FakeStrategy provenance = new FakeStrategy("provenance",
                url -> RawResult.fetched(Pages.page("P", 1000), 200, 1, url, true),
                CapabilityTag.PROVENANCE_SERVICE);
        engine(provenance);

        engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());
        FetchOutcome again = engine.acquire(URL, Identity.CRAWLER, FetchOptions.defaults());

        assertThat(again.isCached()).isTrue();
        assertThat(again.isCloakedProvenance()).isTrue();
        assertThat(again.getHttpStatus()).isEqualTo(200);
        assertThat(provenance.calls()).isEqualTo(1);
    }

    @Test
    void strategiesReceiveNormalizedUrl() {
        FakeStrategy s = FakeStrategy.returning("s", 200, Pages.page("P", 1000));
        engine(s);

        FetchOutcome outcome = engine.acquire("HTTPS://Example.com:443/page#frag", Identity.CRAWLER, FetchOptions.defaults());

        assertThat(s.urls()).containsExactly("https://example.com/page");
        assertThat(outcome.getUrl()).isEqualTo("HTTPS://Example.com:443/page#frag");
    }

    @Test
    void invalidUrl_isRejectedBeforeAnyAttempt() {
        FakeStrategy s = FakeStrategy.returning("s", 200, Pages.page("P", 1000));
        engine(s);

        assertThatThrownBy(() -> engine.acquire("ftp://example.com/", Identity.CRAWLER, FetchOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(s.calls()).isZero();
    }

    @Test
    void concurrentRequests_areIndependent() throws Exception {
        FakeStrategy s = new FakeStrategy("s",
                url -> RawResult.fetched(Pages.page(url, 1000), 200, 1, url, false)).withDelay(50);
        engine(s);

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<FetchOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String url = "https://example.com/p" + i;
                Callable<FetchOutcome> call = () -> engine.acquire(url, Identity.CRAWLER, FetchOptions.defaults());
                futures.add(callers.submit(call));
            }
            for (int i = 0; i < futures.size(); i++) {
                FetchOutcome outcome = futures.get(i).get();
                assertThat(outcome.isSuccess()).isTrue();
                assertThat(outcome.getHtml()).contains("https://example.com/p" + i);
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void availability_listsStrategiesInPriorityOrder() {
        FakeStrategy a = FakeStrategy.returning("a", 200, "x");
        FakeStrategy b = FakeStrategy.returning("b", 200, "x").unavailable();
        engine(List.of(a, b), List.of());

        Map<String, Boolean> availability = engine.availability(Identity.CRAWLER);

        assertThat(availability).containsExactly(entry("a", true), entry("b", false));
        assertThat(engine.availability(Identity.VISITOR)).isEmpty();
    }
}
