package org.smileyface.botview.strategy;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.detector.BlockDetector;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.model.StrategyDescriptor;
import org.smileyface.botview.util.UrlUtils;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Loads the page in the shared headless browser under a given User-Agent.
 *
 * <p>Every fetch opens a fresh isolated context (no cookies or storage carried between fetches)
 * and closes it on every exit path. If the first snapshot is a challenge interstitial, the page is
 * polled once a second until the challenge clears or the wait budget runs out.</p>
 */
public class BrowserStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(BrowserStrategy.class);

    static final Map<String, String> NO_CACHE_HEADERS = Map.of(
            "Cache-Control", "no-cache, no-store, must-revalidate",
            "Pragma", "no-cache",
            "Expires", "0");

    private final BrowserManager manager;
    private final String userAgent;
    private final boolean stealth;
    private final String proxyUrl;
    private final String stealthScript;
    private final BrowserSettings settings;
    private final BlockDetector detector;

    public BrowserStrategy(String name, String userAgent, boolean stealth, String proxyUrl,
                           BrowserManager manager, String stealthScript, BrowserSettings settings,
                           BlockDetector detector, Duration attemptTimeout) {
        super(name, new StrategyDescriptor(tags(stealth, proxyUrl != null), false, attemptTimeout));
        this.manager = Objects.requireNonNull(manager, "manager");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.stealth = stealth;
        this.proxyUrl = proxyUrl;
        this.stealthScript = stealthScript == null ? "" : stealthScript;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    private static Set<CapabilityTag> tags(boolean stealth, boolean proxied) {
        EnumSet<CapabilityTag> tags = EnumSet.of(CapabilityTag.BROWSER);
        if (stealth) tags.add(CapabilityTag.STEALTH);
        if (proxied) tags.add(CapabilityTag.UPSTREAM_PROXY);
        return tags;
    }

    /**
     * A proxied variant without a configured proxy is unavailable.
     */
    @Override
    public boolean isAvailable() {
        if (proxyUrl != null && proxyUrl.isBlank()) return false;
        return manager.isAvailable();
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        try {
            return manager.execute(browser -> load(browser, url, start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IllegalStateException) {
                return RawResult.failed(FailureKind.CONFIGURATION, cause.getMessage(), elapsedMs(start));
            }
            log.warn("[{}] browser fetch failed for {}: {}", name(), url, cause.getMessage());
            return RawResult.failed(FailureKind.TRANSPORT, String.valueOf(cause.getMessage()), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RawResult.failed(FailureKind.TRANSPORT, "Browser fetch interrupted", elapsedMs(start));
        } catch (IllegalStateException e) {
            return RawResult.failed(FailureKind.CONFIGURATION, e.getMessage(), elapsedMs(start));
        }
    }

    // runs on the browser thread
    private RawResult load(Browser browser, String url, long start) {
        BrowserContext context = null;
        try {
            Browser.NewContextOptions options = new Browser.NewContextOptions()
                    .setUserAgent(userAgent)
                    .setViewportSize(settings.viewportWidth(), settings.viewportHeight())
                    .setLocale(settings.locale())
                    .setTimezoneId(settings.timezoneId())
                    .setExtraHTTPHeaders(NO_CACHE_HEADERS);
            if (proxyUrl != null) {
                options.setProxy(proxyUrl).setTimezoneId(settings.proxyTimezoneId());
            }
            context = browser.newContext(options);
            if (stealth && !stealthScript.isEmpty()) {
                context.addInitScript(stealthScript);
            }
            Page page = context.newPage();

            Response response = page.navigate(UrlUtils.withCacheBuster(url), new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(settings.navigationTimeoutMs()));
            if (response == null) {
                return RawResult.failed(FailureKind.TRANSPORT, "No response", elapsedMs(start));
            }

            String html = page.content();
            if (detector.isChallenged(html)) {
                log.debug("[{}] challenge detected on {}, waiting up to {}s", name(), url, settings.maxChallengeWaitSeconds());
                for (int i = 0; i < settings.maxChallengeWaitSeconds(); i++) {
                    page.waitForTimeout(1000);
                    html = page.content();
                    if (!detector.isChallenged(html)) break;
                }
                if (detector.isChallenged(html)) {
                    return RawResult.failed(FailureKind.BLOCKED, "Challenge not resolved",
                            response.status(), html, elapsedMs(start));
                }
            }

            try {
                page.waitForLoadState(LoadState.NETWORKIDLE,
                        new Page.WaitForLoadStateOptions().setTimeout(settings.networkIdleTimeoutMs()));
                html = page.content();
            } catch (TimeoutError e) {
                // long-polling pages never go idle, keep the snapshot we have
                log.debug("[{}] network idle timeout for {}", name(), url);
            }

            return RawResult.fetched(html, response.status(), elapsedMs(start),
                    UrlUtils.stripCacheBuster(page.url()), false);
        } catch (PlaywrightException e) {
            return RawResult.failed(FailureKind.TRANSPORT, e.getMessage(), elapsedMs(start));
        } finally {
            if (context != null) {
                try {
                    context.close();
                } catch (PlaywrightException e) {
                    log.warn("[{}] failed to close browser context: {}", name(), e.getMessage());
                }
            }
        }
    }
}
