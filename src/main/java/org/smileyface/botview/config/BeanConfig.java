package org.smileyface.botview.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.botview.cache.HtmlStore;
import org.smileyface.botview.cache.InMemoryHtmlStore;
import org.smileyface.botview.cache.RedisHtmlStore;
import org.smileyface.botview.cache.ResponseCache;
import org.smileyface.botview.compare.CloakingComparator;
import org.smileyface.botview.detector.BlockDetector;
import org.smileyface.botview.engine.AcquisitionContext;
import org.smileyface.botview.engine.ContentAcquisitionEngine;
import org.smileyface.botview.extractor.SeoMetadataExtractor;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.strategy.AffiliateFmStrategy;
import org.smileyface.botview.strategy.BrowserManager;
import org.smileyface.botview.strategy.BrowserSettings;
import org.smileyface.botview.strategy.BrowserStrategy;
import org.smileyface.botview.strategy.DirectHttpStrategy;
import org.smileyface.botview.strategy.FetchStrategy;
import org.smileyface.botview.strategy.FlareSolverrStrategy;
import org.smileyface.botview.strategy.StrategyNames;
import org.smileyface.botview.strategy.TranslateProxyStrategy;
import org.smileyface.botview.strategy.ZyteStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the acquisition engine: detector, caches, strategies and their configured order.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger(BeanConfig.class);

    @Bean
    public BlockDetector blockDetector(FetcherProperties properties) {
        return new BlockDetector(properties.getChallengeSignatures(),
                properties.getBlockingTitles(),
                properties.getChallengeTitles());
    }

    @Bean
    public InMemoryHtmlStore localHtmlStore(FetcherProperties properties) {
        return new InMemoryHtmlStore(Clock.systemUTC(), properties.getCache().getLocalMaxEntries());
    }

    @Bean(destroyMethod = "close")
    public BrowserManager browserManager(FetcherProperties properties) {
        return new BrowserManager(properties.getBrowser().isHeadless());
    }

    /**
     * Every built-in strategy, configured from properties. Which of them run, and in which order,
     * is decided by the configured strategy lists.
     */
    static List<FetchStrategy> buildStrategies(FetcherProperties properties,
                                               BlockDetector detector,
                                               BrowserManager browserManager,
                                               ObjectMapper objectMapper) {
        FetcherProperties.Services svc = properties.getServices();
        int requestTimeout = properties.getRequestTimeoutMs();
        String crawlerUa = properties.getCrawlerUserAgent();
        String visitorUa = properties.getVisitorUserAgent();

        FetcherProperties.Browser b = properties.getBrowser();
        BrowserSettings browserSettings = new BrowserSettings(
                b.getViewportWidth(), b.getViewportHeight(), b.getLocale(), b.getTimezoneId(), b.getProxyTimezoneId(),
                requestTimeout, properties.getMaxChallengeWaitSeconds(), BrowserSettings.DEFAULT_NETWORK_IDLE_TIMEOUT_MS);
        String stealthScript = BrowserManager.loadStealthScript();

        List<FetchStrategy> strategies = new ArrayList<>();
        strategies.add(new AffiliateFmStrategy(svc.getAffiliateFmBaseUrl(), svc.getAffiliateFmToken(),
                svc.getAffiliateFmLang(), requestTimeout, timeout(properties, StrategyNames.AFFILIATE_FM)));
        strategies.add(new TranslateProxyStrategy(svc.getTranslateHostSuffix(), svc.getTranslateWebsiteUrl(),
                svc.getTranslateLegacyUrl(), svc.getTranslateTargetLang(), visitorUa, requestTimeout,
                timeout(properties, StrategyNames.TRANSLATE_PROXY), detector));
        strategies.add(new ZyteStrategy(svc.getZyteEndpoint(), svc.getZyteApiKey(), requestTimeout,
                timeout(properties, StrategyNames.ZYTE), objectMapper));
        strategies.add(new BrowserStrategy(StrategyNames.BROWSER_DIRECT, crawlerUa, false, null,
                browserManager, stealthScript, browserSettings, detector, timeout(properties, StrategyNames.BROWSER_DIRECT)));
        strategies.add(new BrowserStrategy(StrategyNames.BROWSER_STEALTH, crawlerUa, true, null,
                browserManager, stealthScript, browserSettings, detector, timeout(properties, StrategyNames.BROWSER_STEALTH)));
        // the solver waits up to its own max timeout, give the socket some headroom on top
        strategies.add(new FlareSolverrStrategy(svc.getFlaresolverrUrl(), crawlerUa, svc.getFlaresolverrMaxTimeoutMs(),
                svc.getFlaresolverrMaxTimeoutMs() + 10_000, timeout(properties, StrategyNames.FLARESOLVERR), objectMapper));
        // an empty proxy url keeps the strategy registered but unavailable
        String proxyUrl = svc.getProxyUrl() == null ? "" : svc.getProxyUrl().trim();
        strategies.add(new BrowserStrategy(StrategyNames.BROWSER_PROXY, crawlerUa, true, proxyUrl,
                browserManager, stealthScript, browserSettings, detector, timeout(properties, StrategyNames.BROWSER_PROXY)));
        strategies.add(new BrowserStrategy(StrategyNames.BROWSER_VISITOR, visitorUa, true, null,
                browserManager, stealthScript, browserSettings, detector, timeout(properties, StrategyNames.BROWSER_VISITOR)));
        strategies.add(new DirectHttpStrategy(StrategyNames.DIRECT_HTTP, crawlerUa, requestTimeout,
                timeout(properties, StrategyNames.DIRECT_HTTP)));
        strategies.add(new DirectHttpStrategy(StrategyNames.DIRECT_HTTP_VISITOR, visitorUa, requestTimeout,
                timeout(properties, StrategyNames.DIRECT_HTTP_VISITOR)));
        return strategies;
    }

    /**
     * Selects the shared cache backend based on {@code fetcher.cache.type}. Supported values:
     * - "memory" (default): process-local cache only
     * - "redis": Redis in front of the local cache when a {@link StringRedisTemplate} is available
     *   and answers PING at startup; falls back to local only otherwise.
     */
    @Bean
    public AcquisitionContext acquisitionContext(FetcherProperties properties,
                                                 BlockDetector detector,
                                                 BrowserManager browserManager,
                                                 ObjectMapper objectMapper,
                                                 InMemoryHtmlStore localHtmlStore,
                                                 ObjectProvider<StringRedisTemplate> redisProvider) {
        List<FetchStrategy> fetchStrategies = buildStrategies(properties, detector, browserManager, objectMapper);
        HtmlStore shared = sharedStore(properties, redisProvider);
        FetcherProperties.Cache cache = properties.getCache();
        Duration ttl = Duration.ofSeconds(Math.max(1, cache.getTtlSeconds()));

        return AcquisitionContext.builder()
                .strategies(Identity.CRAWLER,
                        AcquisitionContext.resolveOrder(properties.getCrawlerStrategies(), fetchStrategies))
                .strategies(Identity.VISITOR,
                        AcquisitionContext.resolveOrder(properties.getVisitorStrategies(), fetchStrategies))
                .cache(Identity.CRAWLER, new ResponseCache(shared, localHtmlStore, cache.getNamespace() + ":crawler", ttl))
                .cache(Identity.VISITOR, new ResponseCache(shared, localHtmlStore, cache.getNamespace() + ":visitor", ttl))
                .detector(detector)
                .minHtmlLength(properties.getMinHtmlLength())
                .build();
    }

    @Bean(destroyMethod = "close")
    public ContentAcquisitionEngine contentAcquisitionEngine(AcquisitionContext acquisitionContext,
                                                             FetcherProperties properties) {
        return new ContentAcquisitionEngine(acquisitionContext, properties.getWorkerCount());
    }

    @Bean
    public SeoMetadataExtractor seoMetadataExtractor() {
        return new SeoMetadataExtractor();
    }

    @Bean
    public CloakingComparator cloakingComparator(FetcherProperties properties) {
        FetcherProperties.Comparison c = properties.getComparison();
        return new CloakingComparator(c.getAbsoluteLineThreshold(), c.getRelativeLineThreshold(),
                c.getMaxElements(), c.isStrict());
    }

    private static HtmlStore sharedStore(FetcherProperties properties, ObjectProvider<StringRedisTemplate> redisProvider) {
        String kind = properties.getCache().getType() == null ? "memory" : properties.getCache().getType().trim().toLowerCase();
        if (!"redis".equals(kind)) {
            log.info("Response cache: memory");
            return null;
        }
        StringRedisTemplate template = redisProvider.getIfAvailable();
        if (template == null) {
            log.warn("Response cache: redis requested but no StringRedisTemplate available, using memory");
            return null;
        }
        RedisHtmlStore store = new RedisHtmlStore(template);
        try {
            if (store.ping()) {
                log.info("Response cache: redis");
                return store;
            }
            log.warn("Response cache: redis did not answer PING, using memory");
        } catch (Exception e) {
            log.warn("Response cache: redis unavailable ({}), using memory", e.getMessage());
        }
        return null;
    }

    private static Duration timeout(FetcherProperties properties, String strategyName) {
        return Duration.ofMillis(Math.max(1, properties.attemptTimeoutMsFor(strategyName)));
    }
}
