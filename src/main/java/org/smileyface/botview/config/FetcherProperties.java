package org.smileyface.botview.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for content acquisition, caching and comparison.
 */
@ConfigurationProperties(prefix = "fetcher")
public class FetcherProperties {

    private static final Logger log = LogManager.getLogger(FetcherProperties.class);

    static final String DEFAULTS_RESOURCE = "FetcherConfig.json";

    /** Googlebot smartphone signature. */
    private String crawlerUserAgent =
            "Mozilla/5.0 (Linux; Android 6.0.1; Nexus 5X Build/MMB29P) "
                    + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.6167.184 Mobile Safari/537.36 "
                    + "(compatible; Googlebot/2.1; +http://www.google.com/bot.html)";

    /** Regular desktop Chrome signature. */
    private String visitorUserAgent =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
                    + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    /** Network timeout for a single HTTP call or page navigation, in milliseconds. */
    private int requestTimeoutMs = 30000;

    /** Default upper bound for one strategy attempt, in milliseconds. */
    private int attemptTimeoutMs = 90000;

    /** Per-strategy overrides of {@link #attemptTimeoutMs}, keyed by strategy name. */
    private Map<String, Integer> attemptTimeouts = new HashMap<>();

    /** How long a browser strategy waits for an interstitial challenge to clear, in seconds. */
    private int maxChallengeWaitSeconds = 20;

    /** Accepted documents must be at least this many characters long. */
    private int minHtmlLength = 500;

    /** Size of the worker pool running strategy attempts. */
    private int workerCount = 16;

    /** Strategy names, in priority order, for crawler-identity requests. */
    private List<String> crawlerStrategies = new ArrayList<>();

    /** Strategy names, in priority order, for visitor-identity requests. */
    private List<String> visitorStrategies = new ArrayList<>();

    /** Lower-case body fragments identifying interstitial challenge pages. */
    private List<String> challengeSignatures = new ArrayList<>();

    /** Page titles identifying an error or block page. */
    private List<String> blockingTitles = new ArrayList<>();

    /** Page titles identifying a challenge interstitial. */
    private List<String> challengeTitles = new ArrayList<>();

    private Cache cache = new Cache();
    private Comparison comparison = new Comparison();
    private Services services = new Services();
    private Browser browser = new Browser();

    /**
     * Loads default values from classpath resource FetcherConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public FetcherProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper();
                FetcherConfig cfg = mapper.readValue(in, FetcherConfig.class);
                apply(cfg);
            }
        } catch (Exception e) {
            // Keep defaults when file missing or malformed; do not fail application startup
            log.error("Failed to load default fetcher configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    private void apply(FetcherConfig cfg) {
        if (cfg.crawlerUserAgent != null && !cfg.crawlerUserAgent.isBlank()) this.crawlerUserAgent = cfg.crawlerUserAgent;
        if (cfg.visitorUserAgent != null && !cfg.visitorUserAgent.isBlank()) this.visitorUserAgent = cfg.visitorUserAgent;
        if (cfg.requestTimeoutMs != null && cfg.requestTimeoutMs > 0) this.requestTimeoutMs = cfg.requestTimeoutMs;
        if (cfg.attemptTimeoutMs != null && cfg.attemptTimeoutMs > 0) this.attemptTimeoutMs = cfg.attemptTimeoutMs;
        if (cfg.attemptTimeouts != null) this.attemptTimeouts = new HashMap<>(cfg.attemptTimeouts);
        if (cfg.maxChallengeWaitSeconds != null && cfg.maxChallengeWaitSeconds >= 0) this.maxChallengeWaitSeconds = cfg.maxChallengeWaitSeconds;
        if (cfg.minHtmlLength != null && cfg.minHtmlLength >= 0) this.minHtmlLength = cfg.minHtmlLength;
        if (cfg.workerCount != null && cfg.workerCount > 0) this.workerCount = cfg.workerCount;
        if (cfg.crawlerStrategies != null) this.crawlerStrategies = new ArrayList<>(cfg.crawlerStrategies);
        if (cfg.visitorStrategies != null) this.visitorStrategies = new ArrayList<>(cfg.visitorStrategies);
        if (cfg.challengeSignatures != null) this.challengeSignatures = new ArrayList<>(cfg.challengeSignatures);
        if (cfg.blockingTitles != null) this.blockingTitles = new ArrayList<>(cfg.blockingTitles);
        if (cfg.challengeTitles != null) this.challengeTitles = new ArrayList<>(cfg.challengeTitles);
        if (cfg.cacheTtlSeconds != null && cfg.cacheTtlSeconds > 0) this.cache.setTtlSeconds(cfg.cacheTtlSeconds);
        if (cfg.cacheLocalMaxEntries != null && cfg.cacheLocalMaxEntries > 0) this.cache.setLocalMaxEntries(cfg.cacheLocalMaxEntries);
        if (cfg.comparison != null) this.comparison = cfg.comparison;
    }

    /**
     * Timeout for one attempt of the named strategy: the per-strategy override when present,
     * the global default otherwise.
     */
    public int attemptTimeoutMsFor(String strategyName) {
        Integer override = attemptTimeouts.get(strategyName);
        return (override != null && override > 0) ? override : attemptTimeoutMs;
    }

    public String getCrawlerUserAgent() { return crawlerUserAgent; }
    public void setCrawlerUserAgent(String crawlerUserAgent) { this.crawlerUserAgent = crawlerUserAgent; }

    public String getVisitorUserAgent() { return visitorUserAgent; }
    public void setVisitorUserAgent(String visitorUserAgent) { this.visitorUserAgent = visitorUserAgent; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getAttemptTimeoutMs() { return attemptTimeoutMs; }
    public void setAttemptTimeoutMs(int attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

    public Map<String, Integer> getAttemptTimeouts() { return attemptTimeouts; }
    public void setAttemptTimeouts(Map<String, Integer> attemptTimeouts) {
        this.attemptTimeouts = attemptTimeouts != null ? attemptTimeouts : new HashMap<>();
    }

    public int getMaxChallengeWaitSeconds() { return maxChallengeWaitSeconds; }
    public void setMaxChallengeWaitSeconds(int maxChallengeWaitSeconds) { this.maxChallengeWaitSeconds = maxChallengeWaitSeconds; }

    public int getMinHtmlLength() { return minHtmlLength; }
    public void setMinHtmlLength(int minHtmlLength) { this.minHtmlLength = Math.max(0, minHtmlLength); }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public List<String> getCrawlerStrategies() { return crawlerStrategies; }
    public void setCrawlerStrategies(List<String> crawlerStrategies) {
        this.crawlerStrategies = crawlerStrategies != null ? crawlerStrategies : new ArrayList<>();
    }

    public List<String> getVisitorStrategies() { return visitorStrategies; }
    public void setVisitorStrategies(List<String> visitorStrategies) {
        this.visitorStrategies = visitorStrategies != null ? visitorStrategies : new ArrayList<>();
    }

    public List<String> getChallengeSignatures() { return challengeSignatures; }
    public void setChallengeSignatures(List<String> challengeSignatures) {
        this.challengeSignatures = challengeSignatures != null ? challengeSignatures : new ArrayList<>();
    }

    public List<String> getBlockingTitles() { return blockingTitles; }
    public void setBlockingTitles(List<String> blockingTitles) {
        this.blockingTitles = blockingTitles != null ? blockingTitles : new ArrayList<>();
    }

    public List<String> getChallengeTitles() { return challengeTitles; }
    public void setChallengeTitles(List<String> challengeTitles) {
        this.challengeTitles = challengeTitles != null ? challengeTitles : new ArrayList<>();
    }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache != null ? cache : new Cache(); }

    public Comparison getComparison() { return comparison; }
    public void setComparison(Comparison comparison) { this.comparison = comparison != null ? comparison : new Comparison(); }

    public Services getServices() { return services; }
    public void setServices(Services services) { this.services = services != null ? services : new Services(); }

    public Browser getBrowser() { return browser; }
    public void setBrowser(Browser browser) { this.browser = browser != null ? browser : new Browser(); }

    // --------- Nested groups ---------

    public static class Cache {
        /** "memory" (default) or "redis". Redis falls back to memory when unreachable. */
        private String type = "memory";
        private long ttlSeconds = 3600;
        /** Key prefix in the shared store. */
        private String namespace = "seo:html";
        /** Upper bound on documents held in process memory. */
        private long localMaxEntries = 1000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? "seo:html" : namespace;
        }

        public long getLocalMaxEntries() { return localMaxEntries; }
        public void setLocalMaxEntries(long localMaxEntries) { this.localMaxEntries = Math.max(1, localMaxEntries); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Comparison {
        private int absoluteLineThreshold = 50;
        private double relativeLineThreshold = 0.10;
        private int maxElements = 10;
        private boolean strict = false;

        public int getAbsoluteLineThreshold() { return absoluteLineThreshold; }
        public void setAbsoluteLineThreshold(int absoluteLineThreshold) { this.absoluteLineThreshold = absoluteLineThreshold; }

        public double getRelativeLineThreshold() { return relativeLineThreshold; }
        public void setRelativeLineThreshold(double relativeLineThreshold) { this.relativeLineThreshold = relativeLineThreshold; }

        public int getMaxElements() { return maxElements; }
        public void setMaxElements(int maxElements) { this.maxElements = maxElements; }

        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
    }

    public static class Services {
        private String affiliateFmToken;
        private String affiliateFmBaseUrl = "https://api.affiliate.fm";
        private String affiliateFmLang = "en";
        private String zyteApiKey;
        private String zyteEndpoint = "https://api.zyte.com/v1/extract";
        /** FlareSolverr v1 endpoint, e.g. http://localhost:8191/v1. */
        private String flaresolverrUrl;
        private int flaresolverrMaxTimeoutMs = 120000;
        /** Upstream proxy for the proxied browser strategy. */
        private String proxyUrl;
        private String translateHostSuffix = "translate.goog";
        private String translateWebsiteUrl = "https://translate.google.com/website";
        private String translateLegacyUrl = "https://translate.google.com/translate";
        private String translateTargetLang = "en";

        public String getAffiliateFmToken() { return affiliateFmToken; }
        public void setAffiliateFmToken(String affiliateFmToken) { this.affiliateFmToken = affiliateFmToken; }

        public String getAffiliateFmBaseUrl() { return affiliateFmBaseUrl; }
        public void setAffiliateFmBaseUrl(String affiliateFmBaseUrl) { this.affiliateFmBaseUrl = affiliateFmBaseUrl; }

        public String getAffiliateFmLang() { return affiliateFmLang; }
        public void setAffiliateFmLang(String affiliateFmLang) { this.affiliateFmLang = affiliateFmLang; }

        public String getZyteApiKey() { return zyteApiKey; }
        public void setZyteApiKey(String zyteApiKey) { this.zyteApiKey = zyteApiKey; }

        public String getZyteEndpoint() { return zyteEndpoint; }
        public void setZyteEndpoint(String zyteEndpoint) { this.zyteEndpoint = zyteEndpoint; }

        public String getFlaresolverrUrl() { return flaresolverrUrl; }
        public void setFlaresolverrUrl(String flaresolverrUrl) { this.flaresolverrUrl = flaresolverrUrl; }

        public int getFlaresolverrMaxTimeoutMs() { return flaresolverrMaxTimeoutMs; }
        public void setFlaresolverrMaxTimeoutMs(int flaresolverrMaxTimeoutMs) { this.flaresolverrMaxTimeoutMs = flaresolverrMaxTimeoutMs; }

        public String getProxyUrl() { return proxyUrl; }
        public void setProxyUrl(String proxyUrl) { this.proxyUrl = proxyUrl; }

        public String getTranslateHostSuffix() { return translateHostSuffix; }
        public void setTranslateHostSuffix(String translateHostSuffix) { this.translateHostSuffix = translateHostSuffix; }

        public String getTranslateWebsiteUrl() { return translateWebsiteUrl; }
        public void setTranslateWebsiteUrl(String translateWebsiteUrl) { this.translateWebsiteUrl = translateWebsiteUrl; }

        public String getTranslateLegacyUrl() { return translateLegacyUrl; }
        public void setTranslateLegacyUrl(String translateLegacyUrl) { this.translateLegacyUrl = translateLegacyUrl; }

        public String getTranslateTargetLang() { return translateTargetLang; }
        public void setTranslateTargetLang(String translateTargetLang) { this.translateTargetLang = translateTargetLang; }
    }

    public static class Browser {
        private boolean headless = true;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        private String locale = "en-US";
        private String timezoneId = "America/New_York";
        private String proxyTimezoneId = "Europe/Prague";

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }

        public int getViewportWidth() { return viewportWidth; }
        public void setViewportWidth(int viewportWidth) { this.viewportWidth = viewportWidth; }

        public int getViewportHeight() { return viewportHeight; }
        public void setViewportHeight(int viewportHeight) { this.viewportHeight = viewportHeight; }

        public String getLocale() { return locale; }
        public void setLocale(String locale) { this.locale = locale; }

        public String getTimezoneId() { return timezoneId; }
        public void setTimezoneId(String timezoneId) { this.timezoneId = timezoneId; }

        public String getProxyTimezoneId() { return proxyTimezoneId; }
        public void setProxyTimezoneId(String proxyTimezoneId) { this.proxyTimezoneId = proxyTimezoneId; }
    }

    // --------- Nested config DTO for JSON mapping ---------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FetcherConfig {
        public String crawlerUserAgent;
        public String visitorUserAgent;
        public Integer requestTimeoutMs;
        public Integer attemptTimeoutMs;
        public Map<String, Integer> attemptTimeouts;
        public Integer maxChallengeWaitSeconds;
        public Integer minHtmlLength;
        public Integer workerCount;
        public List<String> crawlerStrategies;
        public List<String> visitorStrategies;
        public List<String> challengeSignatures;
        public List<String> blockingTitles;
        public List<String> challengeTitles;
        public Long cacheTtlSeconds;
        public Long cacheLocalMaxEntries;
        public Comparison comparison;
    }
}
