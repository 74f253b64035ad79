package org.smileyface.botview.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.botview.cache.ResponseCache;
import org.smileyface.botview.detector.BlockDetector;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.strategy.FetchStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the acquisition engine needs, built once at startup: the ordered strategy list and
 * the cache for each identity, the shared block detector and the acceptance threshold.
 */
public final class AcquisitionContext {

    private static final Logger log = LogManager.getLogger();

    public static final int DEFAULT_MIN_HTML_LENGTH = 500;

    private final Map<Identity, List<FetchStrategy>> strategies;
    private final Map<Identity, ResponseCache> caches;
    private final BlockDetector detector;
    private final int minHtmlLength;

    private AcquisitionContext(Builder b) {
        this.strategies = new EnumMap<>(Identity.class);
        this.caches = new EnumMap<>(Identity.class);
        for (Identity identity : Identity.values()) {
            this.strategies.put(identity, List.copyOf(b.strategies.getOrDefault(identity, List.of())));
            ResponseCache cache = b.caches.get(identity);
            if (cache == null) {
                throw new IllegalArgumentException("No response cache configured for identity " + identity);
            }
            this.caches.put(identity, cache);
        }
        this.detector = b.detector != null ? b.detector : new BlockDetector();
        this.minHtmlLength = Math.max(0, b.minHtmlLength);
    }

    /**
     * Strategies for the identity in priority order (index 0 is tried first).
     */
    public List<FetchStrategy> strategiesFor(Identity identity) {
        return strategies.get(identity);
    }

    public ResponseCache cacheFor(Identity identity) {
        return caches.get(identity);
    }

    public BlockDetector getDetector() {
        return detector;
    }

    public int getMinHtmlLength() {
        return minHtmlLength;
    }

    /**
     * Resolves configured strategy names against the registered strategies, keeping the
     * configured order. Unknown names are logged and ignored; a repeated name is kept once.
     */
    public static List<FetchStrategy> resolveOrder(List<String> names, Collection<? extends FetchStrategy> registered) {
        Map<String, FetchStrategy> byName = new LinkedHashMap<>();
        for (FetchStrategy s : registered) {
            byName.put(s.name(), s);
        }
        List<FetchStrategy> ordered = new ArrayList<>();
        if (names == null) return ordered;
        for (String raw : names) {
            String name = raw == null ? "" : raw.trim();
            FetchStrategy s = byName.get(name);
            if (s == null) {
                log.warn("Unknown fetch strategy '{}' in configuration, ignoring", raw);
            } else if (!ordered.contains(s)) {
                ordered.add(s);
            }
        }
        return ordered;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Identity, List<FetchStrategy>> strategies = new EnumMap<>(Identity.class);
        private final Map<Identity, ResponseCache> caches = new EnumMap<>(Identity.class);
        private BlockDetector detector;
        private int minHtmlLength = DEFAULT_MIN_HTML_LENGTH;

        private Builder() {
        }

        public Builder strategies(Identity identity, List<? extends FetchStrategy> ordered) {
            strategies.put(Objects.requireNonNull(identity, "identity"), new ArrayList<>(ordered));
            return this;
        }

        public Builder cache(Identity identity, ResponseCache cache) {
            caches.put(Objects.requireNonNull(identity, "identity"), Objects.requireNonNull(cache, "cache"));
            return this;
        }

        public Builder detector(BlockDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder minHtmlLength(int minHtmlLength) {
            this.minHtmlLength = minHtmlLength;
            return this;
        }

        public AcquisitionContext build() {
            return new AcquisitionContext(this);
        }
    }
}
