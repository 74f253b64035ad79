package org.smileyface.botview.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-local store backed by a bounded Caffeine cache.
 * Each entry expires after the ttl it was written with; the least recently used entries are
 * evicted once {@code maximumSize} is reached.
 */
public class InMemoryHtmlStore implements HtmlStore {

    public static final long DEFAULT_MAXIMUM_SIZE = 1000;

    private final Cache<String, Stored> entries;

    public InMemoryHtmlStore() {
        this(Clock.systemUTC(), DEFAULT_MAXIMUM_SIZE);
    }

    public InMemoryHtmlStore(Clock clock) {
        this(clock, DEFAULT_MAXIMUM_SIZE);
    }

    public InMemoryHtmlStore(Clock clock, long maximumSize) {
        Objects.requireNonNull(clock, "clock");
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        long origin = clock.millis();
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new TtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis() - origin))
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) return Optional.empty();
        Stored stored = entries.getIfPresent(key);
        return stored == null ? Optional.empty() : Optional.of(stored.html());
    }

    @Override
    public void put(String key, String html, Duration ttl) {
        if (key == null || html == null) return;
        entries.put(key, new Stored(html, Objects.requireNonNull(ttl, "ttl")));
    }

    @Override
    public String type() {
        return "memory";
    }

    /** Number of live entries, after pending expirations and evictions have run. */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    private record Stored(String html, Duration ttl) {
    }

    private static final class TtlExpiry implements Expiry<String, Stored> {

        @Override
        public long expireAfterCreate(String key, Stored value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Stored value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Stored value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
