package org.smileyface.botview.cache;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed store shared between service instances.
 *
 * Each document is a plain string value written with SET ... EX, so expiry is handled by Redis.
 * Errors are not caught here; {@link ResponseCache} decides how to degrade.
 */
public class RedisHtmlStore implements HtmlStore {

    private final StringRedisTemplate redis;

    public RedisHtmlStore(StringRedisTemplate redisTemplate) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
    }

    /**
     * Round-trip check used at startup to decide whether Redis is usable.
     */
    public boolean ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping, true);
        return "PONG".equalsIgnoreCase(pong);
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void put(String key, String html, Duration ttl) {
        if (key == null || html == null) return;
        redis.opsForValue().set(key, html, ttl);
    }

    @Override
    public String type() {
        return "redis";
    }
}
