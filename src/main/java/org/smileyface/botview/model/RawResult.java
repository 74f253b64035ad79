package org.smileyface.botview.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single strategy attempt. Either {@link Fetched} (the strategy obtained a body)
 * or {@link Failed} (it did not). A {@code Fetched} result may still turn out to be a challenge
 * page; that decision belongs to the block detector, not to the strategy.
 */
public sealed interface RawResult permits RawResult.Fetched, RawResult.Failed {

    /** HTTP status reported by the origin or the service, if known. */
    Optional<Integer> statusCode();

    /** Body returned by the attempt, if any. Failed attempts may carry an error page body. */
    Optional<String> html();

    long elapsedMs();

    boolean isFetched();

    static Fetched fetched(String html, Integer statusCode, long elapsedMs, String finalUrl, boolean cloakedProvenance) {
        return new Fetched(html, statusCode, elapsedMs, finalUrl, cloakedProvenance);
    }

    static Failed failed(FailureKind kind, String error, long elapsedMs) {
        return new Failed(kind, error, null, null, elapsedMs);
    }

    static Failed failed(FailureKind kind, String error, Integer statusCode, String body, long elapsedMs) {
        return new Failed(kind, error, statusCode, body, elapsedMs);
    }

    /**
     * Attempt produced a document.
     *
     * @param body              raw HTML (never null, may be empty)
     * @param status            HTTP status or null when the technique does not expose one
     * @param elapsedMs         attempt latency
     * @param finalUrl          URL after redirects, or null if unknown
     * @param cloakedProvenance true when the channel is trusted by origins as real crawler traffic
     */
    record Fetched(String body, Integer status, long elapsedMs, String finalUrl, boolean cloakedProvenance)
            implements RawResult {

        public Fetched {
            body = Objects.requireNonNullElse(body, "");
        }

        @Override
        public Optional<Integer> statusCode() { return Optional.ofNullable(status); }

        @Override
        public Optional<String> html() { return Optional.of(body); }

        @Override
        public boolean isFetched() { return true; }
    }

    /**
     * Attempt did not produce usable content.
     *
     * @param kind      failure category
     * @param error     adapter-specific message
     * @param status    HTTP status if one was received
     * @param body      error page body if one was received
     * @param elapsedMs attempt latency
     */
    record Failed(FailureKind kind, String error, Integer status, String body, long elapsedMs)
            implements RawResult {

        public Failed {
            Objects.requireNonNull(kind, "kind");
            error = Objects.requireNonNullElse(error, kind.name().toLowerCase());
        }

        @Override
        public Optional<Integer> statusCode() { return Optional.ofNullable(status); }

        @Override
        public Optional<String> html() { return Optional.ofNullable(body); }

        @Override
        public boolean isFetched() { return false; }
    }
}
