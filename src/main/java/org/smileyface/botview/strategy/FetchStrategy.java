package org.smileyface.botview.strategy;

import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.model.StrategyDescriptor;

/**
 * One content-acquisition technique behind a uniform contract.
 *
 * Implementations must not throw from {@link #fetch(String)}: every failure is reported as a
 * {@link RawResult.Failed}. Implementations are shared between concurrent acquisitions and must be
 * thread-safe.
 */
public interface FetchStrategy {

    /**
     * Stable identifier, used in configuration, logs and the outcome's strategy field.
     */
    String name();

    StrategyDescriptor descriptor();

    /**
     * Evaluated before every attempt. An unavailable strategy is skipped without counting as a
     * failed attempt (missing credentials, failed health check).
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Fetch the document at {@code url}.
     * @param url normalized absolute http(s) URL
     */
    RawResult fetch(String url);
}
