package org.smileyface.botview.model;

import java.util.Set;

/**
 * Per-request switches for the acquisition cascade.
 *
 * @param skipTrustedProxy        skip strategies tagged {@link CapabilityTag#TRUSTED_PROXY}
 * @param preferCloakedProvenance when false, strategies tagged {@link CapabilityTag#PROVENANCE_SERVICE} are skipped
 * @param skipStrategies          strategy names to skip for this request
 */
public record FetchOptions(boolean skipTrustedProxy, boolean preferCloakedProvenance, Set<String> skipStrategies) {

    public FetchOptions {
        skipStrategies = skipStrategies == null ? Set.of() : Set.copyOf(skipStrategies);
    }

    public FetchOptions(boolean skipTrustedProxy, boolean preferCloakedProvenance) {
        this(skipTrustedProxy, preferCloakedProvenance, Set.of());
    }

    public static FetchOptions defaults() {
        return new FetchOptions(false, true, Set.of());
    }
}
