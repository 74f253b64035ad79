package org.smileyface.botview.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a fetch strategy: capability tags, whether its channel carries cloaked
 * provenance, and how long a single attempt may take. The priority rank is not part of the
 * descriptor; it is the strategy's position in the configured order.
 */
public final class StrategyDescriptor {

    private final Set<CapabilityTag> tags;
    private final boolean cloakedProvenance;
    private final Duration attemptTimeout;

    public StrategyDescriptor(Set<CapabilityTag> tags, boolean cloakedProvenance, Duration attemptTimeout) {
        this.tags = tags == null || tags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(tags));
        this.cloakedProvenance = cloakedProvenance;
        this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
    }

    public Set<CapabilityTag> getTags() { return tags; }

    public boolean hasTag(CapabilityTag tag) { return tags.contains(tag); }

    public boolean isCloakedProvenance() { return cloakedProvenance; }

    public Duration getAttemptTimeout() { return attemptTimeout; }

    @Override
    public String toString() {
        return "StrategyDescriptor{" +
                "tags=" + tags +
                ", cloakedProvenance=" + cloakedProvenance +
                ", attemptTimeout=" + attemptTimeout +
                '}';
    }
}
