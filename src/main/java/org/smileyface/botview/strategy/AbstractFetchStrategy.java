package org.smileyface.botview.strategy;

import org.smileyface.botview.model.StrategyDescriptor;

import java.util.Objects;

/**
 * Holds the name and descriptor shared by all concrete strategies.
 */
public abstract class AbstractFetchStrategy implements FetchStrategy {

    private final String name;
    private final StrategyDescriptor descriptor;

    protected AbstractFetchStrategy(String name, StrategyDescriptor descriptor) {
        this.name = Objects.requireNonNull(name, "name");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StrategyDescriptor descriptor() {
        return descriptor;
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return name + descriptor;
    }
}
