package org.smileyface.botview.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.botview.cache.ResponseCache;
import org.smileyface.botview.model.CacheEntry;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.Classification;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.FetchOptions;
import org.smileyface.botview.model.FetchOutcome;
import org.smileyface.botview.model.FetchRequest;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.strategy.FetchStrategy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Acquires the HTML a site serves to a given identity by walking an ordered cascade of fetch
 * strategies until one yields genuine content.
 *
 * <p>The cache is consulted first. On a miss, strategies are tried one at a time in configured
 * order; each attempt runs on a bounded worker pool under the strategy's own timeout, and its
 * result is classified by the shared {@link org.smileyface.botview.detector.BlockDetector}. The
 * first clean document longer than the minimum length is cached and returned. Concurrent calls
 * are independent of each other.</p>
 */
public class ContentAcquisitionEngine implements AutoCloseable {

    private static final Logger log = LogManager.getLogger();

    private final AcquisitionContext context;
    private final ExecutorService workers;

    public ContentAcquisitionEngine(AcquisitionContext context, int workerCount) {
        this.context = Objects.requireNonNull(context, "context");
        int n = Math.max(1, workerCount);
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "fetch-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("ContentAcquisitionEngine started with {} workers (crawler strategies={}, visitor strategies={})",
                n, names(Identity.CRAWLER), names(Identity.VISITOR));
    }

    /**
     * @throws IllegalArgumentException when {@code url} is not an absolute http(s) URL
     */
    public FetchOutcome acquire(String url, Identity identity, FetchOptions options) {
        return acquire(new FetchRequest(url, identity, options));
    }

    public FetchOutcome acquire(FetchRequest request) {
        Objects.requireNonNull(request, "request");
        long start = System.nanoTime();
        String url = request.getNormalizedUrl();
        Identity identity = request.getIdentity();
        ResponseCache cache = context.cacheFor(identity);

        Optional<CacheEntry> cached = cache.lookup(url);
        if (cached.isPresent()) {
            log.info("[{}] cache hit for {}", identity, url);
            return FetchOutcome.fromCache(request, cached.get(), elapsedMs(start));
        }

        String lastError = null;
        for (FetchStrategy strategy : context.strategiesFor(identity)) {
            if (Thread.currentThread().isInterrupted()) {
                lastError = "interrupted";
                break;
            }
            String name = strategy.name();
            if (isFilteredOut(strategy, request.getOptions())) {
                log.debug("[{}] {} skipped by request options", identity, name);
                continue;
            }
            if (!isAvailable(strategy)) {
                log.debug("[{}] {} unavailable, skipped", identity, name);
                continue;
            }

            log.info("[{}] trying {} for {}", identity, name, url);
            RawResult result = attempt(strategy, url);

            if (result instanceof RawResult.Fetched fetched) {
                Classification classification = context.getDetector().classify(fetched);
                int length = fetched.body().length();
                // strictly longer than the minimum, so an empty body is never accepted
                if (classification == Classification.SUCCESS && length > context.getMinHtmlLength()) {
                    log.info("[{}] {} accepted: status={}, {} chars in {} ms",
                            identity, name, fetched.status(), length, fetched.elapsedMs());
                    cache.set(url, new CacheEntry(fetched.body(), fetched.cloakedProvenance(), fetched.status()));
                    return FetchOutcome.accepted(request, name, fetched, elapsedMs(start));
                }
                lastError = classification != Classification.SUCCESS
                        ? name + ": " + classification.name().toLowerCase() + statusSuffix(fetched.status())
                        : name + ": html too short (" + length + " chars)";
                log.warn("[{}] {} rejected: {} ({} ms)", identity, name, lastError, fetched.elapsedMs());
            } else {
                RawResult.Failed failed = (RawResult.Failed) result;
                if (failed.kind() == FailureKind.CONFIGURATION) {
                    log.debug("[{}] {} not configured: {}", identity, name, failed.error());
                    continue;
                }
                lastError = name + ": " + failed.error();
                log.warn("[{}] {} failed ({}): {} ({} ms)", identity, name, failed.kind(), failed.error(), failed.elapsedMs());
            }
        }

        FetchOutcome outcome = FetchOutcome.exhausted(request, lastError, elapsedMs(start));
        log.error("[{}] all strategies failed for {}: {}", identity, url, outcome.getError());
        return outcome;
    }

    /**
     * Availability of each configured strategy for the identity, in priority order.
     */
    public Map<String, Boolean> availability(Identity identity) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (FetchStrategy s : context.strategiesFor(identity)) {
            result.put(s.name(), isAvailable(s));
        }
        return result;
    }

    public AcquisitionContext getContext() {
        return context;
    }

    static boolean isFilteredOut(FetchStrategy strategy, FetchOptions options) {
        if (options == null) return false;
        if (options.skipStrategies().contains(strategy.name())) return true;
        if (options.skipTrustedProxy() && strategy.descriptor().hasTag(CapabilityTag.TRUSTED_PROXY)) return true;
        return !options.preferCloakedProvenance() && strategy.descriptor().hasTag(CapabilityTag.PROVENANCE_SERVICE);
    }

    private boolean isAvailable(FetchStrategy strategy) {
        try {
            return strategy.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Availability check of {} failed: {}", strategy.name(), e.getMessage());
            return false;
        }
    }

    private RawResult attempt(FetchStrategy strategy, String url) {
        long start = System.nanoTime();
        long timeoutMs = strategy.descriptor().getAttemptTimeout().toMillis();
        Future<RawResult> future;
        try {
            future = workers.submit(() -> strategy.fetch(url));
        } catch (RuntimeException e) {
            return RawResult.failed(FailureKind.TRANSPORT, "Could not schedule attempt: " + e.getMessage(), elapsedMs(start));
        }
        try {
            RawResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : RawResult.failed(FailureKind.TRANSPORT, "no result", elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            return RawResult.failed(FailureKind.TRANSPORT, "Timed out after " + timeoutMs + " ms", elapsedMs(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return RawResult.failed(FailureKind.TRANSPORT, cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsedMs(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return RawResult.failed(FailureKind.TRANSPORT, "interrupted", elapsedMs(start));
        }
    }

    private String names(Identity identity) {
        return context.strategiesFor(identity).stream().map(FetchStrategy::name).toList().toString();
    }

    private static String statusSuffix(Integer status) {
        return status == null ? "" : " (HTTP " + status + ")";
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        log.info("ContentAcquisitionEngine stopped");
    }
}
