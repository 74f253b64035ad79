package org.smileyface.botview.strategy;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the single long-lived headless Chromium shared by all browser strategies.
 *
 * <p>Playwright objects may only be used from the thread that created them, so every browser
 * operation is submitted to one dedicated thread. The browser is launched lazily on first use;
 * a failed launch is remembered and the browser strategies then report themselves unavailable.</p>
 */
public class BrowserManager implements AutoCloseable {

    private static final Logger log = LogManager.getLogger();

    static final String STEALTH_RESOURCE = "stealth.js";

    private static final List<String> LAUNCH_ARGS = List.of(
            "--disable-blink-features=AutomationControlled",
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1920,1080");

    static final long DEFAULT_LAUNCH_WAIT_MS = 60_000;

    private final boolean headless;
    private final long launchWaitMs;
    private final Supplier<Browser> launcher;
    private final ExecutorService browserThread;

    // confined to browserThread
    private Playwright playwright;
    private Browser browser;

    private volatile boolean launched;
    private volatile boolean launchFailed;
    private volatile boolean closed;

    public BrowserManager(boolean headless) {
        this(headless, DEFAULT_LAUNCH_WAIT_MS);
    }

    /**
     * @param launchWaitMs how long {@link #isAvailable()} waits for the first launch before
     *                     answering false
     */
    public BrowserManager(boolean headless, long launchWaitMs) {
        this(headless, launchWaitMs, null);
    }

    /**
     * @param launcher starts the browser on the browser thread; null launches Chromium through
     *                 Playwright
     */
    BrowserManager(boolean headless, long launchWaitMs, Supplier<Browser> launcher) {
        this.headless = headless;
        this.launchWaitMs = Math.max(1, launchWaitMs);
        this.launcher = launcher != null ? launcher : this::launchChromium;
        this.browserThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "browser-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * True when the browser is running or can still be launched. A launch still in progress
     * after the launch wait counts as unavailable for this call; the launch itself carries on.
     */
    public boolean isAvailable() {
        if (closed || launchFailed) return false;
        if (launched) return true;
        Future<Boolean> check;
        try {
            check = browserThread.submit(() -> ensureBrowser() != null);
        } catch (RejectedExecutionException e) {
            return false;
        }
        try {
            return check.get(launchWaitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            log.warn("Browser launch still running after {} ms, reporting unavailable", launchWaitMs);
            return false;
        } catch (ExecutionException e) {
            log.warn("Browser availability check failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        }
    }

    /**
     * Runs {@code work} on the browser thread with the shared browser and waits for its result.
     * If the caller is interrupted while waiting, the work is cancelled: a queued task never
     * starts and a running one is interrupted.
     *
     * @throws IllegalStateException when the browser cannot be launched or the manager is closed
     * @throws ExecutionException    wrapping anything thrown by {@code work}
     */
    public <T> T execute(Function<Browser, T> work) throws ExecutionException, InterruptedException {
        if (closed) throw new IllegalStateException("Browser manager closed");
        Future<T> future;
        try {
            future = browserThread.submit(() -> {
                Browser b = ensureBrowser();
                if (b == null) {
                    throw new IllegalStateException("Browser not initialized");
                }
                return work.apply(b);
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Browser manager closed", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private Browser ensureBrowser() {
        if (browser != null && browser.isConnected()) return browser;
        if (launchFailed) return null;
        try {
            browser = launcher.get();
            launched = true;
            log.info("Playwright browser initialized (headless={})", headless);
            return browser;
        } catch (RuntimeException e) {
            // driver download or browser launch failure
            launchFailed = true;
            browser = null;
            log.warn("Failed to initialize Playwright: {}", e.getMessage());
            return null;
        }
    }

    private Browser launchChromium() {
        if (playwright == null) {
            playwright = Playwright.create();
        }
        return playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(LAUNCH_ARGS));
    }

    /**
     * Stealth patches injected into every stealth context before any page script runs.
     */
    public static String loadStealthScript() {
        try (InputStream in = BrowserManager.class.getClassLoader().getResourceAsStream(STEALTH_RESOURCE)) {
            if (in == null) {
                log.warn("Classpath resource {} not found, stealth contexts run unpatched", STEALTH_RESOURCE);
                return "";
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read classpath resource {}", STEALTH_RESOURCE, e);
            return "";
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        Future<?> shutdown = browserThread.submit(() -> {
            try {
                if (browser != null) browser.close();
            } catch (PlaywrightException e) {
                log.warn("Error closing browser: {}", e.getMessage());
            }
            try {
                if (playwright != null) playwright.close();
            } catch (PlaywrightException e) {
                log.warn("Error closing Playwright: {}", e.getMessage());
            }
            browser = null;
            playwright = null;
        });
        try {
            shutdown.get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Browser shutdown did not complete cleanly: {}", e.getMessage());
        }
        browserThread.shutdownNow();
        log.info("BrowserManager closed");
    }
}
