package org.smileyface.botview.strategy;

/**
 * Per-context browser settings shared by the browser strategies.
 *
 * @param navigationTimeoutMs     timeout for the initial navigation
 * @param maxChallengeWaitSeconds how long to poll for an interstitial challenge to clear
 * @param networkIdleTimeoutMs    best-effort wait for dynamic content after load
 */
public record BrowserSettings(int viewportWidth,
                              int viewportHeight,
                              String locale,
                              String timezoneId,
                              String proxyTimezoneId,
                              int navigationTimeoutMs,
                              int maxChallengeWaitSeconds,
                              int networkIdleTimeoutMs) {

    public static final int DEFAULT_NETWORK_IDLE_TIMEOUT_MS = 5000;
}
