package org.smileyface.botview.model;

/**
 * Why an attempt, or a whole acquisition, did not yield content.
 */
public enum FailureKind {
    /** Strategy not configured or its health check failed. Skipped, never counted as a failure. */
    CONFIGURATION,

    /** Network failure, unexpected service response or attempt timeout. */
    TRANSPORT,

    /** Content was classified as blocked/challenged, or too short to be a real page. */
    BLOCKED,

    /** Every strategy failed or was unavailable. Terminal. */
    EXHAUSTION
}
