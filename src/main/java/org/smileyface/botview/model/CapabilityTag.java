package org.smileyface.botview.model;

/**
 * Capability tags attached to a fetch strategy. Request options filter strategies by tag.
 */
public enum CapabilityTag {
    /** Paid service routing through IPs origin servers trust as genuine crawler traffic. */
    PROVENANCE_SERVICE,

    /** Free proxy technique (translation front-end) fetching from crawler-owned IP ranges. */
    TRUSTED_PROXY,

    /** Remote browser rendering service. */
    MANAGED_RENDERING,

    /** In-process browser automation. */
    BROWSER,

    /** Browser fingerprint patches applied before navigation. */
    STEALTH,

    /** Remote challenge-solving service. */
    CHALLENGE_SOLVER,

    /** Traffic leaves through a configured upstream proxy. */
    UPSTREAM_PROXY,

    /** Plain HTTP client, no JavaScript. */
    PLAIN_HTTP
}
