package org.smileyface.botview.model;

/**
 * Who the request pretends to be when content is acquired.
 */
public enum Identity {
    /** Request context built to resemble an automated search-engine crawler. */
    CRAWLER,

    /** Request context resembling an ordinary browser user. */
    VISITOR;

    /**
     * Maps the public API mode ("bot" / "user") to an identity. A missing mode means the crawler.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Identity fromMode(String mode) {
        if (mode == null || mode.isBlank()) return CRAWLER;
        return switch (mode.trim().toLowerCase()) {
            case "bot" -> CRAWLER;
            case "user" -> VISITOR;
            default -> throw new IllegalArgumentException("Unsupported mode '" + mode + "', expected bot or user");
        };
    }

    /** Inverse of {@link #fromMode(String)}. */
    public String mode() {
        return this == VISITOR ? "user" : "bot";
    }
}
