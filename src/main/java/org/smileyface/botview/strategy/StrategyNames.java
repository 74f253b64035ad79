package org.smileyface.botview.strategy;

/**
 * Names under which the built-in strategies are registered and ordered in configuration.
 */
public final class StrategyNames {

    private StrategyNames() {
        // No instanciation
    }

    public static final String AFFILIATE_FM = "affiliate-fm";
    public static final String TRANSLATE_PROXY = "translate-proxy";
    public static final String ZYTE = "zyte";
    public static final String BROWSER_DIRECT = "browser-direct";
    public static final String BROWSER_STEALTH = "browser-stealth";
    public static final String FLARESOLVERR = "flaresolverr";
    public static final String BROWSER_PROXY = "browser-proxy";
    public static final String BROWSER_VISITOR = "browser-visitor";
    public static final String DIRECT_HTTP = "direct-http";
    public static final String DIRECT_HTTP_VISITOR = "direct-http-visitor";
}
