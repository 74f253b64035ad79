package org.smileyface.botview.strategy;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.botview.detector.BlockDetector;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.model.StrategyDescriptor;
import org.smileyface.botview.util.UrlUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches the page through the Google translation proxy.
 *
 * <p>The proxy requests the origin from crawler address ranges, so origins that trust those ranges
 * serve their crawler content. Three URL forms are tried in order: the per-host
 * {@code *.translate.goog} form (the only one whose content counts as cloaked provenance), then the
 * legacy {@code /website} and {@code /translate} forms. The translation wrapper is stripped from the
 * accepted document and proxied links are rewritten back to the origin host.</p>
 */
public class TranslateProxyStrategy extends AbstractFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(TranslateProxyStrategy.class);

    static final int MIN_PROXY_HTML_LENGTH = 1000;

    enum Method { TRANSLATE_GOOG, WEBSITE, TRANSLATE }

    private static final List<Pattern> WRAPPER_PATTERNS = List.of(
            Pattern.compile("<script[^>]*src=\"[^\"]*gstatic\\.com/_/translate_http/[^\"]*\"[^>]*></script>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<link[^>]*href=\"[^\"]*gstatic\\.com/_/translate_http/[^\"]*\"[^>]*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<meta http-equiv=\"X-Translated-By\"[^>]*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<meta http-equiv=\"X-Translated-To\"[^>]*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<meta name=\"robots\" content=\"none\">", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<link[^>]*href=\"[^\"]*fonts\\.googleapis\\.com[^\"]*\"[^>]*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<script[^>]*>.*?gtElInit.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("<script id=\"google-translate-element-script\"[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("<div[^>]*id=\"gt-nvframe\"[^>]*>.*?</div>", Pattern.DOTALL),
            Pattern.compile("<div[^>]*class=\"[^\"]*goog-te-[^\"]*\"[^>]*>.*?</div>", Pattern.DOTALL),
            Pattern.compile("<script[^>]*translate\\.google[^>]*>.*?</script>", Pattern.DOTALL));

    private static final Pattern LEGACY_PROXY_LINK =
            Pattern.compile("https?://translate\\.googleusercontent\\.com/translate_c\\?[^\"']*u=([^\"'&]+)");

    private final String hostSuffix;
    private final String websiteUrl;
    private final String legacyUrl;
    private final String targetLang;
    private final String userAgent;
    private final int requestTimeoutMs;
    private final BlockDetector detector;

    public TranslateProxyStrategy(String hostSuffix, String websiteUrl, String legacyUrl, String targetLang,
                                  String userAgent, int requestTimeoutMs, Duration attemptTimeout,
                                  BlockDetector detector) {
        super(StrategyNames.TRANSLATE_PROXY,
                new StrategyDescriptor(EnumSet.of(CapabilityTag.TRUSTED_PROXY), true, attemptTimeout));
        this.hostSuffix = isBlank(hostSuffix) ? "translate.goog" : hostSuffix;
        this.websiteUrl = websiteUrl;
        this.legacyUrl = legacyUrl;
        this.targetLang = isBlank(targetLang) ? "en" : targetLang;
        this.userAgent = userAgent;
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    @Override
    public RawResult fetch(String url) {
        long start = System.nanoTime();
        String lastError = "Translate proxy failed";
        Integer lastStatus = null;
        for (Method method : Method.values()) {
            String proxyUrl = buildProxyUrl(url, method);
            if (proxyUrl == null) continue;
            try {
                log.debug("[TranslateProxy] Trying {} method: {}", method, proxyUrl);
                Connection conn = Jsoup.connect(proxyUrl)
                        .timeout(requestTimeoutMs)
                        .followRedirects(true)
                        .ignoreHttpErrors(true)
                        .ignoreContentType(true)
                        .maxBodySize(0);
                if (!isBlank(userAgent)) conn.userAgent(userAgent);
                Connection.Response res = conn.execute();
                if (res.statusCode() != 200) {
                    lastStatus = res.statusCode();
                    lastError = "Translate proxy " + method + ": HTTP " + res.statusCode();
                    continue;
                }
                String html = res.body();
                if (html.contains("Can't reach this website") || html.contains("Can&#39;t reach this website")) {
                    log.warn("[TranslateProxy] {} - can't reach website", method);
                    lastError = "Translate proxy " + method + ": can't reach website";
                    continue;
                }
                if (detector.isChallenged(html)) {
                    log.warn("[TranslateProxy] {} got a challenge page", method);
                    lastError = "Translate proxy " + method + ": challenge page";
                    continue;
                }
                if (html.length() > MIN_PROXY_HTML_LENGTH && html.toLowerCase(Locale.ROOT).contains("<html")) {
                    String cleaned = cleanTranslatedHtml(html, url);
                    boolean cloaked = method == Method.TRANSLATE_GOOG;
                    return RawResult.fetched(cleaned, 200, elapsedMs(start), url, cloaked);
                }
                lastError = "Translate proxy " + method + ": document too short";
            } catch (IOException e) {
                log.debug("[TranslateProxy] {} failed: {}", method, e.getMessage());
                lastError = "Translate proxy " + method + ": " + e.getMessage();
            }
        }
        return RawResult.failed(FailureKind.TRANSPORT, lastError, lastStatus, null, elapsedMs(start));
    }

    /**
     * Proxy URL for the given method, or null when the target cannot be parsed.
     */
    String buildProxyUrl(String targetUrl, Method method) {
        URI uri;
        try {
            uri = URI.create(targetUrl);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (uri.getHost() == null) return null;

        if (method == Method.TRANSLATE_GOOG) {
            String host = proxiedHostLabel(uri.getHost());
            String path = isBlank(uri.getRawPath()) ? "/" : uri.getRawPath();
            String query = "_x_tr_sl=auto&_x_tr_tl=" + targetLang + "&_x_tr_hl=" + targetLang;
            if (!isBlank(uri.getRawQuery())) {
                query = query + "&" + uri.getRawQuery();
            }
            return "https://" + host + "." + hostSuffix + path + "?" + query;
        }

        String busted = URLEncoder.encode(UrlUtils.withCacheBuster(targetUrl), StandardCharsets.UTF_8);
        if (method == Method.WEBSITE) {
            if (isBlank(websiteUrl)) return null;
            return websiteUrl + "?sl=auto&tl=" + targetLang + "&hl=" + targetLang + "&u=" + busted;
        }
        if (isBlank(legacyUrl)) return null;
        return legacyUrl + "?sl=auto&tl=" + targetLang + "&u=" + busted;
    }

    /**
     * Host label used under the proxy domain: existing hyphens are doubled, then dots become
     * hyphens, so {@code my-site.com} maps to {@code my--site-com}.
     */
    static String proxiedHostLabel(String host) {
        return host.replace("-", "--").replace('.', '-');
    }

    /**
     * Removes the translation UI from a proxied document and points proxied links back to the
     * origin host.
     */
    String cleanTranslatedHtml(String html, String originalUrl) {
        String host = UrlUtils.hostOf(originalUrl);
        String out = html;
        for (Pattern p : WRAPPER_PATTERNS) {
            out = p.matcher(out).replaceAll("");
        }
        if (host != null) {
            String dashed = proxiedHostLabel(host);
            String proxiedHost = Pattern.quote(dashed + "." + hostSuffix);
            out = Pattern.compile("(href|src)=\"https://" + proxiedHost + "([^\"?]*)\\?[^\"]*_x_tr[^\"]*\"")
                    .matcher(out)
                    .replaceAll("$1=\"https://" + Matcher.quoteReplacement(host) + "$2\"");
            out = out.replace(dashed + "." + hostSuffix, host);
        }
        Matcher legacy = LEGACY_PROXY_LINK.matcher(out);
        StringBuilder sb = new StringBuilder();
        while (legacy.find()) {
            legacy.appendReplacement(sb, Matcher.quoteReplacement(legacy.group(1)));
        }
        legacy.appendTail(sb);
        return sb.toString();
    }
}
