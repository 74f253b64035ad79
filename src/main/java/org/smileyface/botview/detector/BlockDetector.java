package org.smileyface.botview.detector;

import org.smileyface.botview.model.Classification;
import org.smileyface.botview.model.RawResult;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a fetched document is real content or a denial/challenge page.
 * Stateless and thread-safe; one instance is shared by the engine and the browser strategies.
 */
public class BlockDetector {

    public static final Set<Integer> BLOCKED_STATUSES = Set.of(401, 403, 429, 503);

    public static final List<String> DEFAULT_CHALLENGE_SIGNATURES = List.of(
            "just a moment",
            "checking your browser",
            "please wait",
            "ddos protection",
            "ray id",
            "cf-browser-verification",
            "challenge-running",
            "_cf_chl",
            "cdn-cgi/challenge");

    public static final List<String> DEFAULT_BLOCKING_TITLES = List.of(
            "403 forbidden",
            "access denied",
            "blocked",
            "error");

    public static final List<String> DEFAULT_CHALLENGE_TITLES = List.of("just a moment");

    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final List<String> challengeSignatures;
    private final List<String> blockingTitles;
    private final List<String> challengeTitles;

    public BlockDetector() {
        this(DEFAULT_CHALLENGE_SIGNATURES, DEFAULT_BLOCKING_TITLES, DEFAULT_CHALLENGE_TITLES);
    }

    public BlockDetector(List<String> challengeSignatures, List<String> blockingTitles, List<String> challengeTitles) {
        this.challengeSignatures = lowerCased(challengeSignatures, DEFAULT_CHALLENGE_SIGNATURES);
        this.blockingTitles = lowerCased(blockingTitles, DEFAULT_BLOCKING_TITLES);
        this.challengeTitles = lowerCased(challengeTitles, DEFAULT_CHALLENGE_TITLES);
    }

    /**
     * Classifies a strategy result. A status in {@link #BLOCKED_STATUSES} is decisive regardless
     * of body; otherwise the body is inspected for challenge signatures and then for a blocking
     * page title.
     */
    public Classification classify(RawResult result) {
        if (result == null) {
            return Classification.BLOCKED;
        }
        Integer status = result.statusCode().orElse(null);
        return classify(status, result.html().orElse(""));
    }

    public Classification classify(Integer status, String html) {
        if (status != null && BLOCKED_STATUSES.contains(status)) {
            return Classification.BLOCKED;
        }
        String body = html == null ? "" : html.toLowerCase(Locale.ROOT);
        for (String signature : challengeSignatures) {
            if (body.contains(signature)) {
                return Classification.CHALLENGED;
            }
        }
        String title = extractTitle(body);
        if (title != null) {
            if (challengeTitles.contains(title)) {
                return Classification.CHALLENGED;
            }
            if (blockingTitles.contains(title)) {
                return Classification.BLOCKED;
            }
        }
        return Classification.SUCCESS;
    }

    /** Shortcut used by the browser challenge-wait loop. */
    public boolean isChallenged(String html) {
        return classify(null, html) == Classification.CHALLENGED;
    }

    static String extractTitle(String lowerCaseHtml) {
        Matcher m = TITLE.matcher(lowerCaseHtml);
        if (!m.find()) return null;
        return m.group(1).replaceAll("\\s+", " ").trim();
    }

    private static List<String> lowerCased(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) return fallback;
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
