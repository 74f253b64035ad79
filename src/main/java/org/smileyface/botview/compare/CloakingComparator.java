package org.smileyface.botview.compare;

import org.smileyface.botview.model.CloakingReport;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares the crawler view of a page with the visitor view and decides whether the differences
 * amount to cloaking.
 *
 * <p>Unless strict, markup that legitimately varies between requests (scripts, comments, noscript
 * blocks, data attributes, id and class attributes) is removed before the line diff. SEO-relevant
 * elements are always taken from the raw documents. Any difference in those elements is
 * cloaking; otherwise a side is suspicious when its unique lines exceed both the absolute and the
 * relative threshold.</p>
 */
public class CloakingComparator {

    public static final int DEFAULT_ABSOLUTE_LINE_THRESHOLD = 50;
    public static final double DEFAULT_RELATIVE_LINE_THRESHOLD = 0.10;
    public static final int DEFAULT_MAX_ELEMENTS = 10;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final List<Pattern> IGNORE_PATTERNS = List.of(
            Pattern.compile("<script[^>]*>.*?</script>", FLAGS),
            Pattern.compile("<!--.*?-->", FLAGS),
            Pattern.compile("<noscript[^>]*>.*?</noscript>", FLAGS),
            Pattern.compile("\\s*data-[a-z-]+=\"[^\"]*\"", FLAGS),
            Pattern.compile("\\s*\\bid=\"[^\"]*\"", FLAGS),
            Pattern.compile("\\s*\\bclass=\"[^\"]*\"", FLAGS));

    // first h1 only, every other pattern collects all matches
    private static final Pattern FIRST_H1 = Pattern.compile("<h1[^>]*>.*?</h1>", FLAGS);
    private static final List<Pattern> SEO_PATTERNS = List.of(
            Pattern.compile("<title[^>]*>.*?</title>", FLAGS),
            Pattern.compile("<meta[^>]*name=[\"']description[\"'][^>]*>", FLAGS),
            Pattern.compile("<meta[^>]*name=[\"']robots[\"'][^>]*>", FLAGS),
            Pattern.compile("<link[^>]*rel=[\"']canonical[\"'][^>]*>", FLAGS),
            Pattern.compile("<link[^>]*rel=[\"']alternate[\"'][^>]*hreflang[^>]*>", FLAGS));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final int absoluteLineThreshold;
    private final double relativeLineThreshold;
    private final int maxElements;
    private final boolean strict;

    public CloakingComparator() {
        this(DEFAULT_ABSOLUTE_LINE_THRESHOLD, DEFAULT_RELATIVE_LINE_THRESHOLD, DEFAULT_MAX_ELEMENTS, false);
    }

    public CloakingComparator(int absoluteLineThreshold, double relativeLineThreshold, int maxElements, boolean strict) {
        if (absoluteLineThreshold < 0 || relativeLineThreshold < 0 || maxElements < 0) {
            throw new IllegalArgumentException("thresholds and maxElements must not be negative");
        }
        this.absoluteLineThreshold = absoluteLineThreshold;
        this.relativeLineThreshold = relativeLineThreshold;
        this.maxElements = maxElements;
        this.strict = strict;
    }

    /**
     * @param crawlerHtml document served to the crawler identity
     * @param visitorHtml document served to the visitor identity
     */
    public CloakingReport compare(String crawlerHtml, String visitorHtml) {
        String a = crawlerHtml == null ? "" : crawlerHtml;
        String b = visitorHtml == null ? "" : visitorHtml;

        List<String> crawlerLines = lines(normalize(a));
        List<String> visitorLines = lines(normalize(b));
        int[] unique = LineDiff.uniqueCounts(crawlerLines, visitorLines);
        int crawlerOnlyLines = unique[0];
        int visitorOnlyLines = unique[1];

        Set<String> crawlerSeo = extractSeoElements(a);
        Set<String> visitorSeo = extractSeoElements(b);
        List<String> crawlerOnlyElements = difference(crawlerSeo, visitorSeo);
        List<String> visitorOnlyElements = difference(visitorSeo, crawlerSeo);

        boolean detected = !crawlerOnlyElements.isEmpty()
                || !visitorOnlyElements.isEmpty()
                || exceeds(crawlerOnlyLines, crawlerLines.size())
                || exceeds(visitorOnlyLines, visitorLines.size());

        return new CloakingReport(detected, crawlerOnlyLines, visitorOnlyLines,
                cap(crawlerOnlyElements), cap(visitorOnlyElements));
    }

    private boolean exceeds(int uniqueLines, int totalLines) {
        return uniqueLines > absoluteLineThreshold && uniqueLines > totalLines * relativeLineThreshold;
    }

    String normalize(String html) {
        if (strict) return html;
        String out = html;
        for (Pattern p : IGNORE_PATTERNS) {
            out = p.matcher(out).replaceAll("");
        }
        return out;
    }

    /**
     * Splits into lines, collapsing runs of whitespace inside each line and dropping blank lines.
     */
    static List<String> lines(String text) {
        List<String> out = new ArrayList<>();
        for (String line : LINE_BREAK.split(text, -1)) {
            String collapsed = WHITESPACE.matcher(line).replaceAll(" ").trim();
            if (!collapsed.isEmpty()) out.add(collapsed);
        }
        return out;
    }

    static Set<String> extractSeoElements(String html) {
        Set<String> elements = new LinkedHashSet<>();
        for (Pattern p : SEO_PATTERNS) {
            Matcher m = p.matcher(html);
            while (m.find()) {
                elements.add(collapse(m.group()));
            }
        }
        Matcher h1 = FIRST_H1.matcher(html);
        if (h1.find()) {
            elements.add(collapse(h1.group()));
        }
        return elements;
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    private static List<String> difference(Set<String> left, Set<String> right) {
        List<String> out = new ArrayList<>();
        for (String s : left) {
            if (!right.contains(s)) out.add(s);
        }
        return out;
    }

    private List<String> cap(List<String> elements) {
        return elements.size() <= maxElements ? elements : elements.subList(0, maxElements);
    }
}
