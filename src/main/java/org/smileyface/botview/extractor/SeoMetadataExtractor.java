package org.smileyface.botview.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.botview.model.HreflangEntry;
import org.smileyface.botview.model.SeoData;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts SEO-relevant metadata (title, first h1, meta description/robots, canonical, html lang,
 * hreflang alternates) from an HTML document.
 */
public final class SeoMetadataExtractor {

    /**
     * Parses the HTML and collects the metadata fields. Relative canonical and alternate links are
     * resolved against {@code baseUrl} when one is given.
     *
     * @param html    the HTML content (may be null/blank, yielding an empty {@link SeoData})
     * @param baseUrl the URL the document was fetched from (may be null)
     */
    public SeoData extract(String html, String baseUrl) {
        SeoData data = new SeoData();
        if (html == null || html.isBlank()) {
            return data;
        }
        Document doc = baseUrl == null ? Jsoup.parse(html) : Jsoup.parse(html, baseUrl);

        Element title = doc.selectFirst("title");
        if (title != null) data.setTitle(emptyToNull(title.text()));

        Element h1 = doc.selectFirst("h1");
        if (h1 != null) data.setH1(emptyToNull(h1.text()));

        data.setDescription(metaContent(doc, "description"));
        data.setRobots(metaContent(doc, "robots"));

        Element canonical = doc.selectFirst("link[rel=canonical][href]");
        if (canonical != null) data.setCanonical(href(canonical));

        Element htmlTag = doc.selectFirst("html");
        if (htmlTag != null && htmlTag.hasAttr("lang")) data.setHtmlLang(emptyToNull(htmlTag.attr("lang")));

        List<HreflangEntry> hreflang = new ArrayList<>();
        List<String> alternates = new ArrayList<>();
        for (Element link : doc.select("link[rel=alternate][href]")) {
            String href = href(link);
            if (href == null) continue;
            if (link.hasAttr("hreflang")) {
                hreflang.add(new HreflangEntry(link.attr("hreflang"), href));
                continue;
            }
            String type = link.attr("type").toLowerCase(Locale.ROOT);
            // feeds are not alternate versions of the page
            if (!type.contains("rss") && !type.contains("atom")) {
                alternates.add(href);
            }
        }
        data.setHreflang(hreflang);
        data.setAlternateUrls(alternates);
        return data;
    }

    private static String metaContent(Document doc, String name) {
        for (Element meta : doc.select("meta[name][content]")) {
            if (name.equalsIgnoreCase(meta.attr("name").trim())) {
                return emptyToNull(meta.attr("content"));
            }
        }
        return null;
    }

    private static String href(Element link) {
        String abs = link.absUrl("href");
        return emptyToNull(abs.isEmpty() ? link.attr("href") : abs);
    }

    private static String emptyToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
