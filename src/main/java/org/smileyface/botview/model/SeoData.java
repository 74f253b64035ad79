package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * SEO fields read from a fetched document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeoData {

    private String title;              // <title>
    private String h1;                 // first <h1> text
    private String description;        // meta description
    private String canonical;          // absolute canonical href
    private String htmlLang;           // <html lang>
    private String robots;             // meta robots
    private List<HreflangEntry> hreflang = new ArrayList<>();
    private List<String> alternateUrls = new ArrayList<>();

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getH1() { return h1; }
    public void setH1(String h1) { this.h1 = h1; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCanonical() { return canonical; }
    public void setCanonical(String canonical) { this.canonical = canonical; }

    public String getHtmlLang() { return htmlLang; }
    public void setHtmlLang(String htmlLang) { this.htmlLang = htmlLang; }

    public String getRobots() { return robots; }
    public void setRobots(String robots) { this.robots = robots; }

    public List<HreflangEntry> getHreflang() { return hreflang; }
    public void setHreflang(List<HreflangEntry> hreflang) {
        this.hreflang = hreflang != null ? new ArrayList<>(hreflang) : new ArrayList<>();
    }

    public List<String> getAlternateUrls() { return alternateUrls; }
    public void setAlternateUrls(List<String> alternateUrls) {
        this.alternateUrls = alternateUrls != null ? new ArrayList<>(alternateUrls) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SeoData{" +
                "title='" + title + '\'' +
                ", h1='" + h1 + '\'' +
                ", canonical='" + canonical + '\'' +
                ", robots='" + robots + '\'' +
                ", hreflang=" + hreflang.size() +
                '}';
    }
}
