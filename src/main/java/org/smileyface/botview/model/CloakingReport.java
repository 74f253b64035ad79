package org.smileyface.botview.model;

import java.util.List;

/**
 * Outcome of comparing the crawler view of a page with the visitor view.
 *
 * @param detected           whether the differences are treated as cloaking
 * @param crawlerOnlyLines   normalized lines present only in the crawler document
 * @param visitorOnlyLines   normalized lines present only in the visitor document
 * @param crawlerOnlyElements SEO elements present only in the crawler document (bounded)
 * @param visitorOnlyElements SEO elements present only in the visitor document (bounded)
 */
public record CloakingReport(boolean detected,
                             int crawlerOnlyLines,
                             int visitorOnlyLines,
                             List<String> crawlerOnlyElements,
                             List<String> visitorOnlyElements) {

    public CloakingReport {
        crawlerOnlyElements = crawlerOnlyElements == null ? List.of() : List.copyOf(crawlerOnlyElements);
        visitorOnlyElements = visitorOnlyElements == null ? List.of() : List.copyOf(visitorOnlyElements);
    }
}
