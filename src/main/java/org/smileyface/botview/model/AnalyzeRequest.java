package org.smileyface.botview.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of POST /api/analyze.
 */
public record AnalyzeRequest(String url,
                             @JsonAlias("detect_cloaking") boolean detectCloaking,
                             @JsonAlias("include_html") boolean includeHtml) {
}
