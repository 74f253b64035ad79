package org.smileyface.botview.compare;

import org.junit.jupiter.api.Test;
import org.smileyface.botview.model.CloakingReport;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CloakingComparatorTest {

    private final CloakingComparator comparator = new CloakingComparator();

    private static String doc(String head, String body) {
        return "<!doctype html>\n<html>\n<head>\n" + head + "\n</head>\n<body>\n" + body + "\n</body>\n</html>";
    }

    private static String paragraphs(String prefix, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append("<p>").append(prefix).append(' ').append(i).append("</p>\n");
        }
        return sb.toString();
    }

    @Test
    void identicalDocuments_areNotCloaking() {
        String html = doc("<title>Same</title>", paragraphs("line", 100));

        CloakingReport report = comparator.compare(html, html);

        assertThat(report.detected()).isFalse();
        assertThat(report.crawlerOnlyLines()).isZero();
        assertThat(report.visitorOnlyLines()).isZero();
        assertThat(report.crawlerOnlyElements()).isEmpty();
        assertThat(report.visitorOnlyElements()).isEmpty();
    }

    @Test
    void volatileMarkup_isIgnoredUnlessStrict() {
        String crawler = doc("<title>T</title>\n<script>var nonce='abc';</script>",
                "<div id=\"a1\" class=\"x\" data-ts=\"1\">Hello</div>\n<!-- build 1 -->");
        String visitor = doc("<title>T</title>\n<script>var nonce='xyz';</script>",
                "<div id=\"b2\" class=\"y\" data-ts=\"2\">Hello</div>\n<!-- build 2 -->");

        CloakingReport lenient = comparator.compare(crawler, visitor);
        CloakingReport strict = new CloakingComparator(50, 0.10, 10, true).compare(crawler, visitor);

        assertThat(lenient.crawlerOnlyLines()).isZero();
        assertThat(lenient.visitorOnlyLines()).isZero();
        assertThat(strict.crawlerOnlyLines()).isEqualTo(3);
        assertThat(strict.detected()).isFalse();
    }

    @Test
    void whitespaceDifferencesWithinLines_areIgnored() {
        String crawler = doc("<title>T</title>", "<p>Hello    world</p>\n\n\n");
        String visitor = doc("<title>T</title>", "   <p>Hello world</p>");

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.crawlerOnlyLines()).isZero();
        assertThat(report.visitorOnlyLines()).isZero();
    }

    @Test
    void differentTitle_isCloakingEvenWithFewLineChanges() {
        String crawler = doc("<title>Cheap Pills Best Prices</title>", paragraphs("same", 20));
        String visitor = doc("<title>Welcome to our shop</title>", paragraphs("same", 20));

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.detected()).isTrue();
        assertThat(report.crawlerOnlyElements()).containsExactly("<title>Cheap Pills Best Prices</title>");
        assertThat(report.visitorOnlyElements()).containsExactly("<title>Welcome to our shop</title>");
    }

    @Test
    void seoElementsFromRawDocument_includeThoseWithIdOrClass() {
        String crawler = doc("<title>T</title>\n<link rel=\"canonical\" href=\"https://a.example/\">", "<h1 class=\"big\">Main</h1>");
        String visitor = doc("<title>T</title>\n<link rel=\"canonical\" href=\"https://b.example/\">", "<h1 class=\"big\">Main</h1>");

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.detected()).isTrue();
        assertThat(report.crawlerOnlyElements()).containsExactly("<link rel=\"canonical\" href=\"https://a.example/\">");
    }

    @Test
    void onlyFirstH1_isCompared() {
        String crawler = doc("<title>T</title>", "<h1>Main</h1>\n<h1>Second A</h1>");
        String visitor = doc("<title>T</title>", "<h1>Main</h1>\n<h1>Second B</h1>");

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.crawlerOnlyElements()).isEmpty();
        assertThat(report.crawlerOnlyLines()).isEqualTo(1);
        assertThat(report.detected()).isFalse();
    }

    @Test
    void largeBodyDifference_exceedingBothThresholds_isCloaking() {
        String crawler = doc("<title>T</title>", paragraphs("common", 100) + paragraphs("keyword stuffing", 60));
        String visitor = doc("<title>T</title>", paragraphs("common", 100));

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.crawlerOnlyLines()).isEqualTo(60);
        assertThat(report.visitorOnlyLines()).isZero();
        assertThat(report.detected()).isTrue();
    }

    @Test
    void manyChangedLinesInAHugeDocument_belowRelativeThreshold_isNotCloaking() {
        String crawler = doc("<title>T</title>", paragraphs("common", 1000) + paragraphs("crawler", 60));
        String visitor = doc("<title>T</title>", paragraphs("common", 1000) + paragraphs("visitor", 60));

        CloakingReport report = comparator.compare(crawler, visitor);

        assertThat(report.crawlerOnlyLines()).isEqualTo(60);
        assertThat(report.detected()).isFalse();
    }

    @Test
    void elementLists_areBoundedByMaxElements() {
        StringBuilder crawlerHead = new StringBuilder("<title>T</title>\n");
        for (int i = 0; i < 5; i++) {
            crawlerHead.append("<link rel=\"alternate\" hreflang=\"l").append(i).append("\" href=\"https://a.example/").append(i).append("\">\n");
        }
        CloakingComparator bounded = new CloakingComparator(50, 0.10, 2, false);

        CloakingReport report = bounded.compare(doc(crawlerHead.toString(), ""), doc("<title>T</title>", ""));

        assertThat(report.detected()).isTrue();
        assertThat(report.crawlerOnlyElements()).hasSize(2);
    }

    @Test
    void nullInputs_areTreatedAsEmpty() {
        CloakingReport report = comparator.compare(null, doc("<title>T</title>", ""));

        assertThat(report.crawlerOnlyLines()).isZero();
        assertThat(report.visitorOnlyElements()).containsExactly("<title>T</title>");
        assertThat(report.detected()).isTrue();
    }

    @Test
    void extractSeoElements_collapsesWhitespace_titleThenMetaTags() {
        List<String> elements = List.copyOf(CloakingComparator.extractSeoElements(
                "<title>\n  A   title\n</title><meta name=\"robots\" content=\"noindex\"><meta name=\"description\" content=\"d\">"));

        assertThat(elements).containsExactly(
                "<title> A title </title>",
                "<meta name=\"description\" content=\"d\">",
                "<meta name=\"robots\" content=\"noindex\">");
    }

    @Test
    void negativeThresholds_areRejected() {
        assertThatThrownBy(() -> new CloakingComparator(-1, 0.1, 10, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
