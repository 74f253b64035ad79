package org.smileyface.botview.testutil;

/**
 * HTML fixtures.
 */
public final class Pages {

    private Pages() {
        // No instanciation
    }

    /**
     * A well-formed document with the given title whose total length is at least {@code minLength}.
     */
    public static String page(String title, int minLength) {
        StringBuilder body = new StringBuilder();
        int i = 0;
        String head = "<!doctype html><html lang=\"en\"><head><title>" + title + "</title></head><body>\n";
        String tail = "</body></html>";
        while (head.length() + body.length() + tail.length() < minLength) {
            body.append("<p>Paragraph ").append(i++).append(" with some real content.</p>\n");
        }
        return head + body + tail;
    }
}
