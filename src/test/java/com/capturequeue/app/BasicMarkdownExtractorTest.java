package com.capturequeue.app;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BasicMarkdownExtractorTest {
    private final BasicMarkdownExtractor extractor = new BasicMarkdownExtractor();

    @Test
    void convertsCommonElements() {
        String html = "<html><head><title>T</title><style>p{}</style></head><body>"
                + "<h1>Main <em>title</em></h1>"
                + "<p>First &amp; foremost.</p>"
                + "<ul><li>one</li><li>two</li></ul>"
                + "<p>See <a href=\"https://example.com\">the docs</a>.</p>"
                + "<script>alert(1)</script>"
                + "</body></html>";

        String markdown = extractor.extract(html, "https://example.com");

        assertEquals("# Main title\n\nFirst & foremost.\n\n- one\n\n- two\n\nSee [the docs](https://example.com).",
                markdown);
    }

    @Test
    void dropsScriptsAndNavigation() {
        String markdown = extractor.extract("<nav><a href=\"/\">Home</a></nav><p>Body</p><footer>(c)</footer>",
                "https://example.com");

        assertEquals("Body", markdown);
    }

    @Test
    void nullContentGivesEmptyMarkdown() {
        assertEquals("", extractor.extract(null, "https://example.com"));
    }

    @Test
    void decodesEntities() {
        assertEquals("<a> & \"b\" 'c'", BasicMarkdownExtractor.decodeEntities("&lt;a&gt; &amp; &quot;b&quot; &#39;c&#39;"));
    }
}
