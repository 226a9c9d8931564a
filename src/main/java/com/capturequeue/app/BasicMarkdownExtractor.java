package com.capturequeue.app;

import com.capturequeue.spi.MarkdownExtractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal HTML to markdown conversion: headings, paragraphs, line breaks,
 * list items and links; every other tag is dropped.
 */
public class BasicMarkdownExtractor implements MarkdownExtractor {
    private static final Pattern DROPPED_BLOCKS = Pattern.compile(
            "<(script|style|noscript|head|nav|footer)[^>]*>.*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HEADING = Pattern.compile(
            "<h([1-6])[^>]*>(.*?)</h\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LINK = Pattern.compile(
            "<a\\s[^>]*href=\"([^\"]*)\"[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LIST_ITEM = Pattern.compile("<li[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_END = Pattern.compile("</(p|div|li|ul|ol|section|article|tr)>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    @Override
    public String extract(String content, String url) {
        if (content == null) {
            return "";
        }
        String text = DROPPED_BLOCKS.matcher(content).replaceAll("");

        Matcher heading = HEADING.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (heading.find()) {
            String hashes = "#".repeat(Integer.parseInt(heading.group(1)));
            String title = TAG.matcher(heading.group(2)).replaceAll("").trim();
            heading.appendReplacement(sb, Matcher.quoteReplacement("\n\n" + hashes + " " + title + "\n\n"));
        }
        heading.appendTail(sb);
        text = sb.toString();

        Matcher link = LINK.matcher(text);
        sb = new StringBuilder();
        while (link.find()) {
            String label = TAG.matcher(link.group(2)).replaceAll("").trim();
            link.appendReplacement(sb, Matcher.quoteReplacement("[" + label + "](" + link.group(1) + ")"));
        }
        link.appendTail(sb);
        text = sb.toString();

        text = LIST_ITEM.matcher(text).replaceAll("\n- ");
        text = BREAK.matcher(text).replaceAll("\n");
        text = BLOCK_END.matcher(text).replaceAll("\n\n");
        text = TAG.matcher(text).replaceAll("");
        text = decodeEntities(text);

        return text.replaceAll("[ \\t]+", " ")
                .replaceAll(" *\\n *", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }

    static String decodeEntities(String text) {
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
