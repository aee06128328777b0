package com.archivist.sync.extract;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts rich text (HTML with host reference tokens) to plain text and markdown, and
 * markdown summaries back to simple HTML.
 */
public final class TextNormalizer {

    private static final Pattern SCRIPT = Pattern.compile("(?is)<script.*?</script>");
    private static final Pattern UUID_TOKEN = Pattern.compile("@UUID\\[[^\\]]+\\](?:\\{([^}]*)\\})?");
    private static final Pattern JOURNAL_TOKEN = Pattern.compile("@JournalEntry\\[[^\\]]+\\](?:\\{([^}]*)\\})?");
    private static final Pattern DATA_ATTRIBUTE = Pattern.compile("\\sdata-[a-zA-Z-]+=\"[^\"]*\"");
    private static final Pattern BLOCK_BREAK = Pattern.compile("(?i)<br\\s*/?>|</p>|</li>|</h[1-6]>|</div>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_-]{2,})");

    private TextNormalizer() {
    }

    /**
     * Strips markup and reference tokens, decodes common entities and collapses whitespace.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String s = stripBoilerplate(html);
        s = BLOCK_BREAK.matcher(s).replaceAll(" ");
        s = TAG.matcher(s).replaceAll(" ");
        s = decodeEntities(s);
        return s.replaceAll("\\s+", " ").trim();
    }

    /**
     * Minimal HTML to markdown: paragraphs, bold, italics and bullet lists.
     */
    public static String toMarkdown(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String s = stripBoilerplate(html)
                .replace("\r\n", "\n")
                .replaceAll("</?(strong|b)>", "**")
                .replaceAll("</?(em|i)>", "_")
                .replaceAll("<p[^>]*>", "")
                .replace("</p>", "\n\n")
                .replaceAll("<li[^>]*>", "- ")
                .replace("</li>", "\n")
                .replaceAll("<ul[^>]*>", "")
                .replace("</ul>", "\n")
                .replaceAll("<br\\s*/?>", "\n");
        s = TAG.matcher(s).replaceAll("");
        s = decodeEntities(s);
        return s.replaceAll("\n{3,}", "\n\n").trim();
    }

    /**
     * Minimal markdown to HTML: blank-line separated paragraphs, bold, italics and line breaks.
     * Text is escaped first, so markup in the source is shown literally.
     */
    public static String toHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        for (String paragraph : markdown.replace("\r\n", "\n").trim().split("\n\\s*\n")) {
            String p = escape(paragraph.trim())
                    .replaceAll("\\*\\*(.+?)\\*\\*", "<strong>$1</strong>")
                    .replaceAll("(?<![\\w*])_(.+?)_(?![\\w*])", "<em>$1</em>")
                    .replace("\n", "<br>");
            html.append("<p>").append(p).append("</p>");
        }
        return html.toString();
    }

    /**
     * Lower-cased {@code #hashtag} tokens of at least two letters, digits, {@code _} or {@code -}.
     */
    public static Set<String> hashtags(String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (text == null) {
            return tags;
        }
        Matcher m = HASHTAG.matcher(text);
        while (m.find()) {
            tags.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        return tags;
    }

    private static String stripBoilerplate(String html) {
        String s = SCRIPT.matcher(html).replaceAll("");
        s = UUID_TOKEN.matcher(s).replaceAll(mr -> mr.group(1) != null ? Matcher.quoteReplacement(mr.group(1)) : "");
        s = JOURNAL_TOKEN.matcher(s).replaceAll(mr -> mr.group(1) != null ? Matcher.quoteReplacement(mr.group(1)) : "");
        return DATA_ATTRIBUTE.matcher(s).replaceAll("");
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String decodeEntities(String s) {
        return s.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
