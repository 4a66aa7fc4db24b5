package com.newsvault.backend.scraper.extraction;

import com.newsvault.backend.config.ScrapingConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

/**
 * Shared cleaning applied to the text of every HTML-based extraction stage.
 */
@Component
@RequiredArgsConstructor
public class TextCleaner {

    static final int MIN_LINE_LENGTH = 10;

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern RAW_URL = Pattern.compile("(https?://|www\\.)\\S+");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0\\u2000-\\u200B\\u3000]+");

    private final ScrapingConfig scrapingConfig;

    /**
     * Strips non-content elements from a copy of {@code root} and returns its cleaned text.
     */
    public String cleanElement(Element root) {
        Element copy = root.clone();
        for (String selector : scrapingConfig.getStrippedElements()) {
            copy.select(selector).remove();
        }
        return clean(blockText(copy));
    }

    public String clean(String text) {
        if (text == null || text.isBlank()) return "";

        String result = MARKDOWN_IMAGE.matcher(text).replaceAll("");
        result = MARKDOWN_LINK.matcher(result).replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
        result = RAW_URL.matcher(result).replaceAll("");
        result = removeBoilerplate(result);

        List<String> lines = new ArrayList<>();
        for (String line : result.split("\\R")) {
            String collapsed = INLINE_WHITESPACE.matcher(line).replaceAll(" ").trim();
            // Short lines are menu entries, bylines and button labels
            if (collapsed.length() >= MIN_LINE_LENGTH) {
                lines.add(collapsed);
            }
        }
        return String.join("\n", lines);
    }

    private String removeBoilerplate(String text) {
        String result = text;
        for (String phrase : scrapingConfig.getBoilerplatePhrases()) {
            result = Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(result)
                    .replaceAll("");
        }
        return result;
    }

    /**
     * Text of {@code root} with a line break after every block element.
     */
    static String blockText(Element root) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    text.append(((TextNode) node).text());
                } else if (node instanceof Element && ((Element) node).normalName().equals("br")) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && ((Element) node).isBlock()) {
                    text.append('\n');
                }
            }
        }, root);
        return text.toString();
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().toLowerCase(Locale.ROOT).split("\\s+").length;
    }
}
