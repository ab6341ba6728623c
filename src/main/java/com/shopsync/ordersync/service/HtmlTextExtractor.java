package com.shopsync.ordersync.service;

import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * Reduces markup to its visible text: script and style blocks and comments are dropped with
 * their content, remaining tags become spaces, entities are decoded and whitespace collapsed.
 */
@Service
public class HtmlTextExtractor implements ExtractionStrategy {

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern STYLE_BLOCK = Pattern.compile("<style[^>]*>.*?</style>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String name() {
        return "html-text";
    }

    @Override
    public String extract(String payload) {
        if (payload == null || payload.isBlank()) {
            return "";
        }
        String text = SCRIPT_BLOCK.matcher(payload).replaceAll("");
        text = STYLE_BLOCK.matcher(text).replaceAll("");
        text = COMMENT.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        text = HtmlUtils.htmlUnescape(text);
        return collapseWhitespace(text);
    }

    static String collapseWhitespace(String text) {
        return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
