package com.shopsync.ordersync.service;

import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the text of tracking-relevant elements from an XML response.
 */
@Service
public class XmlTagExtractor implements ExtractionStrategy {

    private static final Pattern TRACKING_ELEMENT = Pattern.compile(
            "<(?:status|location|date|time|message|description|remarks|delivery)[^>]*>([^<]+)</",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "xml-tags";
    }

    @Override
    public String extract(String payload) {
        if (payload == null || payload.isBlank()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("\n");
        Matcher matcher = TRACKING_ELEMENT.matcher(payload);
        while (matcher.find()) {
            String value = HtmlUtils.htmlUnescape(matcher.group(1).trim()).trim();
            if (!value.isEmpty()) {
                joiner.add(value);
            }
        }
        return joiner.toString();
    }
}
