package com.shopsync.ordersync.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bounds text to a maximum length, preferring sentence segments that mention delivery
 * keywords and otherwise keeping the head and tail of the text.
 */
@Service
public class IntelligentTruncator {

    static final String SPLICE_MARKER = " [...] ";

    private static final Pattern SEGMENT_DELIMITER = Pattern.compile("[.\\n;]");

    private static final List<String> KEYWORDS = List.of(
            "delivered", "delivery", "status", "tracking",
            "failed", "returned", "stuck", "transit",
            "location", "date", "received", "recipient",
            "out for delivery", "in transit", "picked up",
            "attempted", "exception", "delay", "completed");

    /**
     * Returns {@code text} unchanged when it fits, otherwise a string of at most {@code maxLength}
     * characters.
     */
    public String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 0) {
            return "";
        }

        List<String> kept = new ArrayList<>();
        int currentLength = 0;
        for (String segment : SEGMENT_DELIMITER.split(text)) {
            if (segment.isEmpty() || !containsKeyword(segment)) {
                continue;
            }
            if (currentLength + segment.length() < maxLength) {
                kept.add(segment.trim());
                currentLength += segment.length() + 2;
            } else {
                break;
            }
        }

        if (!kept.isEmpty() && currentLength > maxLength / 2) {
            return String.join(". ", kept);
        }

        int half = maxLength / 2 - 10;
        if (half <= 0) {
            return text.substring(0, maxLength);
        }
        String beginning = text.substring(0, Math.min(half, text.length()));
        int endStart = Math.max(half, text.length() - half);
        return beginning + SPLICE_MARKER + text.substring(endStart);
    }

    private boolean containsKeyword(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
