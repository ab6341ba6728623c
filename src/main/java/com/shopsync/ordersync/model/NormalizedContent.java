package com.shopsync.ordersync.model;

/**
 * Bounded, signal-dense text derived from a raw tracking payload.
 */
public record NormalizedContent(ContentType contentType, String text, int originalLength, String extractedBy) {

    public int length() {
        return text == null ? 0 : text.length();
    }
}
