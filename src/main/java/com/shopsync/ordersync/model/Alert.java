package com.shopsync.ordersync.model;

/**
 * Human-readable alert for a ledger row plus its background colour. A {@code null} text
 * keeps the alert already on the row; a {@code null} colour leaves the fill untouched.
 */
public record Alert(String text, SeverityColor color) {

    public static Alert of(String text, SeverityColor color) {
        return new Alert(text, color);
    }
}
