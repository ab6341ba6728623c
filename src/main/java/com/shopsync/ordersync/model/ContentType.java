package com.shopsync.ordersync.model;

/**
 * Shape of a raw courier tracking payload, as decided by {@code ContentTypeDetector}.
 */
public enum ContentType {
    JSON,
    XML,
    HTML,
    PLAIN_TEXT,
    UNKNOWN
}
