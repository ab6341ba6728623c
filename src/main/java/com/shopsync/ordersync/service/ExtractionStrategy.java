package com.shopsync.ordersync.service;

/**
 * One step of an extraction cascade. Implementations return an empty string, never null,
 * when the payload yields nothing.
 */
public interface ExtractionStrategy {

    String name();

    String extract(String payload);
}
