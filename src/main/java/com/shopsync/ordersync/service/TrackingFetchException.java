package com.shopsync.ordersync.service;

/**
 * A tracking page or courier API could not be fetched for one order.
 */
public class TrackingFetchException extends RuntimeException {

    public TrackingFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
