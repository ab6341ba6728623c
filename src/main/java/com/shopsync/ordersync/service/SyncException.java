package com.shopsync.ordersync.service;

/**
 * The order source or the ledger store cannot be reached; the whole sync pass is aborted.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
