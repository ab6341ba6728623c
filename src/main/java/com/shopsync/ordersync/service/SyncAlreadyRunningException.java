package com.shopsync.ordersync.service;

public class SyncAlreadyRunningException extends RuntimeException {

    public SyncAlreadyRunningException(String runId) {
        super("A sync pass is already running: " + runId);
    }
}
