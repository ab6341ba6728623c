package com.shopsync.ordersync.model;

/**
 * Canonical status labels produced by the tracking classifier after normalization.
 */
public final class TrackingStatus {

    private TrackingStatus() {
    }

    public static final String DELIVERED = "Delivered";
    public static final String IN_TRANSIT = "In-Transit";
    public static final String STUCK = "Stuck";
    public static final String FAILED = "Failed";
    public static final String RETURN = "Return";
    public static final String CUSTOMER_NOT_PICKING_PHONE = "Customer Not Picking Phone";

    // Not part of the classifier vocabulary; marks a verdict that could not be obtained.
    public static final String UNABLE_TO_CLASSIFY = "Unable to Classify";
}
