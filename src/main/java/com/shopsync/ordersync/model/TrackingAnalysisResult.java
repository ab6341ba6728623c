package com.shopsync.ordersync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Verdict of the tracking classifier for one parcel.
 *
 * @param status       canonical status (see {@link TrackingStatus}) or the classifier's own label
 * @param color        canonical colour label: Green, Yellow, Orange or Red
 * @param errorMessage underlying failure, kept for logs; null when the call succeeded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrackingAnalysisResult(String status, String color, String errorMessage) {

    public static TrackingAnalysisResult of(String status, String color) {
        return new TrackingAnalysisResult(status, color, null);
    }

    public static TrackingAnalysisResult unclassified(String errorMessage) {
        return new TrackingAnalysisResult(TrackingStatus.UNABLE_TO_CLASSIFY, SeverityColor.ORANGE.getLabel(), errorMessage);
    }

    public boolean isUnclassified() {
        return TrackingStatus.UNABLE_TO_CLASSIFY.equals(status);
    }
}
