package com.shopsync.ordersync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class AnalyzeRequest {

    @JsonProperty("tracking_url")
    private String trackingUrl;

    public String getTrackingUrl() {
        return trackingUrl;
    }

    public void setTrackingUrl(String trackingUrl) {
        this.trackingUrl = trackingUrl;
    }
}
