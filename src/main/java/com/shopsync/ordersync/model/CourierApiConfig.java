package com.shopsync.ordersync.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Courier-specific tracking API. {@code apiEndpoint} carries a {@code {trackingId}} placeholder.
 */
@Data
@NoArgsConstructor
public class CourierApiConfig {
    private String name;
    private String detectionUrl;
    private String apiEndpoint;
    private List<String> queryParameters = new ArrayList<>();
    private boolean enabled = true;

    public CourierApiConfig(String name, String detectionUrl, String apiEndpoint, List<String> queryParameters, boolean enabled) {
        this.name = name;
        this.detectionUrl = detectionUrl;
        this.apiEndpoint = apiEndpoint;
        this.queryParameters = queryParameters == null ? new ArrayList<>() : new ArrayList<>(queryParameters);
        this.enabled = enabled;
    }
}
