package com.shopsync.ordersync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Optional;

/**
 * Downloads a tracking payload, preferring the courier API endpoint and falling back to the
 * public tracking page.
 */
@Service
public class TrackingPageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(TrackingPageFetcher.class);

    private final RestTemplate restTemplate;
    private final CourierApiResolver courierApiResolver;

    public TrackingPageFetcher(@Qualifier("trackingRestTemplate") RestTemplate restTemplate,
                               CourierApiResolver courierApiResolver) {
        this.restTemplate = restTemplate;
        this.courierApiResolver = courierApiResolver;
    }

    /**
     * @throws TrackingFetchException when neither the courier API nor the tracking URL answers
     */
    public String fetch(String trackingUrl) {
        Optional<String> apiEndpoint = courierApiResolver.resolveEndpoint(trackingUrl);
        if (apiEndpoint.isPresent()) {
            try {
                String body = restTemplate.getForObject(URI.create(apiEndpoint.get()), String.class);
                if (body != null && !body.isBlank()) {
                    return body;
                }
                logger.warn("Courier API {} returned an empty body; falling back to {}", apiEndpoint.get(), trackingUrl);
            } catch (RestClientException | IllegalArgumentException e) {
                logger.warn("Courier API {} failed ({}); falling back to {}", apiEndpoint.get(), e.getMessage(), trackingUrl);
            }
        }

        try {
            String body = restTemplate.getForObject(URI.create(trackingUrl.trim()), String.class);
            return body == null ? "" : body;
        } catch (RestClientException | IllegalArgumentException e) {
            throw new TrackingFetchException("Failed to download tracking page " + trackingUrl, e);
        }
    }
}
