package com.shopsync.ordersync.service;

import com.shopsync.ordersync.config.CourierApiProperties;
import com.shopsync.ordersync.model.CourierApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rewrites a public tracking-page URL into the courier's JSON API endpoint when a configured
 * courier recognizes it. An empty result means "fetch the original URL".
 */
@Service
public class CourierApiResolver {

    private static final Logger logger = LoggerFactory.getLogger(CourierApiResolver.class);

    static final String TRACKING_ID_PLACEHOLDER = "{trackingId}";
    private static final int MIN_PATH_ID_LENGTH = 6;

    private final CourierApiProperties courierApiProperties;

    public CourierApiResolver(CourierApiProperties courierApiProperties) {
        this.courierApiProperties = courierApiProperties;
    }

    public Optional<String> resolveEndpoint(String trackingUrl) {
        if (!StringUtils.hasText(trackingUrl)) {
            return Optional.empty();
        }
        try {
            Optional<CourierApiConfig> courier = findCourier(trackingUrl);
            if (courier.isEmpty()) {
                return Optional.empty();
            }
            CourierApiConfig config = courier.get();
            Optional<String> trackingId = extractTrackingId(trackingUrl, config.getQueryParameters());
            if (trackingId.isEmpty()) {
                logger.debug("Courier {} matched {} but no tracking id could be extracted", config.getName(), trackingUrl);
                return Optional.empty();
            }
            String endpoint = config.getApiEndpoint().replace(TRACKING_ID_PLACEHOLDER,
                    UriUtils.encodePathSegment(trackingId.get(), StandardCharsets.UTF_8));
            logger.debug("Resolved {} to {} API endpoint {}", trackingUrl, config.getName(), endpoint);
            return Optional.of(endpoint);
        } catch (RuntimeException e) {
            logger.warn("Courier API resolution failed for {}: {}", trackingUrl, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<CourierApiConfig> findCourier(String trackingUrl) {
        String lowerUrl = trackingUrl.toLowerCase(Locale.ROOT);
        return courierApiProperties.getCourierApis().stream()
                .filter(CourierApiConfig::isEnabled)
                .filter(c -> StringUtils.hasText(c.getDetectionUrl()) && StringUtils.hasText(c.getApiEndpoint()))
                .filter(c -> lowerUrl.contains(c.getDetectionUrl().toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /**
     * First configured query parameter with a value, otherwise the last path segment longer than five characters.
     */
    Optional<String> extractTrackingId(String trackingUrl, List<String> queryParameterNames) {
        UriComponents uri = UriComponentsBuilder.fromUriString(trackingUrl).build();
        MultiValueMap<String, String> query = uri.getQueryParams();
        if (queryParameterNames != null) {
            for (String name : queryParameterNames) {
                String value = query.getFirst(name);
                if (StringUtils.hasText(value)) {
                    return Optional.of(UriUtils.decode(value.trim(), StandardCharsets.UTF_8));
                }
            }
        }

        List<String> segments = uri.getPathSegments();
        for (int i = segments.size() - 1; i >= 0; i--) {
            String segment = segments.get(i).trim();
            if (!segment.isEmpty()) {
                return segment.length() >= MIN_PATH_ID_LENGTH ? Optional.of(segment) : Optional.empty();
            }
        }
        return Optional.empty();
    }
}
