package com.shopsync.ordersync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structure-agnostic last resort: scans the raw payload for quoted {@code "key": "value"} pairs
 * whose key is a known courier field spelling.
 */
@Service
public class PatternFallbackExtractor implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(PatternFallbackExtractor.class);

    private static final Pattern STATUS_PATTERN = Pattern.compile(
            "\"(?:status|delivery_status|tracking_status|shipment_status|current_status|state|stage|"
                    + "ProcessDescForPortal|OperationDesc|TrackingStatus|CurrentStatus)\"\\s*:\\s*\"([^\"]+)\"",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LOCATION_PATTERN = Pattern.compile(
            "\"(?:location|current_location|city|destination|origin|hub|BranchName|ConsigneeCity|DestinationCity)\"\\s*:\\s*\"([^\"]+)\"",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_PATTERN = Pattern.compile(
            "\"(?:date|timestamp|delivered_at|delivery_date|updated_at|TransactionDate)\"\\s*:\\s*\"([^\"]+)\"",
            Pattern.CASE_INSENSITIVE);

    private static final int MAX_STATUS = 5;
    private static final int MAX_LOCATION = 3;
    private static final int MAX_DATE = 2;

    @Override
    public String name() {
        return "patterns";
    }

    @Override
    public String extract(String payload) {
        if (payload == null || payload.isBlank()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        int statuses = appendMatches(STATUS_PATTERN, payload, MAX_STATUS, "STATUS", out);
        int locations = appendMatches(LOCATION_PATTERN, payload, MAX_LOCATION, "LOCATION", out);
        int dates = appendMatches(DATE_PATTERN, payload, MAX_DATE, "TIME", out);
        logger.debug("Pattern fallback matched {} status, {} location, {} date values", statuses, locations, dates);
        return out.toString();
    }

    private int appendMatches(Pattern pattern, String payload, int limit, String category, StringBuilder out) {
        Matcher matcher = pattern.matcher(payload);
        int count = 0;
        while (count < limit && matcher.find()) {
            String value = matcher.group(1).trim();
            if (value.isEmpty()) {
                continue;
            }
            out.append('[').append(category).append("] ").append(value).append('\n');
            count++;
        }
        return count;
    }
}
