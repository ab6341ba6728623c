package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.SeverityColor;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import com.shopsync.ordersync.model.TrackingStatus;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Maps free-form classifier labels onto the canonical status and colour vocabulary.
 */
@Service
public class ClassifierResultNormalizer {

    /**
     * Unrecognized labels are passed through verbatim; a blank label reads as In-Transit.
     */
    public String normalizeStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return TrackingStatus.IN_TRANSIT;
        }
        String lower = raw.toLowerCase(Locale.ROOT);

        if (lower.contains("deliver") && !lower.contains("not") && !lower.contains("fail")) {
            return TrackingStatus.DELIVERED;
        }
        if (lower.contains("transit")) {
            return TrackingStatus.IN_TRANSIT;
        }
        if (lower.contains("stuck") || lower.contains("delay") || lower.contains("hold")) {
            return TrackingStatus.STUCK;
        }
        if (lower.contains("fail") || lower.contains("unsuccess") || lower.contains("cancel")) {
            return TrackingStatus.FAILED;
        }
        if (lower.contains("return")) {
            return TrackingStatus.RETURN;
        }
        if (lower.contains("phone") || lower.contains("contact") || lower.contains("unreachable")) {
            return TrackingStatus.CUSTOMER_NOT_PICKING_PHONE;
        }
        return raw;
    }

    /**
     * Always one of Green, Yellow, Orange or Red; anything unrecognized reads as Yellow.
     */
    public String normalizeColor(String raw) {
        return toSeverity(raw).getLabel();
    }

    public SeverityColor toSeverity(String raw) {
        if (raw == null || raw.isBlank()) {
            return SeverityColor.YELLOW;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.contains("green")) return SeverityColor.GREEN;
        if (lower.contains("yellow")) return SeverityColor.YELLOW;
        if (lower.contains("orange")) return SeverityColor.ORANGE;
        if (lower.contains("red")) return SeverityColor.RED;
        return SeverityColor.YELLOW;
    }

    public TrackingAnalysisResult normalize(String rawStatus, String rawColor, String errorMessage) {
        return new TrackingAnalysisResult(normalizeStatus(rawStatus), normalizeColor(rawColor), errorMessage);
    }
}
