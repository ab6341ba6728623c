package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.Alert;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.model.Scenario;
import com.shopsync.ordersync.model.SeverityColor;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import com.shopsync.ordersync.model.TrackingStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Produces the alert text and row colour for a resolved scenario.
 */
@Service
public class AlertGenerator {

    static final String URGENT = "URGENT";

    private final ClassifierResultNormalizer resultNormalizer;
    private final Clock clock;
    private final long inTransitFollowUpDays;

    public AlertGenerator(ClassifierResultNormalizer resultNormalizer,
                          Clock clock,
                          @Value("${app.sync.in-transit-followup-days:5}") long inTransitFollowUpDays) {
        this.resultNormalizer = resultNormalizer;
        this.clock = clock;
        this.inTransitFollowUpDays = inTransitFollowUpDays;
    }

    /**
     * @param classifierResult verdict for {@link Scenario#TRACK_PARCEL}; ignored otherwise and may be null
     */
    public Alert alertFor(Scenario scenario, Order order, TrackingAnalysisResult classifierResult) {
        Duration age = orderAge(order);
        return switch (scenario) {
            case AWAITING_WHATSAPP_CONFIRM -> Alert.of(whatsAppReminder(age), whatsAppReminderColor(age));
            case STALE_ORDER -> Alert.of(staleAlert(age), scenario.getColor());
            case TRACK_PARCEL -> trackingAlert(classifierResult, age);
            default -> Alert.of(scenario.getAlertText(), scenario.getColor());
        };
    }

    /**
     * Reminder text for an unanswered WhatsApp confirmation. Escalates at 2, 6 and 24 hours;
     * negative durations are treated as zero.
     */
    public String whatsAppReminder(Duration elapsed) {
        long hours = nonNegative(elapsed).toHours();
        if (hours < 2) {
            return "";
        }
        if (hours < 6) {
            return String.format("Reminder: WhatsApp confirmation pending for %d hours", hours);
        }
        if (hours < 24) {
            return String.format("Follow up: no WhatsApp reply after %d hours - send a reminder", hours);
        }
        return String.format("%s: WhatsApp confirmation pending for %s - call the customer", URGENT, days(hours / 24));
    }

    public SeverityColor whatsAppReminderColor(Duration elapsed) {
        long hours = nonNegative(elapsed).toHours();
        if (hours < 2) return SeverityColor.NONE;
        if (hours < 6) return SeverityColor.YELLOW;
        if (hours < 24) return SeverityColor.ORANGE;
        return SeverityColor.RED;
    }

    public String staleAlert(Duration age) {
        long days = nonNegative(age).toHours() / 24;
        return String.format("%s: Order unfulfilled for %s without size confirmation", URGENT, days(days));
    }

    public Alert trackingAlert(TrackingAnalysisResult result, Duration orderAge) {
        if (result == null) {
            return Alert.of("Tracking link not available yet", null);
        }
        if (result.isUnclassified()) {
            return Alert.of("Tracking check failed - verify the parcel status manually", SeverityColor.ORANGE);
        }

        SeverityColor color = resultNormalizer.toSeverity(result.color());
        String status = result.status() == null ? "" : result.status().trim();

        if (status.equalsIgnoreCase(TrackingStatus.DELIVERED)) {
            return Alert.of("Parcel delivered successfully", color);
        }
        if (status.equalsIgnoreCase(TrackingStatus.IN_TRANSIT) || status.equalsIgnoreCase("in transit")) {
            Duration age = nonNegative(orderAge);
            if (age.compareTo(Duration.ofDays(inTransitFollowUpDays)) > 0) {
                return Alert.of(String.format("Follow up: parcel still in transit after %s - check with the courier", days(age.toDays())), color);
            }
            return Alert.of("Parcel on the way", color);
        }
        if (status.equalsIgnoreCase(TrackingStatus.STUCK)) {
            return Alert.of(URGENT + ": Parcel stuck - contact the courier", color);
        }
        if (status.equalsIgnoreCase(TrackingStatus.FAILED)) {
            return Alert.of("CRITICAL: Delivery failed - call the customer immediately", color);
        }
        if (status.equalsIgnoreCase(TrackingStatus.RETURN) || status.equalsIgnoreCase("Returned")) {
            return Alert.of("Warning: Parcel is being returned - verify the customer address", color);
        }
        if (status.equalsIgnoreCase(TrackingStatus.CUSTOMER_NOT_PICKING_PHONE)) {
            return Alert.of("Courier cannot reach the customer - call back and confirm availability", color);
        }
        return Alert.of("Info: " + status, color);
    }

    public Duration orderAge(Order order) {
        if (order == null || order.getCreatedAt() == null) {
            return Duration.ZERO;
        }
        return nonNegative(Duration.between(order.getCreatedAt().toInstant(), Instant.now(clock)));
    }

    private static Duration nonNegative(Duration duration) {
        return duration == null || duration.isNegative() ? Duration.ZERO : duration;
    }

    private static String days(long days) {
        return days == 1 ? "1 day" : days + " days";
    }
}
