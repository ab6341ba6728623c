package com.shopsync.ordersync.service;

import com.shopsync.ordersync.config.TagVocabulary;
import com.shopsync.ordersync.model.LedgerRow;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.model.OrderTags;
import com.shopsync.ordersync.model.Scenario;
import com.shopsync.ordersync.model.TagFlag;
import com.shopsync.ordersync.model.TrackingStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides which lifecycle stage an order is in. Rules are evaluated in a fixed order and the
 * first match wins: cancellation and newness override everything, the pre-courier funnel goes
 * from most to least specific tag combination, and fulfillment beats staleness.
 * <p>
 * The result depends only on the order and its existing ledger row.
 */
@Service
public class ScenarioResolver {

    private final TagVocabulary tagVocabulary;
    private final Clock clock;
    private final Duration staleAfter;

    public ScenarioResolver(TagVocabulary tagVocabulary,
                            Clock clock,
                            @Value("${app.sync.stale-hours:24}") long staleHours) {
        this.tagVocabulary = tagVocabulary;
        this.clock = clock;
        this.staleAfter = Duration.ofHours(staleHours);
    }

    /**
     * @param existingRow the order's ledger row, or null when the order has never been written
     */
    public Scenario resolve(Order order, LedgerRow existingRow) {
        OrderTags tags = tagVocabulary.parse(order.getTags());
        String fulfillment = order.effectiveFulfillmentStatus();

        if (order.getCancelledAt() != null || tags.has(TagFlag.CANCELLED)) {
            return Scenario.CANCELLED;
        }
        if (existingRow == null) {
            return Scenario.NEW_ORDER;
        }
        if (tags.has(TagFlag.WHATSAPP_SENT)
                && !tags.has(TagFlag.CONFIRMED)
                && !tags.has(TagFlag.DID_NOT_PICK_UP)) {
            return Scenario.AWAITING_WHATSAPP_CONFIRM;
        }
        if (tags.has(TagFlag.INVALID_WHATSAPP)) {
            return Scenario.INVALID_WHATSAPP;
        }
        if (tags.hasAny(TagFlag.WHATSAPP_CONFIRMED, TagFlag.AWAITING_CALL)) {
            return Scenario.AWAITING_PHONE_CALL;
        }
        if (tags.hasAny(TagFlag.DID_NOT_PICK_UP, TagFlag.NO_ANSWER)) {
            return Scenario.CUSTOMER_NOT_PICKING_PHONE;
        }
        if (tags.has(TagFlag.CALL_COMPLETED) && !tags.has(TagFlag.SIZE_CONFIRMED)) {
            return Scenario.AWAITING_SIZE_CONFIRMATION;
        }
        if (tags.has(TagFlag.SIZE_CONFIRMED) && Order.UNFULFILLED.equals(fulfillment)) {
            return Scenario.READY_FOR_COURIER;
        }
        if (Order.FULFILLED.equals(fulfillment) && order.hasFulfillments()) {
            return TrackingStatus.DELIVERED.equalsIgnoreCase(existingRow.deliveryStatus().trim())
                    ? Scenario.ALREADY_DELIVERED
                    : Scenario.TRACK_PARCEL;
        }
        if (isOlderThan(order, staleAfter)
                && Order.UNFULFILLED.equals(fulfillment)
                && !tags.has(TagFlag.SIZE_CONFIRMED)) {
            return Scenario.STALE_ORDER;
        }
        return Scenario.UPDATE_ONLY;
    }

    private boolean isOlderThan(Order order, Duration threshold) {
        if (order.getCreatedAt() == null) {
            return false;
        }
        Duration age = Duration.between(order.getCreatedAt().toInstant(), Instant.now(clock));
        return age.compareTo(threshold) > 0;
    }
}
