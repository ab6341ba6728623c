package com.shopsync.ordersync.model;

/**
 * Lifecycle stage assigned to an order for one sync pass, together with the ledger template
 * applied for it. A {@code null} label keeps whatever the existing row already holds; alert text
 * and colour for {@link #AWAITING_WHATSAPP_CONFIRM}, {@link #TRACK_PARCEL} and {@link #STALE_ORDER}
 * are computed by {@code AlertGenerator}.
 */
public enum Scenario {
    NEW_ORDER("New Order", "Not Sent", "Not Shipped",
            "New order - send WhatsApp confirmation", SeverityColor.NONE),
    AWAITING_WHATSAPP_CONFIRM("Awaiting WhatsApp Confirmation", "Sent - Awaiting Reply", null,
            null, SeverityColor.NONE),
    INVALID_WHATSAPP("WhatsApp Failed", "Invalid Number", null,
            "Invalid WhatsApp number - call the customer directly", SeverityColor.RED),
    AWAITING_PHONE_CALL("Awaiting Phone Call", "Confirmed", null,
            "WhatsApp confirmed - call the customer to verify the order", SeverityColor.YELLOW),
    CUSTOMER_NOT_PICKING_PHONE("Customer Not Picking Phone", "No Answer", null,
            "Customer not picking phone - retry the call or send a WhatsApp reminder", SeverityColor.ORANGE),
    AWAITING_SIZE_CONFIRMATION("Awaiting Size Confirmation", "Confirmed", null,
            "Call completed - confirm the size before dispatch", SeverityColor.YELLOW),
    READY_FOR_COURIER("Ready for Courier", "Confirmed", "Ready to Ship",
            "Size confirmed - book the courier", SeverityColor.GREEN),
    TRACK_PARCEL("In Delivery", null, null, null, null),
    ALREADY_DELIVERED("Delivered", null, TrackingStatus.DELIVERED, null, SeverityColor.GREEN),
    STALE_ORDER("Stale - Unfulfilled", null, null, null, SeverityColor.ORANGE),
    CANCELLED("Cancelled", null, "Cancelled", "Order cancelled", SeverityColor.GREY),
    UPDATE_ONLY(null, null, null, null, null);

    private final String stageLabel;
    private final String whatsAppStatus;
    private final String deliveryStatus;
    private final String alertText;
    private final SeverityColor color;

    Scenario(String stageLabel, String whatsAppStatus, String deliveryStatus, String alertText, SeverityColor color) {
        this.stageLabel = stageLabel;
        this.whatsAppStatus = whatsAppStatus;
        this.deliveryStatus = deliveryStatus;
        this.alertText = alertText;
        this.color = color;
    }

    public String getStageLabel() { return stageLabel; }
    public String getWhatsAppStatus() { return whatsAppStatus; }
    public String getDeliveryStatus() { return deliveryStatus; }
    public String getAlertText() { return alertText; }
    public SeverityColor getColor() { return color; }

    /**
     * Scenarios that never produce a ledger mutation.
     */
    public boolean isNoOp() {
        return this == ALREADY_DELIVERED;
    }
}
