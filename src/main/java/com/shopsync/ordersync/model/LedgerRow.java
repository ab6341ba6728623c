package com.shopsync.ordersync.model;

/**
 * One persisted ledger row as read back from the sheet. Row indices are 1-based and stable.
 */
public record LedgerRow(
        int rowIndex,
        long orderId,
        String currentStage,
        String whatsAppStatus,
        String deliveryStatus,
        String aiAlert
) {
    public String currentStage() { return currentStage == null ? "" : currentStage; }
    public String whatsAppStatus() { return whatsAppStatus == null ? "" : whatsAppStatus; }
    public String deliveryStatus() { return deliveryStatus == null ? "" : deliveryStatus; }
    public String aiAlert() { return aiAlert == null ? "" : aiAlert; }
}
