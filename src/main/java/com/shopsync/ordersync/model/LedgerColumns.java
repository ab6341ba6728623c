package com.shopsync.ordersync.model;

/**
 * Fixed column layout of the ledger sheet (A..L). Row 1 is the header.
 */
public final class LedgerColumns {

    private LedgerColumns() {
    }

    public static final int ORDER_ID = 0;
    public static final int ORDER_NAME = 1;
    public static final int CREATED_AT = 2;
    public static final int CUSTOMER = 3;
    public static final int PHONE = 4;
    public static final int CITY = 5;
    public static final int FINANCIAL_STATUS = 6;
    public static final int TRACKING_URL = 7;
    public static final int CURRENT_STAGE = 8;
    public static final int WHATSAPP_STATUS = 9;
    public static final int DELIVERY_STATUS = 10;
    public static final int AI_ALERT = 11;

    public static final int COUNT = 12;
    public static final String LAST_COLUMN_LETTER = "L";
    public static final int FIRST_DATA_ROW = 2;
}
