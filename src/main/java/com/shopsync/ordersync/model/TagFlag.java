package com.shopsync.ordersync.model;

import java.util.List;

/**
 * Known order tags that act as lifecycle flags. Default spellings can be extended per flag
 * through {@code app.tags.synonyms.<FLAG>}.
 */
public enum TagFlag {
    CANCELLED("Cancelled"),
    WHATSAPP_SENT("WhatsApp Sent"),
    CONFIRMED("Confirmed"),
    INVALID_WHATSAPP("Invalid WhatsApp"),
    WHATSAPP_CONFIRMED("WhatsApp Confirmed"),
    AWAITING_CALL("Awaiting Call"),
    DID_NOT_PICK_UP("Did not pick up"),
    NO_ANSWER("No Answer"),
    CALL_COMPLETED("Call Completed"),
    SIZE_CONFIRMED("Size Confirmed");

    private final String defaultSpelling;

    TagFlag(String defaultSpelling) {
        this.defaultSpelling = defaultSpelling;
    }

    public List<String> defaultSpellings() {
        return List.of(defaultSpelling);
    }
}
