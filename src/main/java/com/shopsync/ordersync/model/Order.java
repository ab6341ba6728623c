package com.shopsync.ordersync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Commerce-side order as returned by the Shopify Admin REST API. Read-only to the sync core.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Order {

    public static final String FULFILLED = "fulfilled";
    public static final String UNFULFILLED = "unfulfilled";

    private long id;

    private String name;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("cancelled_at")
    private OffsetDateTime cancelledAt;

    private String tags;

    @JsonProperty("fulfillment_status")
    private String fulfillmentStatus;

    private List<Fulfillment> fulfillments;

    @JsonProperty("financial_status")
    private String financialStatus;

    private String phone;

    private Customer customer;

    @JsonProperty("shipping_address")
    private Address shippingAddress;

    @JsonProperty("billing_address")
    private Address billingAddress;

    @JsonProperty("note_attributes")
    private List<NoteAttribute> noteAttributes;

    /**
     * Shopify reports an order with no fulfillments as {@code null}; that is treated as unfulfilled.
     */
    public String effectiveFulfillmentStatus() {
        if (fulfillmentStatus == null || fulfillmentStatus.isBlank()) {
            return UNFULFILLED;
        }
        return fulfillmentStatus.trim().toLowerCase();
    }

    public boolean hasFulfillments() {
        return fulfillments != null && !fulfillments.isEmpty();
    }

    public Optional<String> firstTrackingUrl() {
        if (fulfillments == null) {
            return Optional.empty();
        }
        return fulfillments.stream()
                .map(Fulfillment::getTrackingUrl)
                .filter(url -> url != null && !url.isBlank())
                .findFirst();
    }

    public String customerName() {
        if (customer != null) {
            String full = join(customer.getFirstName(), customer.getLastName());
            if (!full.isEmpty()) {
                return full;
            }
        }
        if (shippingAddress != null && shippingAddress.getName() != null) {
            return shippingAddress.getName().trim();
        }
        return "";
    }

    /**
     * Customer phone, then order phone, shipping phone, billing phone, then a note attribute
     * whose name mentions "phone".
     */
    public String contactPhone() {
        if (customer != null && hasText(customer.getPhone())) return customer.getPhone().trim();
        if (hasText(phone)) return phone.trim();
        if (shippingAddress != null && hasText(shippingAddress.getPhone())) return shippingAddress.getPhone().trim();
        if (billingAddress != null && hasText(billingAddress.getPhone())) return billingAddress.getPhone().trim();
        if (noteAttributes != null) {
            for (NoteAttribute attribute : noteAttributes) {
                if (attribute.getName() != null
                        && attribute.getName().toLowerCase().contains("phone")
                        && hasText(attribute.getValue())) {
                    return attribute.getValue().trim();
                }
            }
        }
        return "";
    }

    public String shippingCity() {
        return shippingAddress != null && shippingAddress.getCity() != null ? shippingAddress.getCity().trim() : "";
    }

    private static String join(String first, String last) {
        StringBuilder sb = new StringBuilder();
        if (hasText(first)) sb.append(first.trim());
        if (hasText(last)) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(last.trim());
        }
        return sb.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fulfillment {
        private Long id;

        private String status;

        @JsonProperty("tracking_company")
        private String trackingCompany;

        @JsonProperty("tracking_number")
        private String trackingNumber;

        @JsonProperty("tracking_url")
        private String trackingUrl;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Customer {
        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;

        private String phone;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        private String name;
        private String city;
        private String phone;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NoteAttribute {
        private String name;
        private String value;
    }
}
