package com.shopsync.ordersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pulls status, location, time and context fields out of a courier JSON response.
 * Array roots are treated as an event log with the last element being the latest event.
 */
@Service
public class JsonFieldExtractor implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(JsonFieldExtractor.class);

    static final Set<String> STATUS_FIELDS = lowerCase(
            "status", "delivery_status", "tracking_status", "shipment_status", "current_status",
            "order_status", "state", "stage", "step", "delivered", "is_delivered",
            "deliveryStatus", "OperationDesc", "ProcessDescForPortal", "StatusCode",
            "TrackingStatus", "CurrentStatus");

    static final Set<String> LOCATION_FIELDS = lowerCase(
            "location", "current_location", "last_location", "city", "ConsigneeCity",
            "destination", "origin", "hub", "facility", "OriginCity", "DestBranch", "BranchName",
            "CurrentLocation", "DestinationCity");

    static final Set<String> TIME_FIELDS = lowerCase(
            "date", "timestamp", "updated_at", "delivery_date", "TransactionDate",
            "expected_delivery", "estimated_delivery", "delivered_at", "CallDate", "CallTime",
            "DeliveryDate", "DateTime", "Time");

    static final Set<String> CONTEXT_FIELDS = lowerCase(
            "remarks", "message", "description", "details", "notes",
            "reason", "comment", "failed_reason", "exception", "ReasonDesc", "ConsigneeName",
            "ReceivedBy", "Recipient");

    private static final List<String> HISTORY_FIELDS = List.of(
            "history", "events", "tracking_history", "shipment_history", "timeline", "updates");

    private static final int HISTORY_LIMIT = 3;

    private final ObjectMapper objectMapper;

    public JsonFieldExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json-fields";
    }

    @Override
    public String extract(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.debug("Payload is not parseable JSON: {}", e.getOriginalMessage());
            return "";
        }
        if (root == null || root.isMissingNode()) {
            return "";
        }

        StringBuilder out = new StringBuilder();
        if (root.isArray() && root.size() > 0) {
            extractEventLog(root, out);
        } else if (root.isContainerNode()) {
            extractCategories(root, out);
            extractTrackingHistory(root, out);
        }
        logger.debug("Extracted {} chars of tracking fields from JSON", out.length());
        return out.toString();
    }

    private void extractEventLog(JsonNode events, StringBuilder out) {
        int size = events.size();
        JsonNode latest = events.get(size - 1);
        out.append("### LATEST STATUS ###\n");
        extractCategories(latest, out);

        if (size > 1) {
            out.append("\n### RECENT HISTORY ###\n");
            int from = Math.max(0, size - 1 - HISTORY_LIMIT);
            for (int i = from; i < size - 1; i++) {
                JsonNode item = events.get(i);
                extractFields(item, STATUS_FIELDS, out, null);
                extractFields(item, TIME_FIELDS, out, null);
                out.append("---\n");
            }
        }
    }

    private void extractCategories(JsonNode node, StringBuilder out) {
        extractFields(node, STATUS_FIELDS, out, "STATUS");
        extractFields(node, LOCATION_FIELDS, out, "LOCATION");
        extractFields(node, TIME_FIELDS, out, "TIME");
        extractFields(node, CONTEXT_FIELDS, out, "DETAILS");
    }

    /**
     * Depth-first walk emitting each distinct value of a matching field once, in first-seen order.
     */
    private void extractFields(JsonNode node, Set<String> fieldNames, StringBuilder out, String category) {
        Set<String> seenValues = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        walk(node, fieldNames, out, category, seenValues);
    }

    private void walk(JsonNode current, Set<String> fieldNames, StringBuilder out, String category, Set<String> seenValues) {
        if (current.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = current.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (fieldNames.contains(field.getKey().toLowerCase(Locale.ROOT)) && isScalarText(value)) {
                    String text = value.asText().trim();
                    if (!text.isEmpty() && seenValues.add(text)) {
                        if (category == null) {
                            out.append(field.getKey()).append(": ").append(text).append('\n');
                        } else {
                            out.append('[').append(category).append("] ")
                                    .append(field.getKey()).append(": ").append(text).append('\n');
                        }
                    }
                }
                if (value.isContainerNode()) {
                    walk(value, fieldNames, out, category, seenValues);
                }
            }
        } else if (current.isArray()) {
            for (JsonNode item : current) {
                walk(item, fieldNames, out, category, seenValues);
            }
        }
    }

    private void extractTrackingHistory(JsonNode root, StringBuilder out) {
        for (String field : HISTORY_FIELDS) {
            JsonNode events = findArrayField(root, field);
            if (events == null) {
                continue;
            }
            logger.debug("Found history array '{}' with {} events", field, events.size());

            List<JsonNode> recent = new ArrayList<>();
            for (int i = Math.max(0, events.size() - HISTORY_LIMIT); i < events.size(); i++) {
                recent.add(events.get(i));
            }

            out.append("\n### TRACKING HISTORY ###\n");
            for (JsonNode event : recent) {
                String status = firstText(event, "status", "message", "description");
                if (status == null) {
                    continue;
                }
                String date = firstText(event, "date", "timestamp", "time");
                String location = firstText(event, "location", "city");
                out.append("- ").append(status);
                if (date != null) out.append(" (").append(date).append(')');
                if (location != null) out.append(" at ").append(location);
                out.append('\n');
            }
            return;
        }
    }

    private JsonNode findArrayField(JsonNode node, String fieldName) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equalsIgnoreCase(fieldName) && field.getValue().isArray()) {
                    return field.getValue();
                }
            }
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                JsonNode found = findArrayField(child, fieldName);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private String firstText(JsonNode event, String... names) {
        if (!event.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = event.get(name);
            if (value != null && isScalarText(value)) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static boolean isScalarText(JsonNode value) {
        return value.isTextual() || value.isBoolean();
    }

    private static Set<String> lowerCase(String... names) {
        return Stream.of(names).map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }
}
