package com.shopsync.ordersync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopsync.ordersync.model.ContentType;
import com.shopsync.ordersync.model.NormalizedContent;

public record NormalizeResponse(
        @JsonProperty("content_type") ContentType contentType,
        @JsonProperty("extracted_by") String extractedBy,
        @JsonProperty("original_length") int originalLength,
        int length,
        String text
) {
    public static NormalizeResponse from(NormalizedContent content) {
        return new NormalizeResponse(content.contentType(), content.extractedBy(),
                content.originalLength(), content.length(), content.text());
    }
}
