package com.shopsync.ordersync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncProgressResponse(
        boolean running,
        @JsonProperty("run_id") String runId,
        int processed,
        int total,
        double percentage
) {
    public static SyncProgressResponse idle() {
        return new SyncProgressResponse(false, null, 0, 0, 0.0);
    }
}
