package com.shopsync.ordersync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopsync.ordersync.model.Scenario;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one sync pass, returned by /api/sync.
 */
public class SyncSummary {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("started_at")
    private OffsetDateTime startedAt;

    @JsonProperty("finished_at")
    private OffsetDateTime finishedAt;

    @JsonProperty("orders_fetched")
    private int ordersFetched;

    @JsonProperty("existing_rows")
    private int existingRows;

    private int appended;
    private int updated;

    /** Orders whose scenario produced no mutation. */
    private int unchanged;

    /** Orders skipped after a per-order failure; retried on the next pass. */
    private int failed;

    private int batches;

    private Map<Scenario, Integer> scenarios = new EnumMap<>(Scenario.class);

    public void recordScenario(Scenario scenario) {
        scenarios.merge(scenario, 1, Integer::sum);
    }

    public void incrementAppended() {
        appended++;
    }

    public void incrementUpdated() {
        updated++;
    }

    public void incrementUnchanged() {
        unchanged++;
    }

    public void incrementFailed() {
        failed++;
    }

    public void incrementBatches() {
        batches++;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public int getOrdersFetched() {
        return ordersFetched;
    }

    public void setOrdersFetched(int ordersFetched) {
        this.ordersFetched = ordersFetched;
    }

    public int getExistingRows() {
        return existingRows;
    }

    public void setExistingRows(int existingRows) {
        this.existingRows = existingRows;
    }

    public int getAppended() {
        return appended;
    }

    public int getUpdated() {
        return updated;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public int getFailed() {
        return failed;
    }

    public int getBatches() {
        return batches;
    }

    public Map<Scenario, Integer> getScenarios() {
        return scenarios;
    }

    public int countFor(Scenario scenario) {
        return scenarios.getOrDefault(scenario, 0);
    }

    @Override
    public String toString() {
        return "SyncSummary{runId=" + runId
                + ", fetched=" + ordersFetched
                + ", existingRows=" + existingRows
                + ", appended=" + appended
                + ", updated=" + updated
                + ", unchanged=" + unchanged
                + ", failed=" + failed
                + ", batches=" + batches
                + ", scenarios=" + scenarios + '}';
    }
}
