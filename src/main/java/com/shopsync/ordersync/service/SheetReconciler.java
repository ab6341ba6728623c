package com.shopsync.ordersync.service;

import com.shopsync.ordersync.dto.SyncSummary;
import com.shopsync.ordersync.model.Alert;
import com.shopsync.ordersync.model.LedgerColumns;
import com.shopsync.ordersync.model.LedgerMutation;
import com.shopsync.ordersync.model.LedgerRow;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.model.Scenario;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import com.shopsync.ordersync.model.TrackingStatus;
import com.shopsync.ordersync.repository.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Turns a page of orders plus the current ledger into full-row mutations and writes them in
 * bounded batches.
 * <p>
 * Planning is per order and runs on {@code trackingAnalysisExecutor}, since only the tracking
 * classifier call blocks. Results are gathered back in input order, so appends reach the ledger
 * in the same order the orders were fetched.
 */
@Service
public class SheetReconciler {

    private static final Logger logger = LoggerFactory.getLogger(SheetReconciler.class);

    static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ScenarioResolver scenarioResolver;
    private final AlertGenerator alertGenerator;
    private final TrackingAnalysisService trackingAnalysisService;
    private final LedgerStore ledgerStore;
    private final SyncProgressService progressService;
    private final TaskExecutor trackingAnalysisExecutor;
    private final int batchSize;

    public SheetReconciler(ScenarioResolver scenarioResolver,
                           AlertGenerator alertGenerator,
                           TrackingAnalysisService trackingAnalysisService,
                           LedgerStore ledgerStore,
                           SyncProgressService progressService,
                           @Qualifier("trackingAnalysisExecutor") TaskExecutor trackingAnalysisExecutor,
                           @Value("${app.sync.batch-size:50}") int batchSize) {
        this.scenarioResolver = scenarioResolver;
        this.alertGenerator = alertGenerator;
        this.trackingAnalysisService = trackingAnalysisService;
        this.ledgerStore = ledgerStore;
        this.progressService = progressService;
        this.trackingAnalysisExecutor = trackingAnalysisExecutor;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Outcome of planning one order. {@code mutation} is null for no-op scenarios and
     * {@code scenario} is null when planning failed.
     */
    record Plan(long orderId, Scenario scenario, LedgerMutation mutation, String error) {

        static Plan of(long orderId, Scenario scenario, LedgerMutation mutation) {
            return new Plan(orderId, scenario, mutation, null);
        }

        static Plan failed(long orderId, String error) {
            return new Plan(orderId, null, null, error);
        }

        boolean isFailed() {
            return error != null;
        }
    }

    /**
     * Plans and writes mutations for every order. A failing order is logged and skipped; only a
     * ledger write failure aborts the pass, cancelling the plans still running in the window. If the
     * calling thread is interrupted, mutations not yet flushed are discarded.
     */
    public SyncSummary reconcile(String runId, List<Order> orders, Map<Long, LedgerRow> existingRows, SyncSummary summary) {
        List<Order> unique = dedupe(orders);
        List<LedgerMutation> pending = new ArrayList<>();

        for (int start = 0; start < unique.size(); start += batchSize) {
            List<Order> window = unique.subList(start, Math.min(unique.size(), start + batchSize));
            List<CompletableFuture<Plan>> futures = new ArrayList<>(window.size());
            for (Order order : window) {
                LedgerRow row = existingRows.get(order.getId());
                futures.add(CompletableFuture.supplyAsync(() -> safePlan(order, row), trackingAnalysisExecutor));
            }

            for (int i = 0; i < futures.size(); i++) {
                Plan plan = await(futures, i, pending);
                tally(plan, summary, pending);
                progressService.increment(runId, window.get(i).getName());
                if (pending.size() >= batchSize) {
                    try {
                        flush(pending, summary);
                    } catch (SyncException e) {
                        futures.forEach(f -> f.cancel(true));
                        throw e;
                    }
                }
            }
        }
        flush(pending, summary);
        return summary;
    }

    /**
     * Mutations for a set of orders without writing anything. Failed orders are left out.
     */
    public List<LedgerMutation> plan(List<Order> orders, Map<Long, LedgerRow> existingRows) {
        List<LedgerMutation> mutations = new ArrayList<>();
        for (Order order : dedupe(orders)) {
            Plan plan = safePlan(order, existingRows.get(order.getId()));
            if (plan.mutation() != null) {
                mutations.add(plan.mutation());
            }
        }
        return mutations;
    }

    /**
     * The single full-row mutation for an order, or empty when its scenario writes nothing.
     *
     * @throws TrackingFetchException when the order's tracking payload cannot be downloaded
     */
    public Optional<LedgerMutation> planMutation(Order order, LedgerRow existingRow) {
        return Optional.ofNullable(planOrder(order, existingRow).mutation());
    }

    Plan planOrder(Order order, LedgerRow existingRow) {
        Scenario scenario = scenarioResolver.resolve(order, existingRow);
        logger.info("Order {} resolved as {}", order.getName(), scenario);
        if (scenario.isNoOp() || (scenario == Scenario.CANCELLED && existingRow == null)) {
            return Plan.of(order.getId(), scenario, null);
        }

        String stage = scenario.getStageLabel();
        String whatsAppStatus = scenario.getWhatsAppStatus();
        String deliveryStatus = scenario.getDeliveryStatus();
        Alert alert;

        if (scenario == Scenario.TRACK_PARCEL) {
            TrackingAnalysisResult result = trackingAnalysisService.analyze(order).orElse(null);
            alert = alertGenerator.trackingAlert(result, alertGenerator.orderAge(order));
            if (result != null && !result.isUnclassified()) {
                deliveryStatus = result.status();
                if (TrackingStatus.DELIVERED.equalsIgnoreCase(result.status())) {
                    stage = Scenario.ALREADY_DELIVERED.getStageLabel();
                }
            }
        } else if (scenario == Scenario.UPDATE_ONLY) {
            alert = Alert.of(null, null);
        } else {
            alert = alertGenerator.alertFor(scenario, order, null);
        }

        List<String> cells = buildCells(order, existingRow, stage, whatsAppStatus, deliveryStatus, alert.text());
        LedgerMutation mutation = existingRow == null
                ? LedgerMutation.append(order.getId(), scenario, cells, alert.color())
                : LedgerMutation.update(existingRow.rowIndex(), order.getId(), scenario, cells, alert.color());
        return Plan.of(order.getId(), scenario, mutation);
    }

    /**
     * Full row in column order. A null label keeps the value the existing row already holds.
     */
    List<String> buildCells(Order order, LedgerRow existingRow, String stage, String whatsAppStatus,
                            String deliveryStatus, String alertText) {
        String[] cells = new String[LedgerColumns.COUNT];
        Arrays.fill(cells, "");
        cells[LedgerColumns.ORDER_ID] = String.valueOf(order.getId());
        cells[LedgerColumns.ORDER_NAME] = nullToEmpty(order.getName());
        cells[LedgerColumns.CREATED_AT] = order.getCreatedAt() != null ? order.getCreatedAt().format(CREATED_AT_FORMAT) : "";
        cells[LedgerColumns.CUSTOMER] = order.customerName();
        cells[LedgerColumns.PHONE] = order.contactPhone();
        cells[LedgerColumns.CITY] = order.shippingCity();
        cells[LedgerColumns.FINANCIAL_STATUS] = nullToEmpty(order.getFinancialStatus());
        cells[LedgerColumns.TRACKING_URL] = order.firstTrackingUrl().orElse("");
        cells[LedgerColumns.CURRENT_STAGE] = labelOrExisting(stage, existingRow == null ? "" : existingRow.currentStage());
        cells[LedgerColumns.WHATSAPP_STATUS] = labelOrExisting(whatsAppStatus, existingRow == null ? "" : existingRow.whatsAppStatus());
        cells[LedgerColumns.DELIVERY_STATUS] = labelOrExisting(deliveryStatus, existingRow == null ? "" : existingRow.deliveryStatus());
        cells[LedgerColumns.AI_ALERT] = labelOrExisting(alertText, existingRow == null ? "" : existingRow.aiAlert());
        return List.of(cells);
    }

    private Plan safePlan(Order order, LedgerRow row) {
        try {
            return planOrder(order, row);
        } catch (TrackingFetchException e) {
            logger.warn("Skipping order {}: {}", order.getName(), e.getMessage());
            return Plan.failed(order.getId(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Skipping order {} after unexpected error: {}", order.getName(), e.getMessage(), e);
            return Plan.failed(order.getId(), e.getMessage());
        }
    }

    private Plan await(List<CompletableFuture<Plan>> futures, int index, List<LedgerMutation> pending) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            logger.warn("Sync interrupted; discarding {} unflushed mutations.", pending.size());
            pending.clear();
            throw new SyncException("Sync interrupted", e);
        } catch (ExecutionException e) {
            // safePlan already catches per-order failures
            throw new IllegalStateException("Order planning failed unexpectedly", e.getCause());
        }
    }

    private void tally(Plan plan, SyncSummary summary, List<LedgerMutation> pending) {
        if (plan.isFailed()) {
            summary.incrementFailed();
            return;
        }
        summary.recordScenario(plan.scenario());
        if (plan.mutation() == null) {
            summary.incrementUnchanged();
            return;
        }
        pending.add(plan.mutation());
        if (plan.mutation().type() == LedgerMutation.Type.APPEND) {
            summary.incrementAppended();
        } else {
            summary.incrementUpdated();
        }
    }

    private void flush(List<LedgerMutation> pending, SyncSummary summary) {
        if (pending.isEmpty()) {
            return;
        }
        ledgerStore.applyBatch(List.copyOf(pending));
        summary.incrementBatches();
        pending.clear();
    }

    private static List<Order> dedupe(List<Order> orders) {
        Map<Long, Order> byId = new LinkedHashMap<>();
        for (Order order : orders) {
            if (byId.putIfAbsent(order.getId(), order) != null) {
                logger.warn("Order {} returned more than once; processing the first copy only.", order.getId());
            }
        }
        return new ArrayList<>(byId.values());
    }

    private static String labelOrExisting(String label, String existing) {
        return label != null ? label : existing;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
