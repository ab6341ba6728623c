package com.shopsync.ordersync.service;

import com.shopsync.ordersync.dto.SyncSummary;
import com.shopsync.ordersync.model.LedgerRow;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.repository.LedgerStore;
import com.shopsync.ordersync.repository.OrderSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one sync pass: fetch orders, read the ledger, reconcile. Only one pass runs at a time.
 */
@Service
public class OrderSyncService {

    private static final Logger logger = LoggerFactory.getLogger(OrderSyncService.class);

    private final OrderSource orderSource;
    private final LedgerStore ledgerStore;
    private final SheetReconciler sheetReconciler;
    private final SyncProgressService progressService;
    private final Clock clock;
    private final AtomicReference<String> activeRun = new AtomicReference<>();

    public OrderSyncService(OrderSource orderSource,
                            LedgerStore ledgerStore,
                            SheetReconciler sheetReconciler,
                            SyncProgressService progressService,
                            Clock clock) {
        this.orderSource = orderSource;
        this.ledgerStore = ledgerStore;
        this.sheetReconciler = sheetReconciler;
        this.progressService = progressService;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException     when {@code start} is after {@code end}
     * @throws SyncAlreadyRunningException  when another pass is in progress
     * @throws SyncException                when the order source or the ledger cannot be reached
     */
    public SyncSummary sync(OffsetDateTime start, OffsetDateTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Sync range requires both a start and an end");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Sync range start " + start + " is after end " + end);
        }

        String runId = "sync-" + UUID.randomUUID();
        if (!activeRun.compareAndSet(null, runId)) {
            throw new SyncAlreadyRunningException(activeRun.get());
        }

        SyncSummary summary = new SyncSummary();
        summary.setRunId(runId);
        summary.setStartedAt(OffsetDateTime.now(clock));
        logger.info("========== Order sync {} started for {} .. {} ==========", runId, start, end);
        try {
            List<Order> orders = orderSource.fetchOrders(start, end);
            summary.setOrdersFetched(orders.size());
            Map<Long, LedgerRow> rows = ledgerStore.readRows();
            summary.setExistingRows(rows.size());

            progressService.startTracking(runId, orders.size());
            sheetReconciler.reconcile(runId, orders, rows, summary);
            summary.setFinishedAt(OffsetDateTime.now(clock));
            logger.info("========== Order sync {} finished: {} ==========", runId, summary);
            return summary;
        } catch (SyncException e) {
            logger.error("Order sync {} aborted: {}", runId, e.getMessage(), e);
            throw e;
        } finally {
            progressService.complete(runId);
            activeRun.set(null);
        }
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }
}
