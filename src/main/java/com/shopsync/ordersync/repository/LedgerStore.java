package com.shopsync.ordersync.repository;

import com.shopsync.ordersync.model.LedgerMutation;
import com.shopsync.ordersync.model.LedgerRow;

import java.util.List;
import java.util.Map;

/**
 * Persisted per-order ledger. Implementations throw {@link com.shopsync.ordersync.service.SyncException}
 * when the store cannot be reached.
 */
public interface LedgerStore {

    /**
     * All data rows keyed by order id.
     */
    Map<Long, LedgerRow> readRows();

    /**
     * Applies a batch of full-row writes. Calls are serialized; appends land in submission order.
     */
    void applyBatch(List<LedgerMutation> mutations);
}
