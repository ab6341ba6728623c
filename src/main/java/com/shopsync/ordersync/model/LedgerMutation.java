package com.shopsync.ordersync.model;

import java.util.List;

/**
 * Full-row write against the ledger. Appends carry no row index; updates address the row's
 * stable 1-based index. {@code cells} always holds every column in {@link LedgerColumns} order.
 */
public record LedgerMutation(
        Type type,
        Integer rowIndex,
        long orderId,
        Scenario scenario,
        List<String> cells,
        SeverityColor color
) {
    public enum Type {
        APPEND,
        UPDATE
    }

    public LedgerMutation {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public static LedgerMutation append(long orderId, Scenario scenario, List<String> cells, SeverityColor color) {
        return new LedgerMutation(Type.APPEND, null, orderId, scenario, cells, color);
    }

    public static LedgerMutation update(int rowIndex, long orderId, Scenario scenario, List<String> cells, SeverityColor color) {
        return new LedgerMutation(Type.UPDATE, rowIndex, orderId, scenario, cells, color);
    }

    public String cell(int column) {
        return column < cells.size() ? cells.get(column) : "";
    }
}
