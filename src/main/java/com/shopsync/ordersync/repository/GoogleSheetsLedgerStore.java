package com.shopsync.ordersync.repository;

import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.AppendCellsRequest;
import com.google.api.services.sheets.v4.model.BatchUpdateSpreadsheetRequest;
import com.google.api.services.sheets.v4.model.CellData;
import com.google.api.services.sheets.v4.model.CellFormat;
import com.google.api.services.sheets.v4.model.Color;
import com.google.api.services.sheets.v4.model.ExtendedValue;
import com.google.api.services.sheets.v4.model.GridRange;
import com.google.api.services.sheets.v4.model.RepeatCellRequest;
import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.RowData;
import com.google.api.services.sheets.v4.model.UpdateCellsRequest;
import com.google.api.services.sheets.v4.model.ValueRange;
import com.shopsync.ordersync.model.LedgerColumns;
import com.shopsync.ordersync.model.LedgerMutation;
import com.shopsync.ordersync.model.LedgerRow;
import com.shopsync.ordersync.model.SeverityColor;
import com.shopsync.ordersync.service.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ledger kept on one tab of a Google spreadsheet, one row per order, columns A..L.
 */
@Repository
public class GoogleSheetsLedgerStore implements LedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(GoogleSheetsLedgerStore.class);

    static final String VALUE_FIELDS = "userEnteredValue";
    static final String BACKGROUND_FIELDS = "userEnteredFormat.backgroundColor";

    private final Sheets sheets;
    private final String spreadsheetId;
    private final String sheetName;
    private final int sheetId;
    private final ReentrantLock writeLock = new ReentrantLock();

    public GoogleSheetsLedgerStore(Sheets sheets,
                                   @Value("${google.sheets.spreadsheet-id}") String spreadsheetId,
                                   @Value("${google.sheets.sheet-name:Orders}") String sheetName,
                                   @Value("${google.sheets.sheet-id:0}") int sheetId) {
        this.sheets = sheets;
        this.spreadsheetId = spreadsheetId;
        this.sheetName = sheetName;
        this.sheetId = sheetId;
    }

    @Override
    public Map<Long, LedgerRow> readRows() {
        String range = sheetName + "!A" + LedgerColumns.FIRST_DATA_ROW + ":" + LedgerColumns.LAST_COLUMN_LETTER;
        ValueRange response;
        try {
            response = sheets.spreadsheets().values()
                    .get(spreadsheetId, range)
                    .setValueRenderOption("UNFORMATTED_VALUE")
                    .execute();
        } catch (IOException e) {
            throw new SyncException("Failed to read ledger range " + range, e);
        }
        return toRows(response.getValues());
    }

    Map<Long, LedgerRow> toRows(List<List<Object>> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Long, LedgerRow> rows = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            List<Object> cells = values.get(i);
            int rowIndex = LedgerColumns.FIRST_DATA_ROW + i;
            Long orderId = parseOrderId(cellAt(cells, LedgerColumns.ORDER_ID));
            if (orderId == null) {
                continue;
            }
            if (rows.containsKey(orderId)) {
                logger.warn("Order {} appears again on row {}; keeping row {}.",
                        orderId, rowIndex, rows.get(orderId).rowIndex());
                continue;
            }
            rows.put(orderId, new LedgerRow(
                    rowIndex,
                    orderId,
                    cellAt(cells, LedgerColumns.CURRENT_STAGE),
                    cellAt(cells, LedgerColumns.WHATSAPP_STATUS),
                    cellAt(cells, LedgerColumns.DELIVERY_STATUS),
                    cellAt(cells, LedgerColumns.AI_ALERT)));
        }
        logger.info("Read {} ledger rows from {}.", rows.size(), sheetName);
        return rows;
    }

    @Override
    public void applyBatch(List<LedgerMutation> mutations) {
        if (mutations == null || mutations.isEmpty()) {
            return;
        }
        List<Request> requests = toRequests(mutations);
        writeLock.lock();
        try {
            sheets.spreadsheets()
                    .batchUpdate(spreadsheetId, new BatchUpdateSpreadsheetRequest().setRequests(requests))
                    .execute();
            logger.info("Applied batch of {} ledger mutations ({} requests).", mutations.size(), requests.size());
        } catch (IOException e) {
            throw new SyncException("Failed to apply batch of " + mutations.size() + " ledger mutations", e);
        } finally {
            writeLock.unlock();
        }
    }

    List<Request> toRequests(List<LedgerMutation> mutations) {
        List<Request> requests = new ArrayList<>();
        for (LedgerMutation mutation : mutations) {
            if (mutation.type() == LedgerMutation.Type.APPEND) {
                boolean colored = mutation.color() != null;
                requests.add(new Request().setAppendCells(new AppendCellsRequest()
                        .setSheetId(sheetId)
                        .setRows(List.of(rowData(mutation)))
                        .setFields(colored ? VALUE_FIELDS + "," + BACKGROUND_FIELDS : VALUE_FIELDS)));
                continue;
            }
            GridRange row = rowRange(mutation.rowIndex());
            requests.add(new Request().setUpdateCells(new UpdateCellsRequest()
                    .setRange(row)
                    .setRows(List.of(rowData(mutation)))
                    .setFields(VALUE_FIELDS)));
            if (mutation.color() != null) {
                requests.add(new Request().setRepeatCell(new RepeatCellRequest()
                        .setRange(row)
                        .setCell(new CellData().setUserEnteredFormat(background(mutation.color())))
                        .setFields(BACKGROUND_FIELDS)));
            }
        }
        return requests;
    }

    private RowData rowData(LedgerMutation mutation) {
        List<CellData> cells = new ArrayList<>(LedgerColumns.COUNT);
        CellFormat format = mutation.color() != null ? background(mutation.color()) : null;
        for (int column = 0; column < LedgerColumns.COUNT; column++) {
            ExtendedValue value = column == LedgerColumns.ORDER_ID
                    ? new ExtendedValue().setNumberValue((double) mutation.orderId())
                    : new ExtendedValue().setStringValue(mutation.cell(column));
            CellData cell = new CellData().setUserEnteredValue(value);
            if (format != null) {
                cell.setUserEnteredFormat(format);
            }
            cells.add(cell);
        }
        return new RowData().setValues(cells);
    }

    private GridRange rowRange(int rowIndex) {
        // GridRange is 0-based and end-exclusive; ledger row indices are 1-based
        return new GridRange()
                .setSheetId(sheetId)
                .setStartRowIndex(rowIndex - 1)
                .setEndRowIndex(rowIndex)
                .setStartColumnIndex(0)
                .setEndColumnIndex(LedgerColumns.COUNT);
    }

    private static CellFormat background(SeverityColor color) {
        return new CellFormat().setBackgroundColor(new Color()
                .setRed(color.getRed())
                .setGreen(color.getGreen())
                .setBlue(color.getBlue()));
    }

    private static String cellAt(List<Object> cells, int column) {
        if (cells == null || column >= cells.size() || cells.get(column) == null) {
            return "";
        }
        return String.valueOf(cells.get(column)).trim();
    }

    static Long parseOrderId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }
}
