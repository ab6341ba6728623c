package com.shopsync.ordersync.repository;

import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.model.BatchUpdateSpreadsheetRequest;
import com.google.api.services.sheets.v4.model.CellData;
import com.google.api.services.sheets.v4.model.GridRange;
import com.google.api.services.sheets.v4.model.Request;
import com.shopsync.ordersync.model.LedgerMutation;
import com.shopsync.ordersync.model.LedgerRow;
import com.shopsync.ordersync.model.Scenario;
import com.shopsync.ordersync.model.SeverityColor;
import com.shopsync.ordersync.service.SyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoogleSheetsLedgerStoreTest {

    private static final String SPREADSHEET_ID = "sheet-123";

    @Mock
    private Sheets sheets;

    @Mock
    private Sheets.Spreadsheets spreadsheets;

    @Mock
    private Sheets.Spreadsheets.BatchUpdate batchUpdate;

    private GoogleSheetsLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new GoogleSheetsLedgerStore(sheets, SPREADSHEET_ID, "Orders", 7);
    }

    @Test
    void rowsAreKeyedByOrderIdWithStableIndices() {
        List<List<Object>> values = List.of(
                cells(new BigDecimal("5001"), "#5001", "2024-05-01 10:00", "Ayesha Khan", "", "", "", "",
                        "Awaiting Phone Call", "Confirmed", "Not Shipped", "Call customer"),
                cells("", "#blank"),
                cells(5002.0, "#5002", "", "", "", "", "", "", "Shipped"));

        Map<Long, LedgerRow> rows = store.toRows(values);

        assertThat(rows).containsOnlyKeys(5001L, 5002L);
        LedgerRow first = rows.get(5001L);
        assertThat(first.rowIndex()).isEqualTo(2);
        assertThat(first.currentStage()).isEqualTo("Awaiting Phone Call");
        assertThat(first.aiAlert()).isEqualTo("Call customer");
        LedgerRow sparse = rows.get(5002L);
        assertThat(sparse.rowIndex()).isEqualTo(4);
        assertThat(sparse.currentStage()).isEqualTo("Shipped");
        assertThat(sparse.deliveryStatus()).isEmpty();
    }

    @Test
    void duplicateOrderIdKeepsFirstRow() {
        Map<Long, LedgerRow> rows = store.toRows(List.of(
                cells("77", "#77", "", "", "", "", "", "", "Order Received"),
                cells("77", "#77", "", "", "", "", "", "", "Shipped")));

        assertThat(rows.get(77L).rowIndex()).isEqualTo(2);
        assertThat(rows.get(77L).currentStage()).isEqualTo("Order Received");
    }

    @Test
    void emptySheetHasNoRows() {
        assertThat(store.toRows(null)).isEmpty();
        assertThat(store.toRows(List.of())).isEmpty();
    }

    @Test
    void parsesOnlyWholeNumberIds() {
        assertThat(GoogleSheetsLedgerStore.parseOrderId(" 5123456789 ")).isEqualTo(5123456789L);
        assertThat(GoogleSheetsLedgerStore.parseOrderId("5.123456789E9")).isEqualTo(5123456789L);
        assertThat(GoogleSheetsLedgerStore.parseOrderId("12.5")).isNull();
        assertThat(GoogleSheetsLedgerStore.parseOrderId("#1001")).isNull();
        assertThat(GoogleSheetsLedgerStore.parseOrderId(null)).isNull();
    }

    @Test
    void appendWritesValuesAndBackgroundTogether() {
        LedgerMutation append = LedgerMutation.append(9, Scenario.NEW_ORDER, fullRow("9"), SeverityColor.YELLOW);

        List<Request> requests = store.toRequests(List.of(append));

        assertThat(requests).hasSize(1);
        Request request = requests.get(0);
        assertThat(request.getAppendCells().getSheetId()).isEqualTo(7);
        assertThat(request.getAppendCells().getFields()).isEqualTo("userEnteredValue,userEnteredFormat.backgroundColor");
        List<CellData> written = request.getAppendCells().getRows().get(0).getValues();
        assertThat(written).hasSize(12);
        assertThat(written.get(0).getUserEnteredValue().getNumberValue()).isEqualTo(9.0);
        assertThat(written.get(8).getUserEnteredValue().getStringValue()).isEqualTo("col8");
        assertThat(written.get(8).getUserEnteredFormat().getBackgroundColor().getRed()).isEqualTo(1f);
    }

    @Test
    void updateAddressesItsRowAndRecoloursSeparately() {
        LedgerMutation update = LedgerMutation.update(5, 9, Scenario.TRACK_PARCEL, fullRow("9"), SeverityColor.RED);
        LedgerMutation plain = LedgerMutation.update(6, 10, Scenario.UPDATE_ONLY, fullRow("10"), null);

        List<Request> requests = store.toRequests(List.of(update, plain));

        assertThat(requests).hasSize(3);
        GridRange range = requests.get(0).getUpdateCells().getRange();
        assertThat(range.getSheetId()).isEqualTo(7);
        assertThat(range.getStartRowIndex()).isEqualTo(4);
        assertThat(range.getEndRowIndex()).isEqualTo(5);
        assertThat(range.getEndColumnIndex()).isEqualTo(12);
        assertThat(requests.get(0).getUpdateCells().getFields()).isEqualTo("userEnteredValue");
        assertThat(requests.get(1).getRepeatCell().getFields()).isEqualTo("userEnteredFormat.backgroundColor");
        assertThat(requests.get(1).getRepeatCell().getRange()).isEqualTo(range);
        assertThat(requests.get(2).getUpdateCells().getRange().getStartRowIndex()).isEqualTo(5);
    }

    @Test
    void batchIsSentAsOneSpreadsheetUpdate() throws IOException {
        when(sheets.spreadsheets()).thenReturn(spreadsheets);
        when(spreadsheets.batchUpdate(eq(SPREADSHEET_ID), any(BatchUpdateSpreadsheetRequest.class))).thenReturn(batchUpdate);

        store.applyBatch(List.of(
                LedgerMutation.append(1, Scenario.NEW_ORDER, fullRow("1"), SeverityColor.YELLOW),
                LedgerMutation.append(2, Scenario.NEW_ORDER, fullRow("2"), SeverityColor.YELLOW)));

        ArgumentCaptor<BatchUpdateSpreadsheetRequest> captor = ArgumentCaptor.forClass(BatchUpdateSpreadsheetRequest.class);
        verify(spreadsheets).batchUpdate(eq(SPREADSHEET_ID), captor.capture());
        assertThat(captor.getValue().getRequests()).hasSize(2);
        verify(batchUpdate).execute();
    }

    @Test
    void failedBatchSurfacesAsSyncFailure() throws IOException {
        when(sheets.spreadsheets()).thenReturn(spreadsheets);
        when(spreadsheets.batchUpdate(eq(SPREADSHEET_ID), any(BatchUpdateSpreadsheetRequest.class))).thenReturn(batchUpdate);
        when(batchUpdate.execute()).thenThrow(new IOException("Quota exceeded"));

        List<LedgerMutation> batch = List.of(LedgerMutation.append(1, Scenario.NEW_ORDER, fullRow("1"), null));

        assertThatThrownBy(() -> store.applyBatch(batch))
                .isInstanceOf(SyncException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void emptyBatchIsNotSent() {
        store.applyBatch(List.of());

        verifyNoInteractions(sheets);
    }

    private static List<Object> cells(Object... values) {
        return new ArrayList<>(Arrays.asList(values));
    }

    private static List<String> fullRow(String orderId) {
        List<String> cells = new ArrayList<>();
        cells.add(orderId);
        for (int column = 1; column < 12; column++) {
            cells.add("col" + column);
        }
        return cells;
    }
}
