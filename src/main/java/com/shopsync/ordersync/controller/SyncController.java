package com.shopsync.ordersync.controller;

import com.shopsync.ordersync.dto.SyncProgressResponse;
import com.shopsync.ordersync.dto.SyncRequest;
import com.shopsync.ordersync.dto.SyncSummary;
import com.shopsync.ordersync.service.OrderSyncService;
import com.shopsync.ordersync.service.SyncAlreadyRunningException;
import com.shopsync.ordersync.service.SyncException;
import com.shopsync.ordersync.service.SyncProgressService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

@RestController
@RequestMapping("/api/sync")
@Tag(name = "Order Sync", description = "Reconcile Shopify orders into the order ledger")
public class SyncController {

    private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

    private final OrderSyncService orderSyncService;
    private final SyncProgressService progressService;
    private final Clock clock;
    private final int lookbackDays;

    public SyncController(OrderSyncService orderSyncService,
                          SyncProgressService progressService,
                          Clock clock,
                          @Value("${app.sync.lookback-days:30}") int lookbackDays) {
        this.orderSyncService = orderSyncService;
        this.progressService = progressService;
        this.clock = clock;
        this.lookbackDays = Math.max(1, lookbackDays);
    }

    @Operation(
            summary = "Run a sync pass",
            description = "Fetches orders created in the given date range (inclusive, UTC), resolves each order's " +
                    "stage and writes the ledger. Without a body the last lookback-days are synced."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sync finished",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = SyncSummary.class))),
            @ApiResponse(responseCode = "400", description = "Invalid date range", content = @Content),
            @ApiResponse(responseCode = "409", description = "Another sync is already running", content = @Content),
            @ApiResponse(responseCode = "502", description = "Shopify or the ledger could not be reached", content = @Content)
    })
    @PostMapping
    public ResponseEntity<?> sync(@RequestBody(required = false) SyncRequest request) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate endDate = request != null && request.getEndDate() != null ? request.getEndDate() : today;
        LocalDate startDate = request != null && request.getStartDate() != null
                ? request.getStartDate()
                : endDate.minusDays(lookbackDays);

        OffsetDateTime start = startDate.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime end = endDate.plusDays(1).atStartOfDay().minusSeconds(1).atOffset(ZoneOffset.UTC);
        logger.info("Received sync request for {} .. {}", startDate, endDate);
        try {
            return ResponseEntity.ok(orderSyncService.sync(start, end));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (SyncAlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e.getMessage()));
        } catch (SyncException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "Progress of the running sync pass")
    @GetMapping("/progress")
    public ResponseEntity<SyncProgressResponse> progress() {
        return ResponseEntity.ok(progressService.snapshot());
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "" : message);
    }
}
