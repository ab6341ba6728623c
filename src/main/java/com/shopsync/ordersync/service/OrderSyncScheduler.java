package com.shopsync.ordersync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Periodic sync over the last {@code app.sync.lookback-days}. Disabled unless
 * {@code app.sync.schedule.enabled=true}.
 */
@Component
public class OrderSyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(OrderSyncScheduler.class);

    private final OrderSyncService orderSyncService;
    private final Clock clock;
    private final boolean enabled;
    private final int lookbackDays;

    public OrderSyncScheduler(OrderSyncService orderSyncService,
                              Clock clock,
                              @Value("${app.sync.schedule.enabled:false}") boolean enabled,
                              @Value("${app.sync.lookback-days:30}") int lookbackDays) {
        this.orderSyncService = orderSyncService;
        this.clock = clock;
        this.enabled = enabled;
        this.lookbackDays = Math.max(1, lookbackDays);
    }

    @Scheduled(cron = "${app.sync.schedule.cron:0 */30 * * * *}")
    public void runScheduledSync() {
        if (!enabled) {
            return;
        }
        OffsetDateTime end = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime start = end.minusDays(lookbackDays);
        try {
            orderSyncService.sync(start, end);
        } catch (SyncAlreadyRunningException e) {
            logger.info("Skipping scheduled sync: {}", e.getMessage());
        } catch (SyncException e) {
            logger.error("Scheduled sync failed: {}", e.getMessage());
        }
    }
}
