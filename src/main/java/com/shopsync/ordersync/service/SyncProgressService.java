package com.shopsync.ordersync.service;

import com.shopsync.ordersync.dto.SyncProgressResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SyncProgressService {

    private static final Logger logger = LoggerFactory.getLogger(SyncProgressService.class);

    private static class Progress {
        final String runId;
        final int expected;
        final AtomicInteger processed = new AtomicInteger(0);

        Progress(String runId, int expected) {
            this.runId = runId;
            this.expected = expected;
        }
    }

    private final AtomicReference<Progress> current = new AtomicReference<>();

    public void startTracking(String runId, int expected) {
        if (runId == null) {
            return;
        }
        current.set(new Progress(runId, Math.max(expected, 0)));
        logger.info("Sync progress tracking started for {} ({} orders).", runId, expected);
    }

    public void increment(String runId, String label) {
        Progress progress = current.get();
        if (progress == null || !progress.runId.equals(runId)) {
            return;
        }
        int processed = progress.processed.incrementAndGet();
        if (logger.isDebugEnabled()) {
            logger.debug("Sync progress for {}: processed {}/{} ({} remaining){}",
                    runId,
                    processed,
                    progress.expected,
                    Math.max(progress.expected - processed, 0),
                    label != null ? " - " + label : "");
        }
    }

    public void complete(String runId) {
        Progress progress = current.get();
        if (progress != null && progress.runId.equals(runId) && current.compareAndSet(progress, null)) {
            logger.info("Sync progress completed for {} (processed {}/{}).",
                    runId,
                    progress.processed.get(),
                    progress.expected);
        }
    }

    public SyncProgressResponse snapshot() {
        Progress progress = current.get();
        if (progress == null) {
            return SyncProgressResponse.idle();
        }
        int processed = progress.processed.get();
        double percentage = progress.expected == 0
                ? 100.0
                : Math.min(100.0, Math.round(processed * 1000.0 / progress.expected) / 10.0);
        return new SyncProgressResponse(true, progress.runId, processed, progress.expected, percentage);
    }
}
