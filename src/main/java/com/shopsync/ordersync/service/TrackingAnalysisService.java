package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.NormalizedContent;
import com.shopsync.ordersync.model.Order;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetch, normalize and classify the tracking payload of a shipped order.
 */
@Service
public class TrackingAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(TrackingAnalysisService.class);

    private final TrackingPageFetcher trackingPageFetcher;
    private final ContentNormalizer contentNormalizer;
    private final TrackingClassifier trackingClassifier;
    private final TaskExecutor classifierExecutor;
    private final long timeoutSeconds;

    public TrackingAnalysisService(TrackingPageFetcher trackingPageFetcher,
                                   ContentNormalizer contentNormalizer,
                                   TrackingClassifier trackingClassifier,
                                   @Qualifier("classifierExecutor") TaskExecutor classifierExecutor,
                                   @Value("${app.classifier.timeout-seconds:60}") long timeoutSeconds) {
        this.trackingPageFetcher = trackingPageFetcher;
        this.contentNormalizer = contentNormalizer;
        this.trackingClassifier = trackingClassifier;
        this.classifierExecutor = classifierExecutor;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    /**
     * @return empty when the order has no tracking URL yet
     * @throws TrackingFetchException when the tracking payload cannot be downloaded
     */
    public Optional<TrackingAnalysisResult> analyze(Order order) {
        Optional<String> trackingUrl = order.firstTrackingUrl();
        if (trackingUrl.isEmpty()) {
            logger.info("Order {} is fulfilled but has no tracking URL yet.", order.getName());
            return Optional.empty();
        }
        return Optional.of(analyzeUrl(trackingUrl.get()));
    }

    public TrackingAnalysisResult analyzeUrl(String trackingUrl) {
        logger.info("Downloading tracking payload: {}", trackingUrl);
        String payload = trackingPageFetcher.fetch(trackingUrl);
        NormalizedContent content = contentNormalizer.analyze(payload);
        logger.debug("Tracking payload {} normalized as {} ({} -> {} chars)",
                trackingUrl, content.contentType(), content.originalLength(), content.length());
        TrackingAnalysisResult result = classifyWithTimeout(content.text());
        if (result.errorMessage() != null) {
            logger.warn("Tracking classification for {} degraded: {}", trackingUrl, result.errorMessage());
        }
        return result;
    }

    TrackingAnalysisResult classifyWithTimeout(String normalizedText) {
        CompletableFuture<TrackingAnalysisResult> future =
                CompletableFuture.supplyAsync(() -> trackingClassifier.classify(normalizedText), classifierExecutor);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return TrackingAnalysisResult.unclassified("Classifier timed out after " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TrackingAnalysisResult.unclassified("Interrupted while waiting for the classifier");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ThrottledException) {
                return TrackingAnalysisResult.unclassified("Classifier throttled: " + cause.getMessage());
            }
            logger.error("Tracking classifier failed: {}", cause.getMessage(), cause);
            return TrackingAnalysisResult.unclassified("Classifier failure: " + cause.getMessage());
        }
    }
}
