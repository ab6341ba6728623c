package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.TrackingAnalysisResult;

/**
 * Maps normalized tracking text to a delivery verdict. Model lifecycle belongs to the implementation.
 */
public interface TrackingClassifier {

    /**
     * @throws ThrottledException when the backing model keeps rejecting calls after retries
     */
    TrackingAnalysisResult classify(String normalizedText);
}
