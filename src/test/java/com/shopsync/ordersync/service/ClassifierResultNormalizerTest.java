package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.SeverityColor;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierResultNormalizerTest {

    private final ClassifierResultNormalizer normalizer = new ClassifierResultNormalizer();

    @ParameterizedTest
    @CsvSource({
            "Package was DELIVERED today, Delivered",
            "delivered, Delivered",
            "Shipment in transit to Lahore, In-Transit",
            "IN-TRANSIT, In-Transit",
            "Parcel stuck at hub, Stuck",
            "Delayed due to weather, Stuck",
            "On hold, Stuck",
            "Delivery failed, Failed",
            "Unsuccessful attempt, Failed",
            "Order cancelled, Failed",
            "Returned to shipper, Return",
            "Customer phone switched off, Customer Not Picking Phone",
            "Consignee unreachable, Customer Not Picking Phone"
    })
    void normalizesStatusByKeyword(String raw, String expected) {
        assertThat(normalizer.normalizeStatus(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankStatusIsOptimisticallyInTransit(String raw) {
        assertThat(normalizer.normalizeStatus(raw)).isEqualTo("In-Transit");
    }

    @Test
    void unrecognizedStatusPassesThroughVerbatim() {
        assertThat(normalizer.normalizeStatus("Awaiting Customs Clearance")).isEqualTo("Awaiting Customs Clearance");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Green", "dark GREEN", "yellow", "Orange", "RED", "purple", "", " ", "rgb(1,2,3)", "reddish-orange"})
    void colourIsAlwaysFromTheFixedPalette(String raw) {
        assertThat(normalizer.normalizeColor(raw)).isIn(Set.of("Green", "Yellow", "Orange", "Red"));
    }

    @Test
    void nullOrUnknownColourIsYellow() {
        assertThat(normalizer.normalizeColor(null)).isEqualTo("Yellow");
        assertThat(normalizer.toSeverity("blue")).isEqualTo(SeverityColor.YELLOW);
        assertThat(normalizer.toSeverity("Red")).isEqualTo(SeverityColor.RED);
    }

    @Test
    void normalizeKeepsErrorMessage() {
        TrackingAnalysisResult result = normalizer.normalize("", "", "partial verdict");

        assertThat(result.status()).isEqualTo("In-Transit");
        assertThat(result.color()).isEqualTo("Yellow");
        assertThat(result.errorMessage()).isEqualTo("partial verdict");
    }
}
