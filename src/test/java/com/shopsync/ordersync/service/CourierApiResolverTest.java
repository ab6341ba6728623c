package com.shopsync.ordersync.service;

import com.shopsync.ordersync.config.CourierApiProperties;
import com.shopsync.ordersync.model.CourierApiConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CourierApiResolverTest {

    private CourierApiProperties properties;
    private CourierApiResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new CourierApiProperties();
        properties.setCourierApis(new ArrayList<>(List.of(
                new CourierApiConfig("Leopards", "leopardscourier.com",
                        "https://api.leopards.test/track?cn={trackingId}", List.of("cn", "track_numbers"), true),
                new CourierApiConfig("PostEx", "postex.pk",
                        "https://api.postex.test/track-order/{trackingId}", List.of("trackingNumber"), true))));
        resolver = new CourierApiResolver(properties);
    }

    @Test
    void trackingIdFromQueryParameter() {
        assertThat(resolver.resolveEndpoint("https://www.leopardscourier.com/tracking?cn=LE7788990"))
                .contains("https://api.leopards.test/track?cn=LE7788990");
    }

    @Test
    void laterQueryParameterNameIsTriedWhenFirstIsMissing() {
        assertThat(resolver.resolveEndpoint("https://LeopardsCourier.com/t?track_numbers=LE123456&x=1"))
                .contains("https://api.leopards.test/track?cn=LE123456");
    }

    @Test
    void trackingIdFromLastPathSegment() {
        assertThat(resolver.resolveEndpoint("https://postex.pk/tracking/CX998877/"))
                .contains("https://api.postex.test/track-order/CX998877");
    }

    @Test
    void shortPathSegmentIsNotAnId() {
        assertThat(resolver.resolveEndpoint("https://postex.pk/track/abc12")).isEmpty();
    }

    @Test
    void unknownCourierFallsBackToDirectFetch() {
        assertThat(resolver.resolveEndpoint("https://tcs.example.com/track/123456789")).isEmpty();
        assertThat(resolver.resolveEndpoint("  ")).isEmpty();
    }

    @Test
    void disabledCourierIsSkipped() {
        properties.getCourierApis().get(1).setEnabled(false);

        assertThat(resolver.resolveEndpoint("https://postex.pk/tracking/CX998877")).isEmpty();
    }

    @Test
    void firstEnabledMatchWins() {
        properties.getCourierApis().add(0, new CourierApiConfig("Aggregator", "postex",
                "https://agg.test/{trackingId}", List.of(), true));

        assertThat(resolver.resolveEndpoint("https://postex.pk/tracking/CX998877"))
                .contains("https://agg.test/CX998877");
    }
}
