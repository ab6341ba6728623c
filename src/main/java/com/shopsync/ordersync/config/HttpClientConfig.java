package com.shopsync.ordersync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Value("${app.tracking.http.connect-timeout-seconds:10}")
    private long trackingConnectTimeoutSeconds;

    @Value("${app.tracking.http.read-timeout-seconds:30}")
    private long trackingReadTimeoutSeconds;

    @Value("${shopify.http.read-timeout-seconds:60}")
    private long shopifyReadTimeoutSeconds;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("trackingRestTemplate")
    public RestTemplate trackingRestTemplate(RestTemplateBuilder builder) {
        // some courier pages refuse requests without a browser-like agent
        return builder
                .setConnectTimeout(Duration.ofSeconds(trackingConnectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(trackingReadTimeoutSeconds))
                .defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (compatible; OrderSync/1.0)")
                .build();
    }

    @Bean("shopifyRestTemplate")
    public RestTemplate shopifyRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(trackingConnectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(shopifyReadTimeoutSeconds))
                .build();
    }
}
