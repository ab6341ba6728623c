package com.shopsync.ordersync.config;

import com.shopsync.ordersync.model.CourierApiConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered courier API list bound from {@code app.courier-apis[n].*}.
 */
@ConfigurationProperties(prefix = "app")
public class CourierApiProperties {

    private List<CourierApiConfig> courierApis = new ArrayList<>();

    public List<CourierApiConfig> getCourierApis() {
        return courierApis;
    }

    public void setCourierApis(List<CourierApiConfig> courierApis) {
        this.courierApis = courierApis == null ? new ArrayList<>() : courierApis;
    }
}
