package com.shopsync.ordersync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.shopsync.ordersync.model.Order;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShopifyOrdersResponse {
    private List<Order> orders = new ArrayList<>();
}
