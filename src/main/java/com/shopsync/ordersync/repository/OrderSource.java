package com.shopsync.ordersync.repository;

import com.shopsync.ordersync.model.Order;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Commerce platform orders created within a date range.
 */
public interface OrderSource {

    List<Order> fetchOrders(OffsetDateTime createdAtMin, OffsetDateTime createdAtMax);
}
