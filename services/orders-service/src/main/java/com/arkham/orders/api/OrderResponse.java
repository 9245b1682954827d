package com.arkham.orders.api;

import com.arkham.orders.domain.Order;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Order as returned by the API. */
public record OrderResponse(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("customer_id") String customerId,
        String sku,
        int quantity,
        String status,
        @JsonProperty("created_at") Instant createdAt) {

    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.id(),
                order.customerId(),
                order.sku(),
                order.quantity(),
                order.status().wireName(),
                order.createdAt());
    }
}
