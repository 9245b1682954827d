package com.arkham.orders.domain;

import java.time.Instant;

/** A placed order. Orders are immutable once stored. */
public record Order(
        String id,
        String customerId,
        String sku,
        int quantity,
        OrderStatus status,
        Instant createdAt) {}
