package com.arkham.orders.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Body of {@code POST /api/v1/orders}.
 *
 * @param customerId ordering customer. Required.
 * @param sku product to reserve. Required.
 * @param quantity units to reserve; must be positive.
 * @param customerEmail optional contact address; it is masked before it reaches any log.
 */
public record CreateOrderRequest(
        @NotBlank String customerId,
        @NotBlank String sku,
        @Positive int quantity,
        String customerEmail) {}
