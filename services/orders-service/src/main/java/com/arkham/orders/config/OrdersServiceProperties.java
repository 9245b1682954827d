package com.arkham.orders.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings bound from {@code arkham.service.*}.
 *
 * <pre>
 * arkham:
 *   service:
 *     name: orders-service
 *     environment: production
 *     default-stock: 100
 * </pre>
 *
 * @param name service name reported by the info endpoint. Required.
 * @param environment deployment environment (default {@code development}).
 * @param defaultStock units available per SKU in the in-memory inventory (default 100).
 */
@ConfigurationProperties(prefix = "arkham.service")
@Validated
public record OrdersServiceProperties(@NotBlank String name, String environment, int defaultStock) {

    public static final int DEFAULT_STOCK = 100;

    public OrdersServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (defaultStock <= 0) {
            defaultStock = DEFAULT_STOCK;
        }
    }
}
