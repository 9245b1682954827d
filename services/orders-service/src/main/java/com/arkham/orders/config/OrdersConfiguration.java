package com.arkham.orders.config;

import com.arkham.logging.LoggingManager;
import com.arkham.orders.domain.InventoryGateway;
import com.arkham.orders.infrastructure.inventory.InMemoryInventoryGateway;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Domain wiring. The inventory gateway is proxied so every call becomes a wide event. */
@Configuration
public class OrdersConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InventoryGateway inventoryGateway(
            LoggingManager loggingManager, OrdersServiceProperties properties) {
        return loggingManager
                .serviceCalls()
                .proxy(
                        InventoryGateway.class,
                        new InMemoryInventoryGateway(properties.defaultStock()),
                        "InventoryGateway");
    }
}
