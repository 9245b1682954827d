package com.arkham.orders;

import com.arkham.orders.config.OrdersServiceProperties;
import com.arkham.orders.config.WideEventLoggingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Orders service: reference Spring Boot application wired to the Arkham wide-event pipeline.
 *
 * <p>The application context is the composition root. It builds one {@code LoggingManager}
 * ({@link com.arkham.orders.config.WideEventLoggingConfiguration}), scopes a trace id to every
 * HTTP request ({@link com.arkham.orders.infrastructure.web.TraceIdFilter}) and records each
 * order operation as a single wide event.
 */
@SpringBootApplication
@EnableConfigurationProperties({OrdersServiceProperties.class, WideEventLoggingProperties.class})
public class OrdersServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(OrdersServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrdersServiceApplication.class, args);
        log.info("Orders service started");
    }
}
