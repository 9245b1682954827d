package com.arkham.orders.api;

import com.arkham.logging.LoggingManager;
import com.arkham.orders.config.OrdersServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runtime information, including which log sinks the pipeline has open. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final OrdersServiceProperties properties;
    private final LoggingManager loggingManager;

    public ServiceInfoController(
            OrdersServiceProperties properties, LoggingManager loggingManager) {
        this.properties = properties;
        this.loggingManager = loggingManager;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "log_sinks", loggingManager.sinkNames(),
                "sample_rate", loggingManager.config().wideEvents().samplingRate(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
