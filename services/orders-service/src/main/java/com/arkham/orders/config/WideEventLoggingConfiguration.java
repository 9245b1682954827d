package com.arkham.orders.config;

import com.arkham.logging.LoggingManager;
import com.arkham.logging.config.LoggingConfig;
import com.arkham.logging.config.LoggingConfigLoader;
import com.arkham.logging.operation.OperationLogger;
import com.arkham.logging.tracing.TracingContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the logging pipeline for the application context.
 *
 * <p>One {@link TracingContext} and one {@link LoggingManager} exist per context. The manager
 * shares the actuator {@link MeterRegistry} when there is one, so pipeline counters show up under
 * {@code /actuator/metrics}. Closing the context shuts the manager down, draining its file queues.
 */
@Configuration
public class WideEventLoggingConfiguration {

    @Bean
    public TracingContext tracingContext() {
        return new TracingContext();
    }

    @Bean
    public LoggingConfig loggingConfig(WideEventLoggingProperties properties) {
        return new LoggingConfigLoader().load(properties.configPath());
    }

    @Bean(destroyMethod = "shutdown")
    public LoggingManager loggingManager(
            LoggingConfig config,
            TracingContext tracing,
            WideEventLoggingProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry) {
        LoggingManager manager =
                LoggingManager.builder(config)
                        .tracing(tracing)
                        .meterRegistry(meterRegistry.getIfAvailable(SimpleMeterRegistry::new))
                        .build();
        if (properties.shutdownHook()) {
            manager.registerShutdownHook();
        }
        return manager;
    }

    @Bean
    public OperationLogger operationLogger(LoggingManager manager) {
        return manager.operations();
    }
}
