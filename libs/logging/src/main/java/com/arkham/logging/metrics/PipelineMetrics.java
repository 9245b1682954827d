package com.arkham.logging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Micrometer counters describing the health of the logging pipeline itself.
 * <p>
 * Every meter carries a {@code pipeline} tag so that several managers in one process
 * (tests, multi-tenant hosts) stay distinguishable in a shared registry.
 */
public final class PipelineMetrics {

    public static final String RECORDS_DROPPED = "arkham.logging.records.dropped";
    public static final String WRITE_FAILURES = "arkham.logging.write.failures";
    public static final String WIDE_EVENTS_KEPT = "arkham.logging.wide_events.kept";
    public static final String WIDE_EVENTS_DISCARDED = "arkham.logging.wide_events.discarded";

    /** Tag key identifying the owning pipeline. */
    public static final String TAG_PIPELINE = "pipeline";

    /** Tag key carrying the sink name on sink counters. */
    public static final String TAG_SINK = "sink";

    /** Tag key carrying the event outcome on wide-event counters. */
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String pipeline;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the meter registry
     * @param pipeline name used for the {@code pipeline} tag
     */
    public PipelineMetrics(MeterRegistry registry, String pipeline) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (pipeline == null || pipeline.isBlank()) {
            throw new IllegalArgumentException("pipeline must not be null or blank");
        }
        this.registry = registry;
        this.pipeline = pipeline;
    }

    /**
     * Creates metrics on a private {@link SimpleMeterRegistry}, for hosts that supply none.
     */
    public static PipelineMetrics standalone(String pipeline) {
        return new PipelineMetrics(new SimpleMeterRegistry(), pipeline);
    }

    public void recordDropped(String sink) {
        counter(RECORDS_DROPPED, "Records dropped because a sink queue was full", TAG_SINK, sink).increment();
    }

    public void recordWriteFailure(String sink) {
        counter(WRITE_FAILURES, "Records a sink failed to write", TAG_SINK, sink).increment();
    }

    public void recordWideEvent(String outcome, boolean kept) {
        if (kept) {
            counter(WIDE_EVENTS_KEPT, "Wide events kept by the sampler", TAG_OUTCOME, outcome).increment();
        } else {
            counter(WIDE_EVENTS_DISCARDED, "Wide events discarded by the sampler", TAG_OUTCOME, outcome).increment();
        }
    }

    /**
     * Returns the current count of a counter, or zero when it was never incremented.
     */
    public double count(String name, String tagKey, String tagValue) {
        Counter counter = registry.find(name)
                .tag(TAG_PIPELINE, pipeline)
                .tag(tagKey, tagValue)
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String pipeline() {
        return pipeline;
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag(TAG_PIPELINE, pipeline)
                .tag(tagKey, tagValue == null ? "unknown" : tagValue)
                .register(registry);
    }
}
