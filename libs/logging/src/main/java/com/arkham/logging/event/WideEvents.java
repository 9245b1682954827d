package com.arkham.logging.event;

import com.arkham.logging.Diagnostics;
import com.arkham.logging.config.WideEventConfig;
import com.arkham.logging.metrics.PipelineMetrics;
import com.arkham.logging.sampling.SamplingStrategy;
import com.arkham.logging.sanitize.DataSanitizer;
import com.arkham.logging.tracing.TracingContext;

import java.time.Clock;
import java.util.function.LongSupplier;

/**
 * Opens wide events and routes finished ones through sampling to the emitter.
 * <p>
 * One instance is owned by the composition root (normally through
 * {@link com.arkham.logging.LoggingManager}) and shared by every caller that records operations.
 * Emission faults are reported to {@link Diagnostics} and never reach the caller.
 */
public final class WideEvents {

    /** Logger name kept wide events are written to. */
    public static final String LOGGER_NAME = "arkham.wide_event";

    private final boolean enabled;
    private final SamplingStrategy sampler;
    private final DataSanitizer sanitizer;
    private final WideEventEmitter emitter;
    private final TracingContext tracing;
    private final PipelineMetrics metrics;
    private final Diagnostics diagnostics;
    private final Clock clock;
    private final LongSupplier ticker;

    private WideEvents(Builder builder) {
        this.sampler = builder.sampler != null ? builder.sampler : new SamplingStrategy(WideEventConfig.defaults());
        this.enabled = sampler.config().enabled();
        this.sanitizer = builder.sanitizer;
        this.emitter = builder.emitter;
        this.tracing = builder.tracing;
        this.metrics = builder.metrics;
        this.diagnostics = builder.diagnostics;
        this.clock = builder.clock;
        this.ticker = builder.ticker;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens an event for {@code service} using the ambient trace id, or a fresh one.
     */
    public WideEventBuilder open(String service) {
        return open(service, null);
    }

    /**
     * Opens an event for {@code service}. The trace id is {@code traceId} when given, else the
     * ambient trace id, else a newly generated one.
     */
    public WideEventBuilder open(String service, String traceId) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        String resolved = traceId != null && !traceId.isBlank()
                ? traceId
                : tracing.get().orElseGet(TracingContext::newTraceId);
        Boolean headDraw = sampler.isHeadSampling() ? sampler.draw() : null;
        return new WideEventBuilder(this, service, resolved, clock.instant(), ticker.getAsLong(), headDraw);
    }

    public DataSanitizer sanitizer() {
        return sanitizer;
    }

    public SamplingStrategy sampler() {
        return sampler;
    }

    public TracingContext tracing() {
        return tracing;
    }

    long nowNanos() {
        return ticker.getAsLong();
    }

    /**
     * Samples a finished event and emits it when kept.
     *
     * @param headDraw draw taken at open time, or null under tail sampling
     */
    void complete(WideEvent event, Boolean headDraw) {
        if (!enabled) {
            return;
        }
        try {
            boolean kept = headDraw == null
                    ? sampler.shouldSample(event)
                    : sampler.shouldSample(event, headDraw);
            metrics.recordWideEvent(event.outcome().value(), kept);
            if (kept) {
                emitter.emit(event);
            }
        } catch (RuntimeException e) {
            diagnostics.report("Failed to emit wide event " + event.operationId() + " for " + event.service(), e);
        }
    }

    /**
     * Builder for {@link WideEvents}. Only the emitter is required.
     */
    public static final class Builder {

        private SamplingStrategy sampler;
        private DataSanitizer sanitizer = DataSanitizer.defaults();
        private WideEventEmitter emitter;
        private TracingContext tracing = new TracingContext();
        private PipelineMetrics metrics;
        private Diagnostics diagnostics = Diagnostics.stderr();
        private Clock clock = Clock.systemUTC();
        private LongSupplier ticker = System::nanoTime;

        private Builder() {
        }

        public Builder sampler(SamplingStrategy sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder sanitizer(DataSanitizer sanitizer) {
            this.sanitizer = sanitizer;
            return this;
        }

        public Builder emitter(WideEventEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        public Builder tracing(TracingContext tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder diagnostics(Diagnostics diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Monotonic nanosecond source used for durations. */
        public Builder ticker(LongSupplier ticker) {
            this.ticker = ticker;
            return this;
        }

        public WideEvents build() {
            if (emitter == null) {
                throw new IllegalArgumentException("emitter must not be null");
            }
            if (sanitizer == null || tracing == null || diagnostics == null || clock == null || ticker == null) {
                throw new IllegalArgumentException("sanitizer, tracing, diagnostics, clock and ticker must not be null");
            }
            if (metrics == null) {
                metrics = PipelineMetrics.standalone("wide-events");
            }
            return new WideEvents(this);
        }
    }
}
