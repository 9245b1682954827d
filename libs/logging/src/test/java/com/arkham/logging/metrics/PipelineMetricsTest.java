package com.arkham.logging.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PipelineMetrics")
class PipelineMetricsTest {

    @Test
    @DisplayName("should count drops and failures per sink")
    void shouldCountPerSink() {
        PipelineMetrics metrics = PipelineMetrics.standalone("main");

        metrics.recordDropped("file");
        metrics.recordDropped("file");
        metrics.recordWriteFailure("error_file");

        assertThat(metrics.count(PipelineMetrics.RECORDS_DROPPED, PipelineMetrics.TAG_SINK, "file")).isEqualTo(2.0);
        assertThat(metrics.count(PipelineMetrics.WRITE_FAILURES, PipelineMetrics.TAG_SINK, "error_file")).isEqualTo(1.0);
        assertThat(metrics.count(PipelineMetrics.RECORDS_DROPPED, PipelineMetrics.TAG_SINK, "console")).isZero();
    }

    @Test
    @DisplayName("should split wide events into kept and discarded")
    void shouldCountWideEvents() {
        PipelineMetrics metrics = PipelineMetrics.standalone("main");

        metrics.recordWideEvent("success", true);
        metrics.recordWideEvent("success", false);
        metrics.recordWideEvent("error", true);

        assertThat(metrics.count(PipelineMetrics.WIDE_EVENTS_KEPT, PipelineMetrics.TAG_OUTCOME, "success")).isEqualTo(1.0);
        assertThat(metrics.count(PipelineMetrics.WIDE_EVENTS_DISCARDED, PipelineMetrics.TAG_OUTCOME, "success")).isEqualTo(1.0);
        assertThat(metrics.count(PipelineMetrics.WIDE_EVENTS_KEPT, PipelineMetrics.TAG_OUTCOME, "error")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep pipelines apart in a shared registry")
    void shouldSeparatePipelines() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PipelineMetrics first = new PipelineMetrics(registry, "first");
        PipelineMetrics second = new PipelineMetrics(registry, "second");

        first.recordDropped("file");

        assertThat(first.count(PipelineMetrics.RECORDS_DROPPED, PipelineMetrics.TAG_SINK, "file")).isEqualTo(1.0);
        assertThat(second.count(PipelineMetrics.RECORDS_DROPPED, PipelineMetrics.TAG_SINK, "file")).isZero();
        assertThat(registry.find(PipelineMetrics.RECORDS_DROPPED).counters()).hasSize(1);
    }

    @Test
    @DisplayName("should reject missing registry or blank pipeline")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> new PipelineMetrics(null, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineMetrics(new SimpleMeterRegistry(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
