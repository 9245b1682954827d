package com.arkham.logging.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wide-event and sampling settings, bound from {@code frame.logging.wide_events}.
 *
 * @param enabled              whether finished events are emitted at all (default true)
 * @param samplingRate         keep probability for events no rule forces (0.0 to 1.0, default 1.0)
 * @param tailSampling         draw after the operation finishes (default true); false draws when it opens
 * @param alwaysSampleErrors   keep error outcomes and status codes of 500 and above (default true)
 * @param alwaysSampleSlow     keep events slower than {@code slowThresholdMs} (default true)
 * @param slowThresholdMs      slow threshold in milliseconds (default 2000)
 * @param alwaysSampleUsers    user ids that are always kept
 * @param alwaysSampleProjects project ids that are always kept
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WideEventConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("sampling_rate") Double samplingRate,
        @JsonProperty("tail_sampling") Boolean tailSampling,
        @JsonProperty("always_sample_errors") Boolean alwaysSampleErrors,
        @JsonProperty("always_sample_slow") Boolean alwaysSampleSlow,
        @JsonProperty("slow_threshold_ms") Integer slowThresholdMs,
        @JsonProperty("always_sample_users") List<String> alwaysSampleUsers,
        @JsonProperty("always_sample_projects") List<String> alwaysSampleProjects
) {

    public static final int DEFAULT_SLOW_THRESHOLD_MS = 2000;

    public WideEventConfig {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (samplingRate == null) {
            samplingRate = 1.0;
        }
        if (samplingRate.isNaN() || samplingRate < 0.0 || samplingRate > 1.0) {
            throw new IllegalArgumentException("samplingRate must be between 0.0 and 1.0, was " + samplingRate);
        }
        if (tailSampling == null) {
            tailSampling = Boolean.TRUE;
        }
        if (alwaysSampleErrors == null) {
            alwaysSampleErrors = Boolean.TRUE;
        }
        if (alwaysSampleSlow == null) {
            alwaysSampleSlow = Boolean.TRUE;
        }
        if (slowThresholdMs == null || slowThresholdMs < 0) {
            slowThresholdMs = DEFAULT_SLOW_THRESHOLD_MS;
        }
        alwaysSampleUsers = alwaysSampleUsers == null ? List.of() : List.copyOf(alwaysSampleUsers);
        alwaysSampleProjects = alwaysSampleProjects == null ? List.of() : List.copyOf(alwaysSampleProjects);
    }

    /**
     * Returns the default wide-event settings.
     */
    public static WideEventConfig defaults() {
        return new WideEventConfig(null, null, null, null, null, null, null, null);
    }
}
