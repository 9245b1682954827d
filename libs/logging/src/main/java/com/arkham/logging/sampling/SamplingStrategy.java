package com.arkham.logging.sampling;

import com.arkham.logging.config.WideEventConfig;
import com.arkham.logging.event.Outcome;
import com.arkham.logging.event.WideEvent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a finished wide event is kept.
 * <p>
 * Rules are checked in order; the first that matches keeps the event:
 * <ol>
 *   <li>errors: outcome is error, or the status code is 500 or above</li>
 *   <li>slow operations: duration above the slow threshold</li>
 *   <li>allowlisted users, by {@code id} or {@code user_id} in the user section</li>
 *   <li>allowlisted projects, by the project id or the {@code project_id} context entry</li>
 *   <li>otherwise a uniform random draw against the sampling rate</li>
 * </ol>
 * With tail sampling the draw happens here, after the operation finished. With head sampling
 * the builder draws once when it opens ({@link #draw()}) and passes that result in; rules 1-4
 * still take priority.
 * <p>
 * Instances are immutable and safe to share.
 */
public final class SamplingStrategy {

    private static final int SERVER_ERROR_STATUS = 500;

    private final WideEventConfig config;
    private final DoubleSupplier random;
    private final Set<String> users;
    private final Set<String> projects;

    public SamplingStrategy(WideEventConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a strategy with an explicit random source.
     *
     * @param config sampling settings
     * @param random source of uniform values in {@code [0, 1)}
     */
    public SamplingStrategy(WideEventConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.config = config;
        this.random = random;
        this.users = Set.copyOf(config.alwaysSampleUsers());
        this.projects = Set.copyOf(config.alwaysSampleProjects());
    }

    /**
     * Tail decision: forcing rules, then a fresh random draw.
     */
    public boolean shouldSample(WideEvent event) {
        return isForced(event) || draw();
    }

    /**
     * Head decision: forcing rules, then the draw taken when the operation opened.
     */
    public boolean shouldSample(WideEvent event, boolean headDraw) {
        return isForced(event) || headDraw;
    }

    /**
     * Returns true when the random draw should be taken at open time.
     */
    public boolean isHeadSampling() {
        return !config.tailSampling();
    }

    /**
     * Performs one random draw against the sampling rate.
     */
    public boolean draw() {
        return random.getAsDouble() < config.samplingRate();
    }

    /**
     * Returns true when one of the deterministic rules keeps the event.
     */
    public boolean isForced(WideEvent event) {
        if (config.alwaysSampleErrors() && isError(event)) {
            return true;
        }
        if (config.alwaysSampleSlow() && event.durationMs() > config.slowThresholdMs()) {
            return true;
        }
        if (!users.isEmpty() && matchesUser(event.user())) {
            return true;
        }
        return !projects.isEmpty() && matches(projects, projectOf(event));
    }

    public WideEventConfig config() {
        return config;
    }

    private static boolean isError(WideEvent event) {
        return event.outcome() == Outcome.ERROR
                || (event.statusCode() != null && event.statusCode() >= SERVER_ERROR_STATUS);
    }

    private boolean matchesUser(Map<String, Object> user) {
        return matches(users, user.get("id")) || matches(users, user.get("user_id"));
    }

    private static Object projectOf(WideEvent event) {
        if (event.projectId() != null) {
            return event.projectId();
        }
        return event.extra().get("project_id");
    }

    private static boolean matches(Set<String> allowlist, Object value) {
        return value != null && allowlist.contains(String.valueOf(value));
    }
}
