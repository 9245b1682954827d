package com.arkham.logging.sink;

import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RolloverFailure;

/**
 * Fixed-window rolling ({@code app.log.1} … {@code app.log.N}) followed by a throttled
 * time-based retention sweep after every rollover.
 */
public class RetentionRollingPolicy extends FixedWindowRollingPolicy {

    private RetentionCleaner cleaner;

    public void setCleaner(RetentionCleaner cleaner) {
        this.cleaner = cleaner;
    }

    public RetentionCleaner getCleaner() {
        return cleaner;
    }

    @Override
    public void rollover() throws RolloverFailure {
        super.rollover();
        if (cleaner != null) {
            cleaner.cleanupIfDue();
        }
    }
}
