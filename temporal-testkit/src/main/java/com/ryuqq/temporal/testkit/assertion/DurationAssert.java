package com.ryuqq.temporal.testkit.assertion;

import com.ryuqq.temporal.core.model.Duration;

/**
 * Assertions for {@link Duration}.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class DurationAssert extends AbstractTemporalAssert<DurationAssert, Duration> {

    public DurationAssert(Duration actual) {
        super(actual, DurationAssert.class);
    }

    /**
     * Verifies the three stored components exactly (no normalization).
     *
     * @return this assertion
     */
    public DurationAssert hasComponents(int months, int days, long milliseconds) {
        isNotNull();
        checkComponent("months", months, actual.getMonths());
        checkComponent("days", days, actual.getDays());
        checkComponent("milliseconds", milliseconds, actual.getMilliseconds());
        return this;
    }
}
