package com.ryuqq.temporal.testkit.assertion;

import com.ryuqq.temporal.core.model.LocalTime;

/**
 * Assertions for {@link LocalTime}.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class LocalTimeAssert extends AbstractTemporalAssert<LocalTimeAssert, LocalTime> {

    public LocalTimeAssert(LocalTime actual) {
        super(actual, LocalTimeAssert.class);
    }

    public LocalTimeAssert hasFields(int hours, int minutes, int seconds, int milliseconds) {
        isNotNull();
        checkComponent("hours", hours, actual.getHours());
        checkComponent("minutes", minutes, actual.getMinutes());
        checkComponent("seconds", seconds, actual.getSeconds());
        checkComponent("milliseconds", milliseconds, actual.getMilliseconds());
        return this;
    }
}
