package com.ryuqq.temporal.testkit.assertion;

import com.ryuqq.temporal.core.model.LocalDateTime;

/**
 * Assertions for {@link LocalDateTime}.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class LocalDateTimeAssert extends AbstractTemporalAssert<LocalDateTimeAssert, LocalDateTime> {

    public LocalDateTimeAssert(LocalDateTime actual) {
        super(actual, LocalDateTimeAssert.class);
    }

    /**
     * Verifies the wall-clock fields as decomposed in UTC.
     *
     * @return this assertion
     */
    public LocalDateTimeAssert hasFields(int year, int month, int day,
                                         int hour, int minute, int second, int millisecond) {
        isNotNull();
        checkComponent("year", year, actual.getYear());
        checkComponent("month", month, actual.getMonth());
        checkComponent("day", day, actual.getDay());
        checkComponent("hours", hour, actual.getHours());
        checkComponent("minutes", minute, actual.getMinutes());
        checkComponent("seconds", second, actual.getSeconds());
        checkComponent("milliseconds", millisecond, actual.getMilliseconds());
        return this;
    }

    public LocalDateTimeAssert hasEpochMillis(long epochMillis) {
        isNotNull();
        checkComponent("epochMillis", epochMillis, actual.getEpochMillis());
        return this;
    }

    /**
     * Verifies the day of week, 0 for Sunday through 6 for Saturday.
     *
     * @return this assertion
     */
    public LocalDateTimeAssert hasDayOfWeek(int dayOfWeek) {
        isNotNull();
        checkComponent("dayOfWeek", dayOfWeek, actual.getDayOfWeek());
        return this;
    }
}
