package com.ryuqq.temporal.testkit.assertion;

import com.ryuqq.temporal.core.model.LocalDate;

/**
 * Assertions for {@link LocalDate}.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class LocalDateAssert extends AbstractTemporalAssert<LocalDateAssert, LocalDate> {

    public LocalDateAssert(LocalDate actual) {
        super(actual, LocalDateAssert.class);
    }

    /**
     * Verifies year, zero-based month and day.
     *
     * @param year expected year
     * @param month expected month (0..11)
     * @param day expected day
     * @return this assertion
     */
    public LocalDateAssert hasFields(int year, int month, int day) {
        isNotNull();
        checkComponent("year", year, actual.getYear());
        checkComponent("month", month, actual.getMonth());
        checkComponent("day", day, actual.getDay());
        return this;
    }

    public LocalDateAssert hasOrdinal(long ordinal) {
        isNotNull();
        checkComponent("ordinal", ordinal, actual.toOrdinal());
        return this;
    }
}
