package com.ryuqq.temporal.testkit.fixture;

import com.ryuqq.temporal.core.calendar.CalendarMath;
import com.ryuqq.temporal.core.model.Duration;
import com.ryuqq.temporal.core.model.LocalDate;
import com.ryuqq.temporal.core.model.LocalDateTime;
import com.ryuqq.temporal.core.model.LocalTime;

import java.util.List;
import java.util.Random;

/**
 * Reusable calendar fixtures for tests of temporal values and their codecs.
 *
 * <p>Random generators take a caller-supplied {@link Random} so a failing run can be
 * reproduced from its seed.</p>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class CalendarFixtures {

    /**
     * Years with a February 29th, including century edge cases.
     */
    public static final List<Integer> LEAP_YEARS = List.of(-400, -4, 0, 4, 1600, 1996, 2000, 2004, 2020, 2400);

    /**
     * Years without a February 29th.
     */
    public static final List<Integer> NON_LEAP_YEARS = List.of(-100, -1, 1, 1700, 1800, 1900, 2001, 2019, 2100);

    private CalendarFixtures() {
    }

    /**
     * Dates on calendar boundaries, in ascending order.
     *
     * @return immutable list of dates
     */
    public static List<LocalDate> boundaryDates() {
        return List.of(
            LocalDate.of(0, 1, 29),
            LocalDate.of(1, 0, 1),
            LocalDate.of(1899, 11, 31),
            LocalDate.of(1900, 1, 28),
            LocalDate.of(1969, 11, 31),
            LocalDate.of(1970, 0, 1),
            LocalDate.of(1999, 11, 31),
            LocalDate.of(2000, 0, 1),
            LocalDate.of(2000, 1, 29),
            LocalDate.of(2000, 11, 31),
            LocalDate.of(2019, 0, 31),
            LocalDate.of(2100, 2, 1),
            LocalDate.of(9999, 11, 31)
        );
    }

    /**
     * Times at field boundaries, in ascending order.
     *
     * @return immutable list of times
     */
    public static List<LocalTime> boundaryTimes() {
        return List.of(
            LocalTime.of(0),
            LocalTime.of(0, 0, 0, 1),
            LocalTime.of(0, 0, 0, 500),
            LocalTime.of(11, 59, 59, 999),
            LocalTime.of(12),
            LocalTime.of(23, 59, 59),
            LocalTime.of(23, 59, 59, 999)
        );
    }

    /**
     * Date-times around the Unix epoch and the year 1 / 9999 limits, in ascending order.
     *
     * @return immutable list of date-times
     */
    public static List<LocalDateTime> boundaryDateTimes() {
        return List.of(
            LocalDateTime.of(1, 0, 1),
            LocalDateTime.of(1969, 11, 31, 23, 59, 59, 999),
            LocalDateTime.of(1970),
            LocalDateTime.of(1970, 0, 1, 0, 0, 0, 1),
            LocalDateTime.of(2000, 1, 29, 12, 30),
            LocalDateTime.of(2019, 0, 1),
            LocalDateTime.of(9999, 11, 31, 23, 59, 59, 999)
        );
    }

    /**
     * Durations covering every sign combination of the three components.
     *
     * @return immutable list of durations
     */
    public static List<Duration> mixedSignDurations() {
        return List.of(
            Duration.ZERO,
            Duration.of(14, 0, 0),
            Duration.of(0, 0, 3_661_500),
            Duration.of(-14, 3, 0),
            Duration.of(0, -1, 3_600_000),
            Duration.of(1, -1, -1),
            Duration.of(-1, -1, -1),
            Duration.of(1, 30, 86_400_000),
            Duration.of(Integer.MAX_VALUE, Integer.MIN_VALUE, 0)
        );
    }

    /**
     * A uniformly chosen valid date.
     *
     * @param random source of randomness
     * @param minYear smallest year (inclusive)
     * @param maxYear largest year (inclusive)
     * @return a valid date
     */
    public static LocalDate randomDate(Random random, int minYear, int maxYear) {
        if (minYear > maxYear) {
            throw new IllegalArgumentException(
                "minYear must be <= maxYear (min: " + minYear + ", max: " + maxYear + ")"
            );
        }
        int year = minYear + random.nextInt(maxYear - minYear + 1);
        int month = random.nextInt(12);
        int day = 1 + random.nextInt(CalendarMath.daysInMonth(year, month + 1));
        return LocalDate.of(year, month, day);
    }

    public static LocalTime randomTime(Random random) {
        return LocalTime.of(random.nextInt(24), random.nextInt(60), random.nextInt(60), random.nextInt(1_000));
    }

    /**
     * A valid date-time between years 1 and 9999.
     *
     * @param random source of randomness
     * @return a valid date-time
     */
    public static LocalDateTime randomDateTime(Random random) {
        return LocalDateTime.of(randomDate(random, 1, 9999), randomTime(random));
    }

    /**
     * A duration whose components fit comfortably in a microsecond-based wire field.
     *
     * @param random source of randomness
     * @return a duration with independently signed components
     */
    public static Duration randomDuration(Random random) {
        int months = random.nextInt(2_401) - 1_200;
        int days = random.nextInt(20_001) - 10_000;
        long millis = random.nextLong(-1_000_000_000_000L, 1_000_000_000_001L);
        return Duration.of(months, days, millis);
    }
}
