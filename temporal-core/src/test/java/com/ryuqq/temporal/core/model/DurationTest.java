package com.ryuqq.temporal.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Period;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Duration Value Object 테스트.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
class DurationTest {

    @Test
    void of_StoresComponentsVerbatim() {
        // When
        Duration duration = Duration.of(-3, 45, 90_061_001L);

        // Then
        assertThat(duration.getMonths()).isEqualTo(-3);
        assertThat(duration.getDays()).isEqualTo(45);
        assertThat(duration.getMilliseconds()).isEqualTo(90_061_001L);
    }

    @Test
    void of_Defaults_ZeroFill() {
        assertThat(Duration.of(5)).isEqualTo(Duration.of(5, 0, 0));
        assertThat(Duration.of(5, 2)).isEqualTo(Duration.of(5, 2, 0));
        assertThat(Duration.of(0, 0, 0)).isSameAs(Duration.ZERO);
        assertThat(Duration.ZERO.isZero()).isTrue();
        assertThat(Duration.of(0, 0, 1).isZero()).isFalse();
    }

    @Test
    void equals_MonthIsNotThirtyDays() {
        assertThat(Duration.of(1, 0, 0)).isNotEqualTo(Duration.of(0, 30, 0));
        assertThat(Duration.of(0, 1, 0)).isNotEqualTo(Duration.of(0, 0, 86_400_000L));
        assertThat(Duration.of(1, 2, 3)).isEqualTo(Duration.of(1, 2, 3)).hasSameHashCodeAs(Duration.of(1, 2, 3));
    }

    @ParameterizedTest(name = "({0}, {1}, {2}) -> \"{3}\"")
    @CsvSource(delimiter = '|', value = {
        "0   | 0  | 0          | 00:00:00",
        "14  | 0  | 0          | 1 year 2 months",
        "0   | 0  | 3661500    | 01:01:01.5",
        "12  | 0  | 0          | 1 year",
        "24  | 0  | 0          | 2 years",
        "1   | 0  | 0          | 1 month",
        "0   | 1  | 0          | 1 day",
        "0   | 3  | 0          | 3 days",
        "5   | 10 | 0          | 5 months 10 days",
        "-1  | 0  | 0          | -1 month",
        "-24 | 0  | 0          | -2 years",
        "-14 | 3  | 0          | -1 year -2 months +3 days",
        "-12 | -5 | 0          | -1 year -5 days",
        "13  | -2 | 0          | 1 year 1 month -2 days",
        "0   | -1 | 3600000    | -1 day +01:00:00",
        "-1  | 0  | 60000      | -1 month +00:01:00",
        "0   | -2 | -60000     | -2 days -00:01:00",
        "1   | 0  | -1000      | 1 month -00:00:01",
        "0   | 0  | -3661500   | -01:01:01.5",
        "0   | 0  | 1          | 00:00:00.001",
        "0   | 0  | 123        | 00:00:00.123",
        "0   | 0  | 120        | 00:00:00.12",
        "0   | 0  | 360000000  | 100:00:00",
        "0   | 1  | 86400000   | 1 day 24:00:00",
        "1   | 1  | 1          | 1 month 1 day 00:00:00.001"
    })
    void toString_VerboseIntervalFormat(int months, int days, long millis, String expected) {
        assertThat(Duration.of(months, days, millis).toString()).isEqualTo(expected);
    }

    @Test
    void toString_ExtremeMilliseconds_DoesNotOverflow() {
        assertThat(Duration.of(0, 0, Long.MAX_VALUE).toString()).isEqualTo("2562047788015:12:55.807");
        assertThat(Duration.of(0, 0, Long.MIN_VALUE).toString()).isEqualTo("-2562047788015:12:55.808");
    }

    @Test
    void toString_ExtremeMonths() {
        assertThat(Duration.of(Integer.MIN_VALUE, 0, 0).toString()).isEqualTo("-178956970 years -8 months");
        assertThat(Duration.of(Integer.MAX_VALUE, 0, 0).toString()).isEqualTo("178956970 years 7 months");
    }

    @Test
    void toPeriodAndTimeDuration_SplitComponents() {
        Duration duration = Duration.of(14, -3, 1_500L);

        assertThat(duration.toPeriod()).isEqualTo(Period.of(0, 14, -3));
        assertThat(duration.toTimeDuration()).isEqualTo(java.time.Duration.ofMillis(1_500L));
    }

    @Test
    void format_AlternateFlag_UsesDebugForm() {
        Duration duration = Duration.of(14, 0, 0);

        assertThat(duration.toDebugString()).isEqualTo("Duration [ 1 year 2 months ]");
        assertThat(String.format("%#s", duration)).isEqualTo("Duration [ 1 year 2 months ]");
        assertThat(String.format("%s", duration)).isEqualTo("1 year 2 months");
    }
}
