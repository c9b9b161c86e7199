package com.ryuqq.temporal.testkit.assertion;

import com.ryuqq.temporal.core.model.Duration;
import com.ryuqq.temporal.core.model.LocalDate;
import com.ryuqq.temporal.core.model.LocalDateTime;
import com.ryuqq.temporal.core.model.LocalTime;

/**
 * Entry point for the temporal value assertions.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * import static com.ryuqq.temporal.testkit.assertion.TemporalAssertions.assertThat;
 *
 * assertThat(LocalDate.of(2019, 0, 31))
 *     .hasFields(2019, 0, 31)
 *     .hasCanonicalForm("2019-01-31");
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class TemporalAssertions {

    private TemporalAssertions() {
    }

    public static LocalDateAssert assertThat(LocalDate actual) {
        return new LocalDateAssert(actual);
    }

    public static LocalTimeAssert assertThat(LocalTime actual) {
        return new LocalTimeAssert(actual);
    }

    public static LocalDateTimeAssert assertThat(LocalDateTime actual) {
        return new LocalDateTimeAssert(actual);
    }

    public static DurationAssert assertThat(Duration actual) {
        return new DurationAssert(actual);
    }
}
