package com.ryuqq.temporal.testkit.contract;

import com.ryuqq.temporal.core.model.Duration;
import com.ryuqq.temporal.core.model.LocalDate;
import com.ryuqq.temporal.core.model.LocalDateTime;
import com.ryuqq.temporal.core.model.LocalTime;
import com.ryuqq.temporal.testkit.fixture.CalendarFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.TimeZone;

import static com.ryuqq.temporal.testkit.assertion.TemporalAssertions.assertThat;

/**
 * Abstract base class for wire codec Contract Tests.
 *
 * <p>A protocol codec turns temporal values into the server's binary representation and
 * rebuilds them through {@code TrustedTemporalFactory}. Extending this class and
 * implementing the four {@code roundTrip} methods (encode, then decode) checks that
 * every component and the canonical text survive the trip.</p>
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>Boundary dates, times, date-times and mixed-sign durations</li>
 *   <li>Seeded random samples ({@link #seed()}, {@link #randomSamples()})</li>
 *   <li>Decoding under a non-UTC host default time zone</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCodecContractTest extends AbstractWireRoundTripContractTest {
 *     {@literal @}Override
 *     protected LocalDate roundTrip(LocalDate value) {
 *         return codec.decodeDate(codec.encodeDate(value));
 *     }
 *     // ... LocalTime, LocalDateTime, Duration
 * }
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public abstract class AbstractWireRoundTripContractTest {

    protected Random random;
    private TimeZone originalZone;

    /**
     * Sets up a seeded random source before each test.
     */
    @BeforeEach
    void setUp() {
        random = new Random(seed());
        originalZone = TimeZone.getDefault();
    }

    /**
     * Restores the host default time zone.
     */
    @AfterEach
    void tearDown() {
        TimeZone.setDefault(originalZone);
    }

    protected abstract LocalDate roundTrip(LocalDate value);

    protected abstract LocalTime roundTrip(LocalTime value);

    protected abstract LocalDateTime roundTrip(LocalDateTime value);

    protected abstract Duration roundTrip(Duration value);

    /**
     * Seed for the random samples. Override to reproduce a failure.
     *
     * @return the seed
     */
    protected long seed() {
        return 20_190_101L;
    }

    /**
     * Number of random samples per type.
     *
     * @return sample count
     */
    protected int randomSamples() {
        return 500;
    }

    @Test
    void localDate_BoundaryDates_SurviveRoundTrip() {
        for (LocalDate date : CalendarFixtures.boundaryDates()) {
            assertThat(roundTrip(date)).isEquivalentTo(date);
        }
    }

    @Test
    void localDate_RandomDates_SurviveRoundTrip() {
        for (int i = 0; i < randomSamples(); i++) {
            LocalDate date = CalendarFixtures.randomDate(random, 1, 9999);
            assertThat(roundTrip(date))
                .hasFields(date.getYear(), date.getMonth(), date.getDay())
                .hasOrdinal(date.toOrdinal());
        }
    }

    @Test
    void localTime_BoundaryTimes_SurviveRoundTrip() {
        for (LocalTime time : CalendarFixtures.boundaryTimes()) {
            assertThat(roundTrip(time)).isEquivalentTo(time);
        }
    }

    @Test
    void localTime_RandomTimes_SurviveRoundTrip() {
        for (int i = 0; i < randomSamples(); i++) {
            LocalTime time = CalendarFixtures.randomTime(random);
            assertThat(roundTrip(time))
                .hasFields(time.getHours(), time.getMinutes(), time.getSeconds(), time.getMilliseconds());
        }
    }

    @Test
    void localDateTime_BoundaryValues_SurviveRoundTrip() {
        for (LocalDateTime dateTime : CalendarFixtures.boundaryDateTimes()) {
            assertThat(roundTrip(dateTime))
                .isEquivalentTo(dateTime)
                .hasEpochMillis(dateTime.getEpochMillis())
                .hasDayOfWeek(dateTime.getDayOfWeek());
        }
    }

    @Test
    void localDateTime_RandomValues_SurviveRoundTrip() {
        for (int i = 0; i < randomSamples(); i++) {
            LocalDateTime dateTime = CalendarFixtures.randomDateTime(random);
            assertThat(roundTrip(dateTime)).isEquivalentTo(dateTime);
        }
    }

    @Test
    void localDateTime_DecodedUnderForeignHostZone_KeepsWallClock() {
        // Given
        TimeZone.setDefault(TimeZone.getTimeZone("Pacific/Kiritimati"));
        LocalDateTime dateTime = LocalDateTime.of(2019, 0, 1, 0, 0, 0, 0);

        // When
        LocalDateTime decoded = roundTrip(dateTime);

        // Then
        assertThat(decoded)
            .hasFields(2019, 0, 1, 0, 0, 0, 0)
            .hasCanonicalForm("2019-01-01T00:00:00");
    }

    @Test
    void duration_MixedSigns_SurviveRoundTrip() {
        for (Duration duration : CalendarFixtures.mixedSignDurations()) {
            assertThat(roundTrip(duration))
                .hasComponents(duration.getMonths(), duration.getDays(), duration.getMilliseconds())
                .hasCanonicalForm(duration.toString());
        }
    }

    @Test
    void duration_RandomValues_SurviveRoundTrip() {
        for (int i = 0; i < randomSamples(); i++) {
            Duration duration = CalendarFixtures.randomDuration(random);
            assertThat(roundTrip(duration)).isEquivalentTo(duration);
        }
    }
}
