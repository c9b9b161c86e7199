package com.ryuqq.temporal.testkit.contract;

import com.ryuqq.temporal.core.calendar.CalendarMath;
import com.ryuqq.temporal.core.calendar.YearMonthDay;
import com.ryuqq.temporal.core.model.Duration;
import com.ryuqq.temporal.core.model.LocalDate;
import com.ryuqq.temporal.core.model.LocalDateTime;
import com.ryuqq.temporal.core.model.LocalTime;
import com.ryuqq.temporal.core.model.TrustedTemporalFactory;

import java.nio.ByteBuffer;

/**
 * Big-endian binary codec used to exercise the contract.
 *
 * <p>Layout: dates as int32 days since 2000-01-01, times as int64 microseconds since
 * midnight, date-times as int64 microseconds since 2000-01-01T00:00, durations as
 * int64 microseconds + int32 days + int32 months. Decoding goes through
 * {@link TrustedTemporalFactory}, as a protocol decoder would.</p>
 */
final class MicrosecondWireCodec {

    private static final long POSTGRES_EPOCH_ORDINAL = CalendarMath.ymdToOrdinal(2000, 1, 1);
    private static final long POSTGRES_EPOCH_MILLIS = 946_684_800_000L;

    byte[] encodeDate(LocalDate value) {
        return ByteBuffer.allocate(4)
            .putInt(Math.toIntExact(value.toOrdinal() - POSTGRES_EPOCH_ORDINAL))
            .array();
    }

    LocalDate decodeDate(byte[] data) {
        int days = ByteBuffer.wrap(data).getInt();
        YearMonthDay ymd = CalendarMath.ordinalToYmd(POSTGRES_EPOCH_ORDINAL + days);
        return TrustedTemporalFactory.localDate(ymd.year(), ymd.month() - 1, ymd.day());
    }

    byte[] encodeTime(LocalTime value) {
        return ByteBuffer.allocate(8).putLong(value.toMillisOfDay() * 1_000L).array();
    }

    LocalTime decodeTime(byte[] data) {
        long millis = ByteBuffer.wrap(data).getLong() / 1_000L;
        return TrustedTemporalFactory.localTime(
            (int) (millis / 3_600_000L),
            (int) (millis / 60_000L % 60),
            (int) (millis / 1_000L % 60),
            (int) (millis % 1_000L)
        );
    }

    byte[] encodeDateTime(LocalDateTime value) {
        return ByteBuffer.allocate(8)
            .putLong((value.getEpochMillis() - POSTGRES_EPOCH_MILLIS) * 1_000L)
            .array();
    }

    LocalDateTime decodeDateTime(byte[] data) {
        long micros = ByteBuffer.wrap(data).getLong();
        return TrustedTemporalFactory.localDateTime(Math.floorDiv(micros, 1_000L) + POSTGRES_EPOCH_MILLIS);
    }

    byte[] encodeDuration(Duration value) {
        return ByteBuffer.allocate(16)
            .putLong(Math.multiplyExact(value.getMilliseconds(), 1_000L))
            .putInt(value.getDays())
            .putInt(value.getMonths())
            .array();
    }

    Duration decodeDuration(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        long micros = buffer.getLong();
        int days = buffer.getInt();
        int months = buffer.getInt();
        return TrustedTemporalFactory.duration(months, days, micros / 1_000L);
    }
}
