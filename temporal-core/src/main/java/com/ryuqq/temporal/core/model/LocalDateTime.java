package com.ryuqq.temporal.core.model;

import com.ryuqq.temporal.core.calendar.CalendarMath;
import com.ryuqq.temporal.core.calendar.YearMonthDay;
import com.ryuqq.temporal.core.exception.FormatInvariantException;
import com.ryuqq.temporal.core.exception.TemporalValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Formattable;
import java.util.Formatter;

/**
 * 시간대 정보가 없는 날짜 + 시각 (벽시계 값).
 *
 * <p>서버의 {@code cal::local_datetime}에 대응하는 값 객체입니다.
 * 내부적으로 UTC 기준 epoch 밀리초 하나로 저장하여 필드 추출과 연산이 단일 수치 표현을 공유합니다.
 * <strong>실제 시점(timestamp)이 아니라</strong> 구조화된 벽시계 값일 뿐이므로,
 * 모든 변환은 UTC로만 수행하고 호스트의 기본 시간대는 절대 사용하지 않습니다.</p>
 *
 * <p><strong>유효성 검증 ({@link #of(int, int, int, int, int, int, int)}):</strong></p>
 * <ul>
 *   <li>year: {@value #MIN_YEAR}..{@value #MAX_YEAR}</li>
 *   <li>month: 0..11, day: 1..해당 월의 일수</li>
 *   <li>hour: 0..23, minute: 0..59, second: 0..59, millisecond: 0..999</li>
 * </ul>
 *
 * <p><strong>정규 문자열:</strong> {@code YYYY-MM-DDTHH:MM:SS[.mmm]} (시간대 표시 없음)</p>
 * <pre>
 * LocalDateTime.of(2019, 0, 1).toString();                   // "2019-01-01T00:00:00"
 * LocalDateTime.of(2019, 0, 1, 13, 5, 0, 250).toString();    // "2019-01-01T13:05:00.250"
 * LocalDateTime.of(2019, 0, 1, 13, 5).toPlainString();       // "2019-01-01 13:05:00"
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class LocalDateTime implements Comparable<LocalDateTime>, Formattable {

    private static final Logger log = LoggerFactory.getLogger(LocalDateTime.class);

    /**
     * 허용 최소 연도 (epoch ±100,000,000일 범위에 완전히 포함되는 연도).
     */
    public static final int MIN_YEAR = -271_820;

    /**
     * 허용 최대 연도.
     */
    public static final int MAX_YEAR = 275_759;

    private static final long MILLIS_PER_DAY = 86_400_000L;
    private static final int MILLIS_PER_HOUR = 3_600_000;
    private static final int MILLIS_PER_MINUTE = 60_000;
    private static final int MILLIS_PER_SECOND = 1_000;

    private final long epochMillis;

    private LocalDateTime(long epochMillis) {
        this.epochMillis = epochMillis;
    }

    public static LocalDateTime of(int year) {
        return of(year, 0, 1, 0, 0, 0, 0);
    }

    public static LocalDateTime of(int year, int month) {
        return of(year, month, 1, 0, 0, 0, 0);
    }

    public static LocalDateTime of(int year, int month, int day) {
        return of(year, month, day, 0, 0, 0, 0);
    }

    public static LocalDateTime of(int year, int month, int day, int hour) {
        return of(year, month, day, hour, 0, 0, 0);
    }

    public static LocalDateTime of(int year, int month, int day, int hour, int minute) {
        return of(year, month, day, hour, minute, 0, 0);
    }

    public static LocalDateTime of(int year, int month, int day, int hour, int minute, int second) {
        return of(year, month, day, hour, minute, second, 0);
    }

    /**
     * LocalDateTime 생성.
     *
     * <p>검증된 필드를 {@link CalendarMath}로 UTC epoch 밀리초로 합칩니다.</p>
     *
     * @param year 연도
     * @param month 월 (0..11)
     * @param day 일 (1..해당 월의 일수)
     * @param hour 시 (0..23)
     * @param minute 분 (0..59)
     * @param second 초 (0..59)
     * @param millisecond 밀리초 (0..999)
     * @return LocalDateTime 인스턴스
     * @throws TemporalValidationException 필드가 범위를 벗어난 경우
     */
    public static LocalDateTime of(int year, int month, int day,
                                   int hour, int minute, int second, int millisecond) {
        TemporalValidationException.checkRange("year", year, MIN_YEAR, MAX_YEAR);
        TemporalValidationException.checkRange("month", month, 0, 11);
        TemporalValidationException.checkRange("day", day, 1, CalendarMath.daysInMonth(year, month + 1));
        TemporalValidationException.checkRange("hour", hour, 0, 23);
        TemporalValidationException.checkRange("minute", minute, 0, 59);
        TemporalValidationException.checkRange("second", second, 0, 59);
        TemporalValidationException.checkRange("millisecond", millisecond, 0, 999);

        long epochDay = CalendarMath.ordinalToEpochDay(CalendarMath.ymdToOrdinal(year, month + 1, day));
        long millisOfDay = (long) hour * MILLIS_PER_HOUR
            + (long) minute * MILLIS_PER_MINUTE
            + (long) second * MILLIS_PER_SECOND
            + millisecond;
        return new LocalDateTime(epochDay * MILLIS_PER_DAY + millisOfDay);
    }

    /**
     * 날짜와 시각을 합쳐 생성.
     *
     * @param date 날짜
     * @param time 시각
     * @return LocalDateTime 인스턴스
     * @throws IllegalArgumentException date 또는 time이 null인 경우
     * @throws TemporalValidationException 연도가 허용 범위를 벗어난 경우
     */
    public static LocalDateTime of(LocalDate date, LocalTime time) {
        if (date == null || time == null) {
            throw new IllegalArgumentException("date and time are required for LocalDateTime");
        }
        return of(date.getYear(), date.getMonth(), date.getDay(),
            time.getHours(), time.getMinutes(), time.getSeconds(), time.getMilliseconds());
    }

    static LocalDateTime unchecked(long epochMillis) {
        return new LocalDateTime(epochMillis);
    }

    /**
     * {@code java.time.LocalDateTime}에서 변환. 밀리초 미만 정밀도는 버립니다.
     *
     * @param dateTime 변환할 값
     * @return LocalDateTime 인스턴스
     * @throws IllegalArgumentException dateTime이 null인 경우
     * @throws TemporalValidationException 연도가 지원 범위를 벗어난 경우
     */
    public static LocalDateTime fromJavaLocalDateTime(java.time.LocalDateTime dateTime) {
        if (dateTime == null) {
            throw new IllegalArgumentException("dateTime cannot be null");
        }
        TemporalValidationException.checkRange("year", dateTime.getYear(), MIN_YEAR, MAX_YEAR);
        return new LocalDateTime(dateTime.toInstant(ZoneOffset.UTC).toEpochMilli());
    }

    /**
     * 내부 epoch 밀리초 (UTC 기준) 조회.
     *
     * @return epoch 밀리초
     */
    public long getEpochMillis() {
        return epochMillis;
    }

    public int getYear() {
        return ymd().year();
    }

    /**
     * 월 조회.
     *
     * @return 월 (0..11)
     */
    public int getMonth() {
        return ymd().month() - 1;
    }

    public int getDay() {
        return ymd().day();
    }

    public int getHours() {
        return (int) (millisOfDay() / MILLIS_PER_HOUR);
    }

    public int getMinutes() {
        return (int) (millisOfDay() % MILLIS_PER_HOUR / MILLIS_PER_MINUTE);
    }

    public int getSeconds() {
        return (int) (millisOfDay() % MILLIS_PER_MINUTE / MILLIS_PER_SECOND);
    }

    public int getMilliseconds() {
        return (int) (millisOfDay() % MILLIS_PER_SECOND);
    }

    /**
     * 요일 조회.
     *
     * @return 0 (일요일) .. 6 (토요일)
     */
    public int getDayOfWeek() {
        // 1970-01-01 was a Thursday
        return (int) Math.floorMod(epochDay() + 4, 7L);
    }

    /**
     * 날짜 부분.
     *
     * @return LocalDate
     */
    public LocalDate getDate() {
        return LocalDate.fromOrdinal(CalendarMath.epochDayToOrdinal(epochDay()));
    }

    /**
     * 시각 부분.
     *
     * @return LocalTime
     */
    public LocalTime getTime() {
        return LocalTime.unchecked(getHours(), getMinutes(), getSeconds(), getMilliseconds());
    }

    /**
     * {@code java.time.LocalDateTime}으로 변환 ({@link ZoneOffset#UTC} 기준).
     *
     * @return java.time.LocalDateTime
     */
    public java.time.LocalDateTime toJavaLocalDateTime() {
        return java.time.LocalDateTime.ofEpochSecond(
            Math.floorDiv(epochMillis, MILLIS_PER_SECOND),
            (int) Math.floorMod(epochMillis, (long) MILLIS_PER_SECOND) * 1_000_000,
            ZoneOffset.UTC
        );
    }

    /**
     * ISO 형식 문자열 (시간대 표시 제외).
     *
     * <p>{@link Instant#toString()}의 UTC 출력에서 마지막 {@code Z}를 잘라냅니다.</p>
     *
     * @return {@code YYYY-MM-DDTHH:MM:SS[.mmm]}
     * @throws FormatInvariantException 포매터 출력이 {@code Z}로 끝나지 않는 경우
     */
    public String toIsoString() {
        String iso = Instant.ofEpochMilli(epochMillis).toString();
        if (!iso.endsWith("Z")) {
            log.error("Unexpected ISO format for epochMillis={}: {}", epochMillis, iso);
            throw new FormatInvariantException("unexpected ISO format: " + iso);
        }
        return iso.substring(0, iso.length() - 1);
    }

    /**
     * 표시용 문자열. {@code T} 구분자를 공백으로 바꿉니다.
     *
     * @return {@code YYYY-MM-DD HH:MM:SS[.mmm]}
     */
    public String toPlainString() {
        return toIsoString().replace('T', ' ');
    }

    /**
     * 디버그용 표현.
     *
     * @return {@code LocalDateTime [ YYYY-MM-DDTHH:MM:SS ]}
     */
    public String toDebugString() {
        return "LocalDateTime [ " + toIsoString() + " ]";
    }

    private long epochDay() {
        return Math.floorDiv(epochMillis, MILLIS_PER_DAY);
    }

    private long millisOfDay() {
        return Math.floorMod(epochMillis, MILLIS_PER_DAY);
    }

    private YearMonthDay ymd() {
        return CalendarMath.ordinalToYmd(CalendarMath.epochDayToOrdinal(epochDay()));
    }

    @Override
    public int compareTo(LocalDateTime other) {
        return Long.compare(epochMillis, other.epochMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return epochMillis == ((LocalDateTime) o).epochMillis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(epochMillis);
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        TemporalText.formatTo(formatter, flags, width, precision, toString(), toDebugString());
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
