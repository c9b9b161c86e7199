package com.ryuqq.temporal.core.model;

import com.ryuqq.temporal.core.calendar.CalendarMath;
import com.ryuqq.temporal.core.calendar.YearMonthDay;
import com.ryuqq.temporal.core.exception.TemporalValidationException;

import java.util.Formattable;
import java.util.Formatter;

/**
 * 시간대 정보가 없는 달력 날짜 (연, 월, 일).
 *
 * <p>서버의 {@code cal::local_date}에 대응하는 값 객체입니다.
 * 월은 0부터 시작합니다 (0 = 1월, 11 = 12월).</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>month: 0..11</li>
 *   <li>day: 1..해당 연월의 일수 (윤년 반영)</li>
 * </ul>
 *
 * <p><strong>정규 문자열:</strong> {@code YYYY-MM-DD} (월은 1부터 출력)</p>
 * <pre>
 * LocalDate.of(2019, 0, 31).toString();   // "2019-01-31"
 * LocalDate.of(2019, 1, 30);              // TemporalValidationException
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class LocalDate implements Comparable<LocalDate>, Formattable {

    private final int year;
    private final int month;
    private final int day;

    private LocalDate(int year, int month, int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    /**
     * LocalDate 생성 (해당 연도 1월 1일).
     *
     * @param year 연도
     * @return LocalDate 인스턴스
     */
    public static LocalDate of(int year) {
        return of(year, 0, 1);
    }

    /**
     * LocalDate 생성 (해당 월 1일).
     *
     * @param year 연도
     * @param month 월 (0..11)
     * @return LocalDate 인스턴스
     * @throws TemporalValidationException month가 범위를 벗어난 경우
     */
    public static LocalDate of(int year, int month) {
        return of(year, month, 1);
    }

    /**
     * LocalDate 생성.
     *
     * @param year 연도
     * @param month 월 (0..11)
     * @param day 일 (1..해당 월의 일수)
     * @return LocalDate 인스턴스
     * @throws TemporalValidationException month 또는 day가 범위를 벗어난 경우
     */
    public static LocalDate of(int year, int month, int day) {
        TemporalValidationException.checkRange("month", month, 0, 11);
        TemporalValidationException.checkRange("day", day, 1, CalendarMath.daysInMonth(year, month + 1));
        return new LocalDate(year, month, day);
    }

    /**
     * 검증 없이 생성. {@link TrustedTemporalFactory} 전용.
     */
    static LocalDate unchecked(int year, int month, int day) {
        return new LocalDate(year, month, day);
    }

    /**
     * 서수에서 LocalDate 생성.
     *
     * <p>일 단위 덧셈/뺄셈의 기본 수단입니다: {@code fromOrdinal(date.toOrdinal() + n)}.</p>
     *
     * @param ordinal 서수 일 (0001-01-01 = 1)
     * @return LocalDate 인스턴스
     */
    public static LocalDate fromOrdinal(long ordinal) {
        YearMonthDay ymd = CalendarMath.ordinalToYmd(ordinal);
        return new LocalDate(ymd.year(), ymd.month() - 1, ymd.day());
    }

    /**
     * {@code java.time.LocalDate}에서 변환.
     *
     * @param date 변환할 날짜
     * @return LocalDate 인스턴스
     * @throws IllegalArgumentException date가 null인 경우
     */
    public static LocalDate fromJavaLocalDate(java.time.LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return new LocalDate(date.getYear(), date.getMonthValue() - 1, date.getDayOfMonth());
    }

    public int getYear() {
        return year;
    }

    /**
     * 월 조회.
     *
     * @return 월 (0..11)
     */
    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    /**
     * 서수 조회 (저장/비교용 정수 표현).
     *
     * @return 서수 일
     */
    public long toOrdinal() {
        return CalendarMath.ymdToOrdinal(year, month + 1, day);
    }

    /**
     * 일 수를 더한 새 인스턴스.
     *
     * @param days 더할 일 수 (음수 허용)
     * @return 새 LocalDate 인스턴스
     */
    public LocalDate plusDays(long days) {
        if (days == 0) {
            return this;
        }
        return fromOrdinal(toOrdinal() + days);
    }

    /**
     * {@code java.time.LocalDate}로 변환.
     *
     * @return java.time.LocalDate
     */
    public java.time.LocalDate toJavaLocalDate() {
        return java.time.LocalDate.of(year, month + 1, day);
    }

    /**
     * 디버그용 표현.
     *
     * @return {@code LocalDate [ YYYY-MM-DD ]}
     */
    public String toDebugString() {
        return "LocalDate [ " + this + " ]";
    }

    @Override
    public int compareTo(LocalDate other) {
        return Long.compare(toOrdinal(), other.toOrdinal());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocalDate that = (LocalDate) o;
        return year == that.year && month == that.month && day == that.day;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * year + month) + day;
    }

    /**
     * {@code %s}는 정규 문자열, {@code %#s}는 디버그 표현을 출력합니다.
     */
    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        TemporalText.formatTo(formatter, flags, width, precision, toString(), toDebugString());
    }

    @Override
    public String toString() {
        return TemporalText.year(year) + '-' + TemporalText.pad2(month + 1) + '-' + TemporalText.pad2(day);
    }
}
