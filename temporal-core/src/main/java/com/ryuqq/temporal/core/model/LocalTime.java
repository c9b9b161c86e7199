package com.ryuqq.temporal.core.model;

import com.ryuqq.temporal.core.exception.TemporalValidationException;

import java.util.Formattable;
import java.util.Formatter;

/**
 * 날짜와 무관한 벽시계 시각 (밀리초 정밀도).
 *
 * <p>서버의 {@code cal::local_time}에 대응하는 값 객체입니다.</p>
 *
 * <p><strong>유효성 검증:</strong> 네 필드를 독립적으로 검사하며, 한 필드가 다른 필드로 올림되지 않습니다.</p>
 * <ul>
 *   <li>hours: 0..23</li>
 *   <li>minutes: 0..59</li>
 *   <li>seconds: 0..59</li>
 *   <li>milliseconds: 0..999</li>
 * </ul>
 *
 * <p><strong>정규 문자열:</strong> {@code HH:MM:SS}, 밀리초가 0이 아닐 때만 소수부를 붙이고 뒤쪽 0은 제거합니다.</p>
 * <pre>
 * LocalTime.of(9, 5).toString();              // "09:05:00"
 * LocalTime.of(23, 59, 59, 500).toString();   // "23:59:59.5"
 * LocalTime.of(0, 0, 0, 5).toString();        // "00:00:00.005"
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class LocalTime implements Comparable<LocalTime>, Formattable {

    private static final int MILLIS_PER_SECOND = 1_000;
    private static final int MILLIS_PER_MINUTE = 60_000;
    private static final int MILLIS_PER_HOUR = 3_600_000;

    private final int hours;
    private final int minutes;
    private final int seconds;
    private final int milliseconds;

    private LocalTime(int hours, int minutes, int seconds, int milliseconds) {
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
        this.milliseconds = milliseconds;
    }

    public static LocalTime of(int hours) {
        return of(hours, 0, 0, 0);
    }

    public static LocalTime of(int hours, int minutes) {
        return of(hours, minutes, 0, 0);
    }

    public static LocalTime of(int hours, int minutes, int seconds) {
        return of(hours, minutes, seconds, 0);
    }

    /**
     * LocalTime 생성.
     *
     * @param hours 시 (0..23)
     * @param minutes 분 (0..59)
     * @param seconds 초 (0..59)
     * @param milliseconds 밀리초 (0..999)
     * @return LocalTime 인스턴스
     * @throws TemporalValidationException 필드가 범위를 벗어난 경우 (hours → minutes → seconds → milliseconds 순으로 검사)
     */
    public static LocalTime of(int hours, int minutes, int seconds, int milliseconds) {
        TemporalValidationException.checkRange("hours", hours, 0, 23);
        TemporalValidationException.checkRange("minutes", minutes, 0, 59);
        TemporalValidationException.checkRange("seconds", seconds, 0, 59);
        TemporalValidationException.checkRange("milliseconds", milliseconds, 0, 999);
        return new LocalTime(hours, minutes, seconds, milliseconds);
    }

    static LocalTime unchecked(int hours, int minutes, int seconds, int milliseconds) {
        return new LocalTime(hours, minutes, seconds, milliseconds);
    }

    /**
     * {@code java.time.LocalTime}에서 변환. 밀리초 미만 정밀도는 버립니다.
     *
     * @param time 변환할 시각
     * @return LocalTime 인스턴스
     * @throws IllegalArgumentException time이 null인 경우
     */
    public static LocalTime fromJavaLocalTime(java.time.LocalTime time) {
        if (time == null) {
            throw new IllegalArgumentException("time cannot be null");
        }
        return new LocalTime(time.getHour(), time.getMinute(), time.getSecond(), time.getNano() / 1_000_000);
    }

    public int getHours() {
        return hours;
    }

    public int getMinutes() {
        return minutes;
    }

    public int getSeconds() {
        return seconds;
    }

    public int getMilliseconds() {
        return milliseconds;
    }

    /**
     * 자정부터 경과한 밀리초.
     *
     * @return 0..86_399_999
     */
    public int toMillisOfDay() {
        return hours * MILLIS_PER_HOUR + minutes * MILLIS_PER_MINUTE + seconds * MILLIS_PER_SECOND + milliseconds;
    }

    public java.time.LocalTime toJavaLocalTime() {
        return java.time.LocalTime.of(hours, minutes, seconds, milliseconds * 1_000_000);
    }

    /**
     * 디버그용 표현.
     *
     * @return {@code LocalTime [ HH:MM:SS ]}
     */
    public String toDebugString() {
        return "LocalTime [ " + this + " ]";
    }

    @Override
    public int compareTo(LocalTime other) {
        return Integer.compare(toMillisOfDay(), other.toMillisOfDay());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocalTime that = (LocalTime) o;
        return hours == that.hours
            && minutes == that.minutes
            && seconds == that.seconds
            && milliseconds == that.milliseconds;
    }

    @Override
    public int hashCode() {
        return toMillisOfDay();
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        TemporalText.formatTo(formatter, flags, width, precision, toString(), toDebugString());
    }

    @Override
    public String toString() {
        String repr = TemporalText.pad2(hours) + ':' + TemporalText.pad2(minutes) + ':' + TemporalText.pad2(seconds);
        if (milliseconds != 0) {
            repr += '.' + TemporalText.millisFraction(milliseconds);
        }
        return repr;
    }
}
