package com.ryuqq.temporal.core.model;

import com.ryuqq.temporal.core.exception.FormatInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Period;
import java.util.Formattable;
import java.util.Formatter;

/**
 * 달력을 인식하는 기간 (개월, 일, 밀리초).
 *
 * <p>서버의 interval 타입처럼 세 구성 요소를 서로 독립적으로 저장합니다.
 * 한 달의 길이는 가변이므로 "1개월"과 "30일"은 서로 다른 값이며, 개월을 일로 환산하는 등의
 * 정규화는 하지 않습니다. 각 구성 요소의 부호도 독립적입니다.</p>
 *
 * <p><strong>유효성 검증:</strong> 없음 (범위 제한 없음)</p>
 *
 * <p><strong>정규 문자열 (PostgreSQL interval verbose 스타일):</strong></p>
 * <pre>
 * Duration.of(0, 0, 0).toString();           // "00:00:00"
 * Duration.of(14, 0, 0).toString();          // "1 year 2 months"
 * Duration.of(0, 0, 3_661_500).toString();   // "01:01:01.5"
 * Duration.of(-14, 3, 0).toString();         // "-1 year -2 months +3 days"
 * Duration.of(0, -1, 3_600_000).toString();  // "-1 day +01:00:00"
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class Duration implements Formattable {

    private static final Logger log = LoggerFactory.getLogger(Duration.class);

    /**
     * 모든 구성 요소가 0인 기간.
     */
    public static final Duration ZERO = new Duration(0, 0, 0L);

    private static final long MILLIS_PER_HOUR = 3_600_000L;
    private static final long MILLIS_PER_MINUTE = 60_000L;
    private static final long MILLIS_PER_SECOND = 1_000L;

    private final int months;
    private final int days;
    private final long milliseconds;

    private Duration(int months, int days, long milliseconds) {
        this.months = months;
        this.days = days;
        this.milliseconds = milliseconds;
    }

    public static Duration of(int months) {
        return of(months, 0, 0L);
    }

    public static Duration of(int months, int days) {
        return of(months, days, 0L);
    }

    /**
     * Duration 생성. 값을 그대로 저장합니다.
     *
     * @param months 개월 (부호 있음)
     * @param days 일 (부호 있음)
     * @param milliseconds 밀리초 (부호 있음)
     * @return Duration 인스턴스
     */
    public static Duration of(int months, int days, long milliseconds) {
        if (months == 0 && days == 0 && milliseconds == 0L) {
            return ZERO;
        }
        return new Duration(months, days, milliseconds);
    }

    public int getMonths() {
        return months;
    }

    public int getDays() {
        return days;
    }

    public long getMilliseconds() {
        return milliseconds;
    }

    public boolean isZero() {
        return months == 0 && days == 0 && milliseconds == 0L;
    }

    /**
     * 개월과 일 부분을 {@link Period}로 변환.
     *
     * @return Period (years는 항상 0, 개월은 정규화하지 않음)
     */
    public Period toPeriod() {
        return Period.of(0, months, days);
    }

    /**
     * 밀리초 부분을 {@link java.time.Duration}으로 변환.
     *
     * @return java.time.Duration
     */
    public java.time.Duration toTimeDuration() {
        return java.time.Duration.ofMillis(milliseconds);
    }

    /**
     * 디버그용 표현.
     *
     * @return {@code Duration [ ... ]}
     */
    public String toDebugString() {
        return "Duration [ " + this + " ]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Duration that = (Duration) o;
        return months == that.months && days == that.days && milliseconds == that.milliseconds;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * months + days) + Long.hashCode(milliseconds);
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        TemporalText.formatTo(formatter, flags, width, precision, toString(), toDebugString());
    }

    /**
     * 정규 문자열.
     *
     * <p><strong>알고리즘:</strong></p>
     * <pre>
     * 1. months → years, remMonths (0 방향 절삭)
     * 2. milliseconds → hours, minutes, seconds, fracMs (0 방향 절삭)
     * 3. hours 부호가 입력 부호와 다르면 "interval out of range"
     * 4. 0이 아닌 years / months / days를 "n unit[s]"로 출력
     *    직전 단위가 음수이고 현재 단위가 양수면 "+" 접두사
     * 5. 달력 단위가 하나도 없거나 시간 성분이 0이 아니면 "HH:MM:SS[.ffffff]"
     *    시간 성분 중 음수가 있으면 "-", 아니면 직전 단위가 음수일 때 "+"
     * </pre>
     *
     * @return 정규 문자열
     * @throws FormatInvariantException 시간 분해 결과의 부호가 입력과 다른 경우
     */
    @Override
    public String toString() {
        int years = months / 12;
        int remMonths = months % 12;

        long time = milliseconds;
        long hours = time / MILLIS_PER_HOUR;
        if (hours != 0 && (hours < 0) != (time < 0)) {
            log.error("Interval hours overflow: milliseconds={}, hours={}", milliseconds, hours);
            throw new FormatInvariantException("interval out of range");
        }
        time -= hours * MILLIS_PER_HOUR;
        long minutes = time / MILLIS_PER_MINUTE;
        time -= minutes * MILLIS_PER_MINUTE;
        long seconds = time / MILLIS_PER_SECOND;
        long fracMs = time - seconds * MILLIS_PER_SECOND;

        StringBuilder sb = new StringBuilder();
        boolean before = appendUnit(sb, years, "year", false);
        before = appendUnit(sb, remMonths, "month", before);
        before = appendUnit(sb, days, "day", before);

        if (sb.length() == 0 || hours != 0 || minutes != 0 || seconds != 0 || fracMs != 0) {
            boolean negative = hours < 0 || minutes < 0 || seconds < 0 || fracMs < 0;
            if (sb.length() > 0) {
                sb.append(' ');
            }
            if (negative) {
                sb.append('-');
            } else if (before) {
                sb.append('+');
            }
            sb.append(TemporalText.pad2(Math.abs(hours)))
                .append(':').append(TemporalText.pad2(Math.abs(minutes)))
                .append(':').append(TemporalText.pad2(Math.abs(seconds)));

            if (fracMs != 0) {
                String micros = TemporalText.padLeft(Math.abs(fracMs) * 1_000, 6);
                sb.append('.').append(TemporalText.stripTrailingZeros(micros));
            }
        }
        return sb.toString();
    }

    /**
     * 0이 아닌 달력 단위를 출력.
     *
     * @return 다음 단위 기준의 "직전 단위가 음수" 여부
     */
    private static boolean appendUnit(StringBuilder sb, int value, String unit, boolean before) {
        if (value == 0) {
            return before;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        if (before && value > 0) {
            sb.append('+');
        }
        sb.append(value).append(' ').append(unit);
        if (Math.abs((long) value) != 1) {
            sb.append('s');
        }
        return value < 0;
    }
}
