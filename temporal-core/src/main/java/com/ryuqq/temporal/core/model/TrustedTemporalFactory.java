package com.ryuqq.temporal.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 검증을 생략하는 내부 전용 생성 경로.
 *
 * <p>와이어 프로토콜 디코더처럼 이미 유효성이 보장된 값을 다루는 신뢰된 호출자만 사용합니다.
 * 값 타입의 생성자는 private이고 검증 생략 팩토리는 package-private이므로,
 * 이 클래스가 그 경로로 들어가는 유일한 입구입니다.</p>
 *
 * <p><strong>주의:</strong> 애플리케이션 코드는 각 타입의 {@code of(...)}를 사용해야 합니다.
 * 이 클래스로 범위를 벗어난 필드를 주입하면 정규 문자열과 비교 결과가 정의되지 않습니다.</p>
 *
 * <p><strong>예시 (디코더):</strong></p>
 * <pre>
 * LocalDateTime value = TrustedTemporalFactory.localDateTime(epochMillis);
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class TrustedTemporalFactory {

    private static final Logger log = LoggerFactory.getLogger(TrustedTemporalFactory.class);

    private TrustedTemporalFactory() {
    }

    /**
     * 검증 없이 LocalDate 생성.
     *
     * @param year 연도
     * @param month 월 (0..11)
     * @param day 일
     * @return LocalDate 인스턴스
     */
    public static LocalDate localDate(int year, int month, int day) {
        log.trace("Trusted LocalDate: year={}, month={}, day={}", year, month, day);
        return LocalDate.unchecked(year, month, day);
    }

    /**
     * 검증 없이 LocalTime 생성.
     *
     * @param hours 시
     * @param minutes 분
     * @param seconds 초
     * @param milliseconds 밀리초
     * @return LocalTime 인스턴스
     */
    public static LocalTime localTime(int hours, int minutes, int seconds, int milliseconds) {
        log.trace("Trusted LocalTime: {}:{}:{}.{}", hours, minutes, seconds, milliseconds);
        return LocalTime.unchecked(hours, minutes, seconds, milliseconds);
    }

    /**
     * 미리 계산된 UTC epoch 밀리초로 LocalDateTime 생성.
     *
     * @param epochMillis epoch 밀리초
     * @return LocalDateTime 인스턴스
     */
    public static LocalDateTime localDateTime(long epochMillis) {
        log.trace("Trusted LocalDateTime: epochMillis={}", epochMillis);
        return LocalDateTime.unchecked(epochMillis);
    }

    /**
     * Duration 생성. {@link Duration#of(int, int, long)}와 동일하며 디코더의 진입점을 하나로 유지합니다.
     *
     * @param months 개월
     * @param days 일
     * @param milliseconds 밀리초
     * @return Duration 인스턴스
     */
    public static Duration duration(int months, int days, long milliseconds) {
        return Duration.of(months, days, milliseconds);
    }
}
