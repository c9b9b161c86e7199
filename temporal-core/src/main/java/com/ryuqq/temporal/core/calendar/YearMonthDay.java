package com.ryuqq.temporal.core.calendar;

/**
 * 서수 변환 결과로 얻은 (연, 월, 일) 조합.
 *
 * <p>{@link CalendarMath} 내부 규약을 따라 월은 1부터 시작합니다 (1..12).</p>
 *
 * @param year 연도 (Proleptic Gregorian, 0 이하 허용)
 * @param month 월 (1..12)
 * @param day 일 (1..31)
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public record YearMonthDay(int year, int month, int day) {
}
