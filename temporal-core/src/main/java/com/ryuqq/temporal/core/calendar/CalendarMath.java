package com.ryuqq.temporal.core.calendar;

/**
 * Proleptic Gregorian 달력 계산.
 *
 * <p>(연, 월, 일)과 서수 일(ordinal day number) 사이의 변환, 월별 일수 계산을 제공합니다.
 * 호스트의 시간대나 {@code java.util.Calendar} 같은 달력 라이브러리에 의존하지 않는 순수 함수입니다.</p>
 *
 * <p><strong>규약:</strong></p>
 * <ul>
 *   <li>월은 1부터 시작 (1..12)</li>
 *   <li>서수 1 = 0001-01-01, 하루마다 정확히 1씩 증가</li>
 *   <li>0 이하의 연도는 내림 나눗셈으로 처리 (proleptic)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CalendarMath.daysInMonth(2000, 2);      // 29
 * CalendarMath.ymdToOrdinal(1970, 1, 1);  // 719163
 * CalendarMath.ordinalToYmd(719163);      // YearMonthDay[year=1970, month=1, day=1]
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public final class CalendarMath {

    /**
     * 1970-01-01의 서수.
     */
    public static final long EPOCH_ORDINAL = 719_163L;

    private static final int DAYS_IN_400_YEARS = 146_097;
    private static final int DAYS_IN_100_YEARS = 36_524;
    private static final int DAYS_IN_4_YEARS = 1_461;

    // index 0 unused
    private static final int[] DAYS_IN_MONTH = {-1, 31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
    private static final int[] DAYS_BEFORE_MONTH = {-1, 0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334};

    private CalendarMath() {
    }

    /**
     * 윤년 여부.
     *
     * <p>4로 나누어떨어지면 윤년, 단 100으로 나누어떨어지는 해는 400으로도 나누어떨어져야 윤년.</p>
     *
     * @param year 연도
     * @return 윤년이면 true
     */
    public static boolean isLeapYear(long year) {
        return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    /**
     * 해당 연월의 일수.
     *
     * @param year 연도
     * @param month 월 (1..12)
     * @return 28..31
     */
    public static int daysInMonth(long year, int month) {
        if (month == 2 && isLeapYear(year)) {
            return 29;
        }
        return DAYS_IN_MONTH[month];
    }

    /**
     * 해당 연도 1월 1일 이전까지의 총 일수 (0001-01-01 기준).
     *
     * @param year 연도
     * @return 일수
     */
    public static long daysBeforeYear(long year) {
        long y = year - 1;
        return y * 365 + Math.floorDiv(y, 4) - Math.floorDiv(y, 100) + Math.floorDiv(y, 400);
    }

    /**
     * 해당 연도 안에서 주어진 월 1일 이전까지의 일수.
     *
     * @param year 연도
     * @param month 월 (1..12)
     * @return 0..335
     */
    public static int daysBeforeMonth(long year, int month) {
        return DAYS_BEFORE_MONTH[month] + (month > 2 && isLeapYear(year) ? 1 : 0);
    }

    /**
     * (연, 월, 일) → 서수.
     *
     * <p>유효한 날짜만 전달해야 합니다. 검증은 호출자의 책임입니다.</p>
     *
     * @param year 연도
     * @param month 월 (1..12)
     * @param day 일 (1..daysInMonth)
     * @return 서수 일
     */
    public static long ymdToOrdinal(long year, int month, int day) {
        return daysBeforeYear(year) + daysBeforeMonth(year, month) + day;
    }

    /**
     * 서수 → (연, 월, 일).
     *
     * <p>{@link #ymdToOrdinal}의 정확한 역함수입니다.
     * 400년 / 100년 / 4년 / 1년 주기로 차례로 나누어 연도를 구한 뒤,
     * 월은 {@code (n + 50) >> 5}로 추정하고 한 번만 보정합니다.</p>
     *
     * @param ordinal 서수 일
     * @return 연, 월(1..12), 일
     */
    public static YearMonthDay ordinalToYmd(long ordinal) {
        long n = ordinal - 1;
        long n400 = Math.floorDiv(n, DAYS_IN_400_YEARS);
        n = Math.floorMod(n, DAYS_IN_400_YEARS);
        long year = n400 * 400 + 1;

        int n100 = (int) (n / DAYS_IN_100_YEARS);
        n %= DAYS_IN_100_YEARS;
        int n4 = (int) (n / DAYS_IN_4_YEARS);
        n %= DAYS_IN_4_YEARS;
        int n1 = (int) (n / 365);
        n %= 365;

        year += n100 * 100L + n4 * 4L + n1;
        if (n1 == 4 || n100 == 4) {
            // last day of a leap cycle
            return new YearMonthDay(Math.toIntExact(year - 1), 12, 31);
        }

        boolean leapYear = n1 == 3 && (n4 != 24 || n100 == 3);
        int dayOfYear = (int) n;
        int month = (dayOfYear + 50) >> 5;
        int preceding = DAYS_BEFORE_MONTH[month] + (month > 2 && leapYear ? 1 : 0);
        if (preceding > dayOfYear) {
            month -= 1;
            preceding -= DAYS_IN_MONTH[month] + (month == 2 && leapYear ? 1 : 0);
        }
        return new YearMonthDay(Math.toIntExact(year), month, dayOfYear - preceding + 1);
    }

    /**
     * 서수 → 1970-01-01 기준 일수.
     *
     * @param ordinal 서수 일
     * @return epoch day
     */
    public static long ordinalToEpochDay(long ordinal) {
        return ordinal - EPOCH_ORDINAL;
    }

    /**
     * 1970-01-01 기준 일수 → 서수.
     *
     * @param epochDay epoch day
     * @return 서수 일
     */
    public static long epochDayToOrdinal(long epochDay) {
        return epochDay + EPOCH_ORDINAL;
    }
}
