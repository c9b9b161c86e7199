package com.ryuqq.temporal.core.model;

import java.util.Formatter;
import java.util.FormattableFlags;

/**
 * 정규 문자열 조립용 헬퍼.
 */
final class TemporalText {

    private TemporalText() {
    }

    static String pad2(long value) {
        return value < 10 ? "0" + value : Long.toString(value);
    }

    static String pad3(long value) {
        return padLeft(value, 3);
    }

    /**
     * 음이 아닌 값을 최소 {@code width}자리로 0을 채워 출력. 로캘과 무관합니다.
     */
    static String padLeft(long value, int width) {
        String digits = Long.toString(value);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    /**
     * 연도를 최소 4자리로 출력. 음수는 부호 뒤에 0을 채웁니다 (-0001).
     */
    static String year(int year) {
        String digits = Long.toString(Math.abs((long) year));
        StringBuilder sb = new StringBuilder(6);
        if (year < 0) {
            sb.append('-');
        }
        for (int i = digits.length(); i < 4; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    /**
     * 밀리초를 소수부로 변환. 3자리로 채운 뒤 뒤쪽 0 제거 (500 → "5", 5 → "005").
     */
    static String millisFraction(int millis) {
        return stripTrailingZeros(pad3(millis));
    }

    static String stripTrailingZeros(String digits) {
        int end = digits.length();
        while (end > 0 && digits.charAt(end - 1) == '0') {
            end--;
        }
        return digits.substring(0, end);
    }

    /**
     * {@link java.util.Formattable} 공통 구현.
     *
     * <p>ALTERNATE 플래그({@code %#s})가 있으면 디버그 표현, 없으면 정규 문자열.
     * precision은 최대 길이, width는 최소 길이 (LEFT_JUSTIFY 시 오른쪽에 공백).</p>
     */
    static void formatTo(Formatter formatter, int flags, int width, int precision,
                         String canonical, String debug) {
        String text = (flags & FormattableFlags.ALTERNATE) != 0 ? debug : canonical;
        if (precision >= 0 && text.length() > precision) {
            text = text.substring(0, precision);
        }
        if (width > text.length()) {
            String padding = " ".repeat(width - text.length());
            text = (flags & FormattableFlags.LEFT_JUSTIFY) != 0 ? text + padding : padding + text;
        }
        formatter.format("%s", text);
    }
}
