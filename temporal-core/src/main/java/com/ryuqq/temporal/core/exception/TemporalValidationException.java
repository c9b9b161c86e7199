package com.ryuqq.temporal.core.exception;

/**
 * 값 객체 생성 시 필드가 허용 범위를 벗어난 경우 발생하는 예외.
 *
 * <p>공개 팩토리 메서드({@code LocalDate.of}, {@code LocalTime.of},
 * {@code LocalDateTime.of})가 입력을 검증할 때 동기적으로 던지며,
 * 라이브러리 내부에서 복구하지 않고 호출자에게 그대로 전파합니다.</p>
 *
 * <p><strong>메시지 형식:</strong></p>
 * <pre>
 * hours must be in 0..23 range (current: 24)
 * </pre>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class TemporalValidationException extends IllegalArgumentException {

    private final String field;
    private final long value;
    private final long min;
    private final long max;

    /**
     * 생성자.
     *
     * @param field 범위를 벗어난 필드 이름
     * @param value 입력된 값
     * @param min 허용 최솟값 (포함)
     * @param max 허용 최댓값 (포함)
     */
    public TemporalValidationException(String field, long value, long min, long max) {
        super(field + " must be in " + min + ".." + max + " range (current: " + value + ")");
        this.field = field;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    /**
     * 값이 {@code [min, max]} 범위 안에 있는지 검증.
     *
     * @param field 필드 이름
     * @param value 검증할 값
     * @param min 허용 최솟값 (포함)
     * @param max 허용 최댓값 (포함)
     * @throws TemporalValidationException 범위를 벗어난 경우
     */
    public static void checkRange(String field, long value, long min, long max) {
        if (value < min || value > max) {
            throw new TemporalValidationException(field, value, min, max);
        }
    }

    public String getField() {
        return field;
    }

    public long getValue() {
        return value;
    }

    public long getMin() {
        return min;
    }

    public long getMax() {
        return max;
    }
}
