package com.ryuqq.temporal.core.exception;

/**
 * 정규 문자열 변환 중 내부 가정이 깨졌을 때 발생하는 치명적 예외.
 *
 * <p>다음 두 경우에 발생합니다:</p>
 * <ul>
 *   <li>범용 포매터 출력이 예상한 형식이 아님 (예: ISO 문자열의 {@code Z} 접미사 누락)</li>
 *   <li>Duration 분해 결과의 부호가 입력과 불일치 (오버플로)</li>
 * </ul>
 *
 * <p>프로그래밍 결함을 의미하므로 재시도하거나 삼키지 않습니다.</p>
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public class FormatInvariantException extends IllegalStateException {

    public FormatInvariantException(String message) {
        super(message);
    }
}
