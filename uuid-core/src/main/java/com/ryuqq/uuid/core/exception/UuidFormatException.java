package com.ryuqq.uuid.core.exception;

/**
 * 입력의 타입은 올바르지만 길이 또는 형식이 UUID 규칙에 맞지 않을 때 발생하는 예외.
 *
 * <p><strong>발생 예시:</strong></p>
 * <ul>
 *   <li>36자/32자가 아닌 문자열</li>
 *   <li>16진수가 아닌 문자, 버전(1~5) 또는 variant(8,9,a,b) 위치의 잘못된 값</li>
 *   <li>16바이트가 아닌 바이트 배열</li>
 * </ul>
 *
 * <p>값을 보정하지 않고 항상 호출자에게 전달됩니다.</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class UuidFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public UuidFormatException(String message) {
        super(message);
    }
}
