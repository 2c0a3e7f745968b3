package com.ryuqq.uuid.core.model;

import java.util.UUID;

/**
 * UUID 유효성 검증 술어 모음.
 *
 * <p>모든 메서드는 부수 효과가 없고 예외를 던지지 않습니다. 실패는 항상 {@code false}로 변환됩니다.
 * 예외 없이 입력을 확인해야 하는 호출자는 파싱 전에 이 클래스를 사용합니다.</p>
 *
 * <p><strong>유효성 규칙:</strong></p>
 * <ul>
 *   <li>문자열: 36자 RFC 4122 형식 또는 32자 16진수 형식</li>
 *   <li>버전 니블(byte 6 상위 4비트): 1~5</li>
 *   <li>variant 비트(byte 8 상위 2비트): 0b10</li>
 * </ul>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class UuidValidator {

    private UuidValidator() {
    }

    /**
     * 하이픈 없는 32자 16진수 UUID 검증.
     *
     * @param hex 검사할 문자열 (null 허용)
     * @return 형식, 버전, variant가 모두 올바르면 true
     */
    public static boolean isValidHex(String hex) {
        return hex != null && UuidParser.HEX_PATTERN.matcher(hex).matches();
    }

    /**
     * RFC 4122 하이픈 형식 UUID 검증.
     *
     * @param value 검사할 문자열 (null 허용)
     * @return 형식, 버전, variant가 모두 올바르면 true
     */
    public static boolean isValidString(String value) {
        return value != null && UuidParser.RFC4122_PATTERN.matcher(value).matches();
    }

    /**
     * 16바이트 UUID 검증.
     *
     * @param bytes 검사할 바이트 배열 (null 허용)
     * @return 길이 16, 버전 1~5, variant 10이면 true
     */
    public static boolean isValidBytes(byte[] bytes) {
        if (bytes == null || bytes.length != UuidParser.BYTE_LENGTH) {
            return false;
        }
        int version = UuidParser.version(bytes);
        if (version < 1 || version > 5) {
            return false;
        }
        return UuidParser.variant(bytes) == 0b10;
    }

    /**
     * 지원되는 모든 입력 형태에 대한 검증.
     *
     * <p>String(36자/32자), byte[], Uuid, java.util.UUID 외의 타입과 null은 false입니다.</p>
     *
     * @param input 검사할 값 (null 허용)
     * @return 유효한 UUID 표현이면 true
     */
    public static boolean isValid(Object input) {
        if (input == null) {
            return false;
        }
        if (input instanceof String) {
            String value = (String) input;
            switch (value.length()) {
                case UuidParser.STR_LENGTH:
                    return isValidString(value);
                case UuidParser.HEX_STR_LENGTH:
                    return isValidHex(value);
                default:
                    return false;
            }
        }
        if (input instanceof Uuid) {
            return isValidBytes(((Uuid) input).bytes());
        }
        if (input instanceof byte[]) {
            return isValidBytes((byte[]) input);
        }
        if (input instanceof UUID) {
            return isValidBytes(UuidParser.fromJdk((UUID) input));
        }
        return false;
    }
}
