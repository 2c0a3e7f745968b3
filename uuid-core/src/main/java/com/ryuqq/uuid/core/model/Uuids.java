package com.ryuqq.uuid.core.model;

import com.ryuqq.uuid.core.exception.UuidFormatException;

import java.util.Arrays;

/**
 * 여러 입력 형태를 받는 UUID 정적 연산.
 *
 * <p>모든 메서드는 입력을 {@link Uuid#of(Object)}와 같은 규칙으로 파싱하며, 파싱 실패 시
 * 같은 예외를 던집니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Uuids.allEqual("9e472052-a654-4693-9a8b-3ce57ada3d6c",
 *                "9E472052A65446939A8B3CE57ADA3D6C");   // true
 * Uuids.compare(Uuid.nil(), Uuid.max());                // -1
 * Uuids.version("9e472052-a654-4693-9a8b-3ce57ada3d6c"); // 4
 * </pre>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class Uuids {

    private Uuids() {
    }

    /**
     * 모든 입력이 같은 UUID인지 비교.
     *
     * <p>첫 입력을 기준으로 나머지를 순서대로 비교하며, null이나 불일치를 만나면 즉시 false를 반환합니다.
     * 즉시 반환 이후의 입력은 파싱하지 않습니다.</p>
     *
     * @param inputs 비교할 입력 (2개 이상)
     * @return 모든 입력이 바이트 단위로 같으면 true
     * @throws IllegalArgumentException 입력이 2개 미만인 경우
     * @throws UuidFormatException 형식이 잘못된 입력이 있는 경우
     * @throws com.ryuqq.uuid.core.exception.InvalidUuidInputException 지원하지 않는 타입이 있는 경우
     */
    public static boolean allEqual(Object... inputs) {
        if (inputs == null || inputs.length < 2) {
            throw new IllegalArgumentException("At least two UUIDs required for comparison");
        }
        if (inputs[0] == null) {
            return false;
        }
        byte[] reference = UuidParser.parse(inputs[0]);
        for (int i = 1; i < inputs.length; i++) {
            Object input = inputs[i];
            if (input == null) {
                return false;
            }
            if (!Arrays.equals(reference, UuidParser.parse(input))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 부호 없는 바이트 사전순 비교.
     *
     * <p>하이픈 위치가 고정되어 있으므로 소문자 정규화된 문자열 순서와 일치합니다.</p>
     *
     * @param first 첫 번째 입력
     * @param second 두 번째 입력
     * @return first &lt; second 이면 -1, 같으면 0, 크면 1
     */
    public static int compare(Object first, Object second) {
        return UuidParser.compare(UuidParser.parse(first), UuidParser.parse(second));
    }

    /**
     * 버전 니블 조회.
     *
     * <p>byte[]는 길이만 검사한 뒤 원시 값을 읽고, 그 외 형태는 먼저 파싱합니다.</p>
     *
     * @param input 지원되는 입력 형태
     * @return byte 6의 상위 4비트 (0~15)
     * @throws UuidFormatException byte[] 길이가 16이 아니거나 문자열 형식이 잘못된 경우
     */
    public static int version(Object input) {
        if (input instanceof byte[]) {
            byte[] bytes = (byte[]) input;
            if (bytes.length != UuidParser.BYTE_LENGTH) {
                throw new UuidFormatException("Invalid UUID byte length: expected "
                    + UuidParser.BYTE_LENGTH + ", got " + bytes.length);
            }
            return UuidParser.version(bytes);
        }
        return UuidParser.version(UuidParser.parse(input));
    }
}
