package com.ryuqq.uuid.core.exception;

import java.util.Arrays;

/**
 * 지원하지 않는 타입(또는 null)이 UUID 입력으로 전달되었을 때 발생하는 예외.
 *
 * <p>지원 타입: {@code String}, {@code byte[]}, {@code Uuid}, {@code java.util.UUID}.
 * 그 외 타입은 형식 검사 이전에 이 예외로 거부됩니다.</p>
 *
 * <p>메시지에는 입력 값의 타입과 내용이 포함됩니다 (예: {@code [Integer] 42}).</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class InvalidUuidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String inputDescription;

    /**
     * 생성자.
     *
     * @param input 거부된 입력 값 (null 가능)
     */
    public InvalidUuidInputException(Object input) {
        this(describe(input));
    }

    private InvalidUuidInputException(String inputDescription) {
        super("Not expected invalid input received: " + inputDescription);
        this.inputDescription = inputDescription;
    }

    /**
     * 거부된 입력의 설명 조회.
     *
     * @return "null" 또는 "[타입] 값" 형식의 문자열
     */
    public String getInputDescription() {
        return inputDescription;
    }

    /**
     * 입력 값을 "[타입] 값" 형식으로 설명.
     *
     * @param input 입력 값 (null 가능)
     * @return 설명 문자열
     */
    public static String describe(Object input) {
        if (input == null) {
            return "null";
        }
        Class<?> type = input.getClass();
        if (type.isArray()) {
            // 원시 타입 배열도 요소 단위로 출력되도록 한 번 감싼 뒤 바깥 괄호 제거
            String wrapped = Arrays.deepToString(new Object[] {input});
            return "[" + type.getSimpleName() + "] " + wrapped.substring(1, wrapped.length() - 1);
        }
        return "[" + type.getSimpleName() + "] " + input;
    }
}
