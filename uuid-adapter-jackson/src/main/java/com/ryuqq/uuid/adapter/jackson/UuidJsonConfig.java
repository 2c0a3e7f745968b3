package com.ryuqq.uuid.adapter.jackson;

/**
 * JSON 역직렬화 설정 (불변 record).
 *
 * <p>직렬화는 항상 RFC 4122 하이픈 형식(소문자)을 사용하며, 이 설정은 읽기 규칙만 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>acceptCompactHex: 32자 16진수 형식 허용 (기본 true)</li>
 *   <li>acceptBinary: 16바이트 바이너리 값(base64 텍스트 포함) 허용 (기본 false)</li>
 *   <li>requireValidBytes: 바이너리 값에 버전/variant 검증 적용 (기본 true)</li>
 * </ul>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 * @param acceptCompactHex 32자 16진수 형식 허용 여부
 * @param acceptBinary 바이너리 값 허용 여부
 * @param requireValidBytes 바이너리 값의 버전/variant 검증 여부
 */
public record UuidJsonConfig(boolean acceptCompactHex, boolean acceptBinary, boolean requireValidBytes) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: acceptCompactHex=true, acceptBinary=false, requireValidBytes=true</p>
     */
    public UuidJsonConfig() {
        this(true, false, true);
    }

    /**
     * acceptCompactHex만 변경한 새 인스턴스 생성.
     *
     * @param acceptCompactHex 32자 16진수 형식 허용 여부
     * @return 새 UuidJsonConfig 인스턴스
     */
    public UuidJsonConfig withAcceptCompactHex(boolean acceptCompactHex) {
        return new UuidJsonConfig(acceptCompactHex, this.acceptBinary, this.requireValidBytes);
    }

    /**
     * acceptBinary만 변경한 새 인스턴스 생성.
     *
     * @param acceptBinary 바이너리 값 허용 여부
     * @return 새 UuidJsonConfig 인스턴스
     */
    public UuidJsonConfig withAcceptBinary(boolean acceptBinary) {
        return new UuidJsonConfig(this.acceptCompactHex, acceptBinary, this.requireValidBytes);
    }

    /**
     * requireValidBytes만 변경한 새 인스턴스 생성.
     *
     * @param requireValidBytes 바이너리 값의 버전/variant 검증 여부
     * @return 새 UuidJsonConfig 인스턴스
     */
    public UuidJsonConfig withRequireValidBytes(boolean requireValidBytes) {
        return new UuidJsonConfig(this.acceptCompactHex, this.acceptBinary, requireValidBytes);
    }
}
