package com.ryuqq.uuid.core.spi;

/**
 * 랜덤 UUID 생성 SPI.
 *
 * <p>{@code Uuid.v4()}는 이 SPI가 반환한 RFC 4122 문자열을 엄격한 파서로 다시 검증합니다.
 * 따라서 구현체는 외부 입력과 동일한 규칙을 따르는 문자열을 반환해야 합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>암호학적으로 안전한 난수원 사용</li>
 *   <li>36자 하이픈 형식, 버전 4, variant 10</li>
 *   <li>실패 시 예외를 던지며 재시도하지 않음</li>
 * </ul>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RandomUuidSource {

    /**
     * 새 랜덤 UUID 문자열 생성.
     *
     * @return RFC 4122 형식의 v4 UUID 문자열
     */
    String nextUuidString();
}
