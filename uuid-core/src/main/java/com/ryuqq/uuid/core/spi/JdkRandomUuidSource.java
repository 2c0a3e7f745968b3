package com.ryuqq.uuid.core.spi;

import java.util.UUID;

/**
 * JDK {@link UUID#randomUUID()} 기반 기본 구현.
 *
 * <p>{@code UUID.randomUUID()}는 {@code SecureRandom}을 사용하여 버전 4 UUID를 생성합니다.</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class JdkRandomUuidSource implements RandomUuidSource {

    /** 공유 인스턴스 (상태 없음). */
    public static final JdkRandomUuidSource INSTANCE = new JdkRandomUuidSource();

    private JdkRandomUuidSource() {
    }

    @Override
    public String nextUuidString() {
        return UUID.randomUUID().toString();
    }
}
