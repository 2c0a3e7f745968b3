package com.ryuqq.uuid.core.spi;

import com.ryuqq.uuid.core.model.Uuid;

/**
 * 확장 타입을 반환하는 UUID 팩토리.
 *
 * <p>핵심 값 타입 {@link Uuid}는 상속 대신 조합으로 확장합니다. 확장 타입은 {@link #wrap(Uuid)}만
 * 구현하면 모든 생성 메서드가 자신의 타입을 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * UuidFactory&lt;BufferUuid&gt; factory = BufferUuid::new;
 * BufferUuid id = factory.fromString("9e472052-a654-4693-9a8b-3ce57ada3d6c");
 * </pre>
 *
 * @param <T> 생성할 타입
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UuidFactory<T> {

    /**
     * 검증이 끝난 핵심 값을 확장 타입으로 감싸기.
     *
     * @param uuid 핵심 UUID 값 (null 아님)
     * @return 확장 타입 인스턴스
     */
    T wrap(Uuid uuid);

    /**
     * 지원되는 모든 입력 형태로부터 생성.
     *
     * <p>기본 구현은 핵심 입력 형태만 받습니다. 확장 타입 자신이나 추가 형태를 받으려면 재정의합니다.</p>
     *
     * @param input String, byte[], Uuid, java.util.UUID
     * @return 확장 타입 인스턴스
     */
    default T of(Object input) {
        return wrap(Uuid.of(input));
    }

    default T fromString(String value) {
        return wrap(Uuid.fromString(value));
    }

    default T fromHex(String hex) {
        return wrap(Uuid.fromHex(hex));
    }

    default T fromBytes(byte[] bytes) {
        return wrap(Uuid.fromBytes(bytes));
    }

    default T nil() {
        return wrap(Uuid.nil());
    }

    default T max() {
        return wrap(Uuid.max());
    }

    default T v4() {
        return wrap(Uuid.v4());
    }

    /**
     * 핵심 값 그대로 반환하는 팩토리.
     *
     * @return Uuid 팩토리
     */
    static UuidFactory<Uuid> identity() {
        return uuid -> uuid;
    }
}
