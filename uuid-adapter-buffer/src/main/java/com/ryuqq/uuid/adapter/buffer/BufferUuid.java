package com.ryuqq.uuid.adapter.buffer;

import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.model.Uuid;
import com.ryuqq.uuid.core.spi.UuidFactory;

import java.nio.ByteBuffer;

/**
 * {@link ByteBuffer} 접근자를 추가한 UUID 데코레이터.
 *
 * <p>핵심 값 {@link Uuid}를 감싸며, 동등성과 순서는 감싼 값의 것을 그대로 따릅니다.
 * {@link #FACTORY}를 통해 모든 생성 메서드가 {@code BufferUuid}를 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * BufferUuid id = BufferUuid.FACTORY.fromString("9e472052-a654-4693-9a8b-3ce57ada3d6c");
 * ByteBuffer buffer = id.toByteBuffer();
 * BufferUuid same = BufferUuid.of(buffer);
 * </pre>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class BufferUuid implements Comparable<BufferUuid> {

    /** BufferUuid 팩토리. {@code of}는 {@link #of(Object)}와 같은 입력 형태를 받습니다. */
    public static final UuidFactory<BufferUuid> FACTORY = new UuidFactory<>() {
        @Override
        public BufferUuid wrap(Uuid uuid) {
            return new BufferUuid(uuid);
        }

        @Override
        public BufferUuid of(Object input) {
            return BufferUuid.of(input);
        }
    };

    private final Uuid uuid;

    /**
     * 생성자.
     *
     * @param uuid 감쌀 값
     * @throws InvalidUuidInputException uuid가 null인 경우
     */
    public BufferUuid(Uuid uuid) {
        if (uuid == null) {
            throw new InvalidUuidInputException(null);
        }
        this.uuid = uuid;
    }

    /**
     * 핵심 입력 형태와 버퍼 형태로부터 생성.
     *
     * @param input String, byte[], Uuid, java.util.UUID, ByteBuffer(남은 바이트 16), BufferUuid
     * @return BufferUuid 인스턴스
     */
    public static BufferUuid of(Object input) {
        if (input instanceof ByteBuffer) {
            return new BufferUuid(ByteBufferCodec.fromByteBuffer((ByteBuffer) input));
        }
        if (input instanceof BufferUuid) {
            return new BufferUuid(Uuid.of(((BufferUuid) input).uuid));
        }
        return new BufferUuid(Uuid.of(input));
    }

    /**
     * 감싼 핵심 값 조회.
     *
     * @return Uuid
     */
    public Uuid uuid() {
        return uuid;
    }

    /**
     * 새 힙 버퍼로 변환.
     *
     * @return position 0, limit 16 인 버퍼
     */
    public ByteBuffer toByteBuffer() {
        return ByteBufferCodec.toByteBuffer(uuid);
    }

    public String toHex() {
        return uuid.toHex();
    }

    public byte[] toBytes() {
        return uuid.toBytes();
    }

    public int version() {
        return uuid.version();
    }

    @Override
    public int compareTo(BufferUuid other) {
        return uuid.compareTo(other.uuid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BufferUuid that = (BufferUuid) o;
        return uuid.equals(that.uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return uuid.toString();
    }
}
