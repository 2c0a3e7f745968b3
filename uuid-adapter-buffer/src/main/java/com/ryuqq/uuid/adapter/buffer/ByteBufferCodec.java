package com.ryuqq.uuid.adapter.buffer;

import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.exception.UuidFormatException;
import com.ryuqq.uuid.core.model.Uuid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;

/**
 * {@link Uuid}와 {@link ByteBuffer} 간 변환기.
 *
 * <p>바이트는 배열 순서 그대로 복사되므로 버퍼의 {@link java.nio.ByteOrder} 설정과 무관합니다.</p>
 *
 * <p><strong>두 가지 접근 방식:</strong></p>
 * <ul>
 *   <li>절대 접근: {@link #toByteBuffer(Uuid)}, {@link #fromByteBuffer(ByteBuffer)} - 호출자 버퍼의 position 유지</li>
 *   <li>상대 접근: {@link #writeTo(Uuid, ByteBuffer)}, {@link #readFrom(ByteBuffer)} - position 16 증가</li>
 * </ul>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class ByteBufferCodec {

    private static final Logger log = LoggerFactory.getLogger(ByteBufferCodec.class);

    private ByteBufferCodec() {
    }

    /**
     * 새 힙 버퍼로 변환.
     *
     * @param uuid 변환할 값
     * @return position 0, limit 16 인 버퍼
     * @throws InvalidUuidInputException uuid가 null인 경우
     */
    public static ByteBuffer toByteBuffer(Uuid uuid) {
        if (uuid == null) {
            throw new InvalidUuidInputException(null);
        }
        ByteBuffer out = ByteBuffer.allocate(Uuid.BYTE_LENGTH);
        out.put(uuid.toBytes());
        return out.flip();
    }

    /**
     * 남은 바이트가 정확히 16인 버퍼로부터 생성.
     *
     * <p>버퍼의 position은 변경되지 않습니다.</p>
     *
     * @param buffer 16바이트가 남아 있는 버퍼
     * @return Uuid 인스턴스
     * @throws UuidFormatException remaining()이 16이 아닌 경우
     * @throws InvalidUuidInputException buffer가 null인 경우
     */
    public static Uuid fromByteBuffer(ByteBuffer buffer) {
        if (buffer == null) {
            throw new InvalidUuidInputException(null);
        }
        if (buffer.remaining() != Uuid.BYTE_LENGTH) {
            log.debug("Rejected UUID buffer with {} remaining bytes", buffer.remaining());
            throw new UuidFormatException("Invalid UUID buffer length: expected "
                + Uuid.BYTE_LENGTH + ", got " + buffer.remaining());
        }
        byte[] bytes = new byte[Uuid.BYTE_LENGTH];
        buffer.duplicate().get(bytes);
        return Uuid.fromBytes(bytes);
    }

    /**
     * 현재 position에 16바이트 기록.
     *
     * @param uuid 기록할 값
     * @param buffer 대상 버퍼 (16바이트 이상 남아 있어야 함)
     * @throws UuidFormatException 남은 공간이 16 미만인 경우
     */
    public static void writeTo(Uuid uuid, ByteBuffer buffer) {
        if (uuid == null) {
            throw new InvalidUuidInputException(null);
        }
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        if (buffer.remaining() < Uuid.BYTE_LENGTH) {
            log.debug("Buffer too small for UUID: {} remaining", buffer.remaining());
            throw new UuidFormatException("Insufficient buffer space: need "
                + Uuid.BYTE_LENGTH + ", remaining " + buffer.remaining());
        }
        buffer.put(uuid.toBytes());
    }

    /**
     * 현재 position에서 16바이트 읽기.
     *
     * @param buffer 원본 버퍼 (16바이트 이상 남아 있어야 함)
     * @return Uuid 인스턴스
     * @throws UuidFormatException 남은 바이트가 16 미만인 경우
     */
    public static Uuid readFrom(ByteBuffer buffer) {
        if (buffer == null) {
            throw new InvalidUuidInputException(null);
        }
        if (buffer.remaining() < Uuid.BYTE_LENGTH) {
            log.debug("Buffer underflow reading UUID: {} remaining", buffer.remaining());
            throw new UuidFormatException("Insufficient buffer data: need "
                + Uuid.BYTE_LENGTH + ", remaining " + buffer.remaining());
        }
        byte[] bytes = new byte[Uuid.BYTE_LENGTH];
        buffer.get(bytes);
        return Uuid.fromBytes(bytes);
    }
}
