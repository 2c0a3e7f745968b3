package com.ryuqq.uuid.adapter.buffer;

import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.model.Uuid;
import com.ryuqq.uuid.testkit.contract.UuidFixtures;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BufferUuid 데코레이터 테스트.
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
class BufferUuidTest {

    @Test
    void of_ByteBuffer_CreatesSameValue() {
        // Given
        ByteBuffer buffer = ByteBuffer.wrap(Uuid.fromString(UuidFixtures.SAMPLE).toBytes());

        // When
        BufferUuid value = BufferUuid.of(buffer);

        // Then
        assertEquals(UuidFixtures.SAMPLE, value.toString());
        assertEquals(UuidFixtures.SAMPLE_HEX, value.toHex());
        assertEquals(4, value.version());
    }

    @Test
    void of_CoreInputShapes_CreatesSameValue() {
        // When & Then
        assertEquals(BufferUuid.of(UuidFixtures.SAMPLE), BufferUuid.of(UuidFixtures.SAMPLE_HEX));
        assertEquals(BufferUuid.of(UuidFixtures.SAMPLE), BufferUuid.of(UUID.fromString(UuidFixtures.SAMPLE)));
        assertEquals(BufferUuid.of(UuidFixtures.SAMPLE), BufferUuid.of(Uuid.fromString(UuidFixtures.SAMPLE)));
    }

    @Test
    void of_ExistingBufferUuid_CopiesByValue() {
        // Given
        BufferUuid original = BufferUuid.of(UuidFixtures.SAMPLE);

        // When
        BufferUuid copy = BufferUuid.of(original);

        // Then
        assertEquals(original, copy);
        assertNotSame(original.uuid(), copy.uuid());
    }

    @Test
    void factoryOf_WrapperAndBufferInputs_MatchesStaticOf() {
        // Given
        BufferUuid original = BufferUuid.of(UuidFixtures.SAMPLE);
        ByteBuffer buffer = original.toByteBuffer();

        // When
        BufferUuid fromWrapper = BufferUuid.FACTORY.of(original);
        BufferUuid fromBuffer = BufferUuid.FACTORY.of(buffer);

        // Then
        assertEquals(original, fromWrapper);
        assertNotSame(original.uuid(), fromWrapper.uuid());
        assertEquals(original, fromBuffer);
    }

    @Test
    void factoryOf_UnsupportedType_ThrowsInvalidInput() {
        // When & Then
        assertThrows(InvalidUuidInputException.class, () -> BufferUuid.FACTORY.of(42));
    }

    @Test
    void toByteBuffer_RoundTrips() {
        // Given
        BufferUuid value = BufferUuid.FACTORY.v4();

        // When
        ByteBuffer buffer = value.toByteBuffer();

        // Then
        assertEquals(value, BufferUuid.of(buffer));
        assertArrayEquals(value.toBytes(), value.uuid().toBytes());
    }

    @Test
    void toByteBuffer_IndependentOfInternalState() {
        // Given
        BufferUuid value = BufferUuid.of(UuidFixtures.SAMPLE);
        ByteBuffer buffer = value.toByteBuffer();

        // When
        buffer.put(0, (byte) 0);

        // Then
        assertEquals(UuidFixtures.SAMPLE, value.toString());
    }

    @Test
    void compareTo_FollowsWrappedValue() {
        // Given
        BufferUuid nil = BufferUuid.FACTORY.nil();
        BufferUuid max = BufferUuid.FACTORY.max();

        // When & Then
        assertEquals(-1, nil.compareTo(max));
        assertEquals(1, max.compareTo(nil));
        assertEquals(0, nil.compareTo(BufferUuid.of(new byte[16])));
    }

    @Test
    void equals_DifferentTypeWithSameBytes_ReturnsFalse() {
        // Given
        BufferUuid value = BufferUuid.of(UuidFixtures.SAMPLE);

        // When & Then
        assertNotEquals(value, value.uuid());
        assertEquals(value.hashCode(), value.uuid().hashCode());
    }

    @Test
    void constructor_Null_ThrowsInvalidInput() {
        // When & Then
        assertThrows(InvalidUuidInputException.class, () -> new BufferUuid(null));
    }
}
