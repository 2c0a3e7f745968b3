package com.ryuqq.uuid.core.model;

import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.exception.UuidFormatException;
import com.ryuqq.uuid.core.spi.RandomUuidSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Uuid Value Object 테스트.
 *
 * <p>파싱, 포맷, 캐시, 불변성, 바이트 생성 경로의 검증 차이를 확인합니다.</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class UuidTest {

    private static final String SAMPLE = "9e472052-a654-4693-9a8b-3ce57ada3d6c";
    private static final String SAMPLE_HEX = "9e472052a65446939a8b3ce57ada3d6c";

    @Mock
    private RandomUuidSource randomSource;

    // ============================================================
    // 1. 문자열 파싱
    // ============================================================

    @Test
    void fromString_ValidValue_CreatesUuid() {
        // When
        Uuid uuid = Uuid.fromString(SAMPLE);

        // Then
        assertEquals(SAMPLE, uuid.toString());
        assertEquals(SAMPLE_HEX, uuid.toHex());
        assertEquals(4, uuid.version());
    }

    @Test
    void fromString_UppercaseValue_FormatsLowercase() {
        // When
        Uuid uuid = Uuid.fromString(SAMPLE.toUpperCase(Locale.ROOT));

        // Then
        assertEquals(SAMPLE, uuid.toString());
    }

    @Test
    void fromString_EachVersion1To5_CreatesUuid() {
        // Given
        String[] values = {
            "6ba7b810-9dad-11d1-80b4-00c04fd430c8",
            "000003e8-cbb9-21ea-b201-00155d9b2bde",
            "a3bb189e-8bf9-3888-9912-ace4e6543002",
            SAMPLE,
            "886313e1-3b8a-5372-9b90-0c9aee199e5d"
        };

        // When & Then
        for (int i = 0; i < values.length; i++) {
            assertEquals(i + 1, Uuid.fromString(values[i]).version());
        }
    }

    @Test
    void fromString_Version6_ThrowsException() {
        // When & Then
        UuidFormatException exception = assertThrows(
            UuidFormatException.class,
            () -> Uuid.fromString("1ec9414c-232a-6b00-b3c8-9e6bdeced846")
        );
        assertTrue(exception.getMessage().contains("Invalid RFC 4122 UUID string"));
    }

    @Test
    void fromString_InvalidVariant_ThrowsException() {
        // When & Then
        assertThrows(UuidFormatException.class, () -> Uuid.fromString("9e472052-a654-4693-ca8b-3ce57ada3d6c"));
    }

    @Test
    void fromString_NilString_ThrowsException() {
        // Given: nil은 버전 0이므로 엄격한 파서를 통과하지 못함
        String nil = Uuid.nil().toString();

        // When & Then
        assertThrows(UuidFormatException.class, () -> Uuid.fromString(nil));
    }

    @Test
    void fromString_HexForm_ThrowsException() {
        // When & Then
        assertThrows(UuidFormatException.class, () -> Uuid.fromString(SAMPLE_HEX));
    }

    @Test
    void fromString_Null_ThrowsInvalidInput() {
        // When & Then
        assertThrows(InvalidUuidInputException.class, () -> Uuid.fromString(null));
    }

    @Test
    void fromHex_ValidValue_CreatesUuid() {
        // When
        Uuid uuid = Uuid.fromHex(SAMPLE_HEX.toUpperCase(Locale.ROOT));

        // Then
        assertEquals(SAMPLE_HEX, uuid.toHex());
        assertEquals(SAMPLE, uuid.toString());
    }

    @Test
    void fromHex_NonHexCharacter_ThrowsException() {
        // When & Then
        UuidFormatException exception = assertThrows(
            UuidFormatException.class,
            () -> Uuid.fromHex("9e472052a65446939a8b3ce57ada3d6z")
        );
        assertTrue(exception.getMessage().contains("Invalid UUID hex string"));
    }

    // ============================================================
    // 2. of(Object) 입력 형태별 분기
    // ============================================================

    @Test
    void of_HyphenatedAndHexStrings_CreateEqualValues() {
        // When & Then
        assertEquals(Uuid.of(SAMPLE), Uuid.of(SAMPLE_HEX));
    }

    @Test
    void of_WrongLengthString_ThrowsException() {
        // When & Then
        UuidFormatException exception = assertThrows(
            UuidFormatException.class,
            () -> Uuid.of("not-a-uuid")
        );
        assertTrue(exception.getMessage().contains("expected 36 or 32, got 10"));
    }

    @Test
    void of_ExistingUuid_CopiesByValue() {
        // Given
        Uuid original = Uuid.fromString(SAMPLE);

        // When
        Uuid copy = Uuid.of(original);

        // Then
        assertEquals(original, copy);
        assertNotSame(original, copy);
    }

    @Test
    void of_JdkUuid_CreatesSameValue() {
        // When
        Uuid uuid = Uuid.of(UUID.fromString(SAMPLE));

        // Then
        assertEquals(SAMPLE, uuid.toString());
    }

    @Test
    void of_UnsupportedType_ThrowsInvalidInput() {
        // When & Then
        assertThatThrownBy(() -> Uuid.of(42))
            .isInstanceOf(InvalidUuidInputException.class)
            .hasMessage("Not expected invalid input received: [Integer] 42");
        assertThrows(InvalidUuidInputException.class, () -> Uuid.of(new StringBuilder(SAMPLE)));
    }

    @Test
    void of_Null_ThrowsInvalidInput() {
        // When
        InvalidUuidInputException exception = assertThrows(
            InvalidUuidInputException.class,
            () -> Uuid.of(null)
        );

        // Then
        assertEquals("null", exception.getInputDescription());
    }

    // ============================================================
    // 3. 바이트 생성 경로 (길이만 검사)
    // ============================================================

    @Test
    void fromBytes_ArbitraryBytes_CreatesUuidEvenIfNotValid() {
        // Given
        byte[] bytes = new byte[16];
        Arrays.fill(bytes, (byte) 0x01);

        // When
        Uuid uuid = Uuid.fromBytes(bytes);

        // Then
        assertEquals("01010101-0101-0101-0101-010101010101", uuid.toString());
        assertEquals(0, uuid.version());
        assertFalse(uuid.isValid());
        assertFalse(UuidValidator.isValidBytes(bytes));
    }

    @Test
    void fromBytes_WrongLength_ThrowsException() {
        // When & Then
        UuidFormatException exception = assertThrows(
            UuidFormatException.class,
            () -> Uuid.fromBytes(new byte[15])
        );
        assertTrue(exception.getMessage().contains("expected 16, got 15"));
    }

    @Test
    void fromBytes_Null_ThrowsInvalidInput() {
        // When & Then
        assertThrows(InvalidUuidInputException.class, () -> Uuid.fromBytes(null));
    }

    @Test
    void fromBytes_SourceMutatedAfterwards_ValueUnchanged() {
        // Given
        byte[] bytes = Uuid.fromString(SAMPLE).toBytes();
        Uuid uuid = Uuid.fromBytes(bytes);

        // When
        bytes[0] = 0;

        // Then
        assertEquals(SAMPLE, uuid.toString());
    }

    @Test
    void toBytes_ReturnsCopy() {
        // Given
        Uuid uuid = Uuid.fromString(SAMPLE);

        // When
        byte[] first = uuid.toBytes();
        first[0] = 0;

        // Then
        assertNotSame(first, uuid.toBytes());
        assertEquals((byte) 0x9E, uuid.toBytes()[0]);
    }

    // ============================================================
    // 4. 포맷 캐시
    // ============================================================

    @Test
    void toString_RepeatedCalls_ReturnsCachedInstance() {
        // Given
        Uuid uuid = Uuid.fromHex(SAMPLE_HEX);

        // When & Then
        assertSame(uuid.toString(), uuid.toString());
        assertSame(uuid.toHex(), uuid.toHex());
    }

    @Test
    void toString_HyphensAtCanonicalPositions() {
        // When
        String value = Uuid.max().toString();

        // Then
        assertEquals("ffffffff-ffff-ffff-ffff-ffffffffffff", value);
        assertEquals('-', value.charAt(8));
        assertEquals('-', value.charAt(13));
        assertEquals('-', value.charAt(18));
        assertEquals('-', value.charAt(23));
    }

    // ============================================================
    // 5. 상수, JDK 변환
    // ============================================================

    @Test
    void nil_AllZeroBytes() {
        // When
        Uuid nil = Uuid.nil();

        // Then
        assertEquals("00000000-0000-0000-0000-000000000000", nil.toString());
        assertArrayEquals(new byte[16], nil.toBytes());
        assertEquals(0, nil.version());
    }

    @Test
    void max_AllFfBytes() {
        // When
        Uuid max = Uuid.max();

        // Then
        assertEquals("ffffffffffffffffffffffffffffffff", max.toHex());
        assertEquals(15, max.version());
        assertFalse(max.isValid());
    }

    @Test
    void toJdk_RoundTripsThroughJdkUuid() {
        // Given
        UUID jdk = UUID.fromString(SAMPLE);

        // When
        Uuid uuid = Uuid.fromJdk(jdk);

        // Then
        assertEquals(jdk, uuid.toJdk());
        assertEquals(jdk.toString(), uuid.toString());
    }

    // ============================================================
    // 6. v4 생성
    // ============================================================

    @Test
    void v4_DefaultSource_CreatesValidVersion4() {
        // When
        Uuid uuid = Uuid.v4();

        // Then
        assertEquals(4, uuid.version());
        assertTrue(uuid.isValid());
        assertNotEquals(uuid, Uuid.v4());
    }

    @Test
    void v4_SourceOutputIsParsedStrictly() {
        // Given
        when(randomSource.nextUuidString()).thenReturn(SAMPLE.toUpperCase(Locale.ROOT));

        // When
        Uuid uuid = Uuid.v4(randomSource);

        // Then
        assertEquals(SAMPLE, uuid.toString());
        verify(randomSource, times(1)).nextUuidString();
    }

    @Test
    void v4_SourceReturnsMalformedString_ThrowsException() {
        // Given
        when(randomSource.nextUuidString()).thenReturn("6ba7b810-9dad-61d1-80b4-00c04fd430c8");

        // When & Then
        assertThrows(UuidFormatException.class, () -> Uuid.v4(randomSource));
    }

    @Test
    void v4_NullSource_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Uuid.v4(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    // ============================================================
    // 7. equals / hashCode / 비교
    // ============================================================

    @Test
    void equals_SameBytes_ReturnsTrue() {
        // Given
        Uuid uuid1 = Uuid.fromString(SAMPLE);
        Uuid uuid2 = Uuid.fromHex(SAMPLE_HEX);

        // When & Then
        assertEquals(uuid1, uuid2);
        assertEquals(uuid1.hashCode(), uuid2.hashCode());
    }

    @Test
    void equals_OtherTypes_ReturnsFalse() {
        // Given
        Uuid uuid = Uuid.fromString(SAMPLE);

        // When & Then
        assertNotEquals(null, uuid);
        assertNotEquals(SAMPLE, uuid);
        assertNotEquals(uuid, Uuid.nil());
    }

    @Test
    void isEqualTo_MixedInputShapes_ReturnsTrue() {
        // Given
        Uuid uuid = Uuid.fromString(SAMPLE);

        // When & Then
        assertTrue(uuid.isEqualTo(SAMPLE_HEX, uuid.toBytes(), UUID.fromString(SAMPLE)));
        assertTrue(uuid.isEqualTo(SAMPLE.toUpperCase(Locale.ROOT)));
    }

    @Test
    void isEqualTo_NullOther_ReturnsFalse() {
        // Given
        Uuid uuid = Uuid.fromString(SAMPLE);

        // When & Then
        assertFalse(uuid.isEqualTo(null));
        assertFalse(uuid.isEqualTo(SAMPLE, (Object) null));
    }

    @Test
    void compareTo_UnsignedByteOrder() {
        // Given: 0x80 은 부호 있는 byte로는 음수지만 0x7F 보다 커야 함
        byte[] low = new byte[16];
        byte[] high = new byte[16];
        low[0] = 0x7F;
        high[0] = (byte) 0x80;

        // When & Then
        assertEquals(-1, Uuid.fromBytes(low).compareTo(Uuid.fromBytes(high)));
        assertEquals(1, Uuid.fromBytes(high).compareTo(Uuid.fromBytes(low)));
        assertEquals(0, Uuid.fromBytes(low).compareTo(Uuid.fromBytes(low)));
    }

    @Test
    void compareWith_OtherInputShape_ComparesBytes() {
        // When & Then
        assertEquals(-1, Uuid.nil().compareWith(SAMPLE));
        assertEquals(1, Uuid.max().compareWith(SAMPLE_HEX));
        assertEquals(0, Uuid.fromString(SAMPLE).compareWith(SAMPLE_HEX));
    }
}
