package com.ryuqq.uuid.core.model;

import com.ryuqq.uuid.core.codec.HexCodec;
import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.exception.UuidFormatException;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 지원되는 입력 형태를 16바이트 배열로 정규화.
 *
 * <p>반환되는 배열은 항상 새로 할당되며 호출자가 소유합니다.</p>
 */
final class UuidParser {

    static final int BYTE_LENGTH = 16;
    static final int STR_LENGTH = 36;
    static final int HEX_STR_LENGTH = 32;

    /** 하이픈 없는 32자 16진수, 버전 1~5, variant 10. */
    static final Pattern HEX_PATTERN = Pattern.compile(
        "^[0-9a-fA-F]{8}[0-9a-fA-F]{4}[1-5][0-9a-fA-F]{3}[89abAB][0-9a-fA-F]{3}[0-9a-fA-F]{12}$");

    /** RFC 4122 하이픈 형식, 버전 1~5, variant 10. */
    static final Pattern RFC4122_PATTERN = Pattern.compile(
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[1-5][0-9a-fA-F]{3}-[89abAB][0-9a-fA-F]{3}-[0-9a-fA-F]{12}$");

    private UuidParser() {
    }

    static byte[] parse(Object input) {
        if (input instanceof String) {
            String value = (String) input;
            switch (value.length()) {
                case STR_LENGTH:
                    return parseString(value);
                case HEX_STR_LENGTH:
                    return parseHex(value);
                default:
                    throw new UuidFormatException("Invalid UUID string length: expected "
                        + STR_LENGTH + " or " + HEX_STR_LENGTH + ", got " + value.length());
            }
        }
        if (input instanceof byte[]) {
            return parseBytes((byte[]) input);
        }
        if (input instanceof Uuid) {
            return ((Uuid) input).toBytes();
        }
        if (input instanceof UUID) {
            return fromJdk((UUID) input);
        }
        throw new InvalidUuidInputException(input);
    }

    static byte[] parseString(String value) {
        if (!RFC4122_PATTERN.matcher(value).matches()) {
            throw new UuidFormatException("Invalid RFC 4122 UUID string: " + value);
        }
        return HexCodec.decode(value.replace("-", ""));
    }

    static byte[] parseHex(String hex) {
        if (!HEX_PATTERN.matcher(hex).matches()) {
            throw new UuidFormatException("Invalid UUID hex string: " + hex);
        }
        return HexCodec.decode(hex);
    }

    static byte[] parseBytes(byte[] bytes) {
        if (bytes.length != BYTE_LENGTH) {
            throw new UuidFormatException(
                "Invalid UUID byte length: expected " + BYTE_LENGTH + ", got " + bytes.length);
        }
        return bytes.clone();
    }

    static byte[] fromJdk(UUID uuid) {
        return ByteBuffer.allocate(BYTE_LENGTH)
            .putLong(uuid.getMostSignificantBits())
            .putLong(uuid.getLeastSignificantBits())
            .array();
    }

    /** 버전 니블 (byte 6 상위 4비트), 0~15. */
    static int version(byte[] bytes) {
        return (bytes[6] & 0xFF) >>> 4;
    }

    /** variant 비트 (byte 8 상위 2비트), 0~3. */
    static int variant(byte[] bytes) {
        return (bytes[8] & 0xC0) >>> 6;
    }

    /** 부호 없는 사전순 비교, 결과는 -1, 0, 1. */
    static int compare(byte[] a, byte[] b) {
        return Integer.signum(Arrays.compareUnsigned(a, b));
    }

    /** 32자 16진수에 8-4-4-4-12 위치로 하이픈 삽입. */
    static String format(String hex) {
        return hex.substring(0, 8) + '-'
            + hex.substring(8, 12) + '-'
            + hex.substring(12, 16) + '-'
            + hex.substring(16, 20) + '-'
            + hex.substring(20);
    }
}
