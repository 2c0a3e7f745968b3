package com.ryuqq.uuid.core.codec;

import com.ryuqq.uuid.core.exception.UuidFormatException;

/**
 * 16진수 문자열과 바이트 배열 간 변환기.
 *
 * <p>상태가 없는 순수 함수만 제공하며, UUID 계층은 호출 전에 길이(32자 / 16바이트)를 먼저 검증합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>decode: 대소문자 구분 없이 두 글자씩 1바이트로 변환</li>
 *   <li>encode: 각 바이트를 소문자 두 글자로 변환, 구분자 없음</li>
 * </ul>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class HexCodec {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexCodec() {
    }

    /**
     * 16진수 문자열을 바이트 배열로 변환.
     *
     * @param hex 짝수 길이의 16진수 문자열
     * @return 디코딩된 바이트 배열 (길이 = hex.length() / 2)
     * @throws UuidFormatException 길이가 홀수이거나 16진수가 아닌 문자가 포함된 경우
     */
    public static byte[] decode(String hex) {
        if ((hex.length() & 1) != 0) {
            throw new UuidFormatException("Invalid hex string (odd length " + hex.length() + "): " + hex);
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = nibble(hex, 2 * i);
            int lo = nibble(hex, 2 * i + 1);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    // ASCII 16진수만 허용 (Character.digit은 전각/아랍 숫자도 받아들임)
    private static int nibble(String hex, int index) {
        char c = hex.charAt(index);
        if (!isHexDigit(c)) {
            throw new UuidFormatException("Invalid hex string (non-hex character at " + index + "): " + hex);
        }
        if (c <= '9') {
            return c - '0';
        }
        return (c | 0x20) - 'a' + 10;
    }

    /**
     * 바이트 배열을 소문자 16진수 문자열로 변환.
     *
     * @param bytes 변환할 바이트 배열
     * @return 길이 bytes.length * 2 의 소문자 16진수 문자열
     */
    public static String encode(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[2 * i] = DIGITS[v >>> 4];
            out[2 * i + 1] = DIGITS[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * 16진수 문자 여부 확인 (0-9, a-f, A-F).
     *
     * @param c 검사할 문자
     * @return 16진수 문자이면 true
     */
    public static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
