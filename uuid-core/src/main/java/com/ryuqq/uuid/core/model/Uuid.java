package com.ryuqq.uuid.core.model;

import com.ryuqq.uuid.core.codec.HexCodec;
import com.ryuqq.uuid.core.exception.InvalidUuidInputException;
import com.ryuqq.uuid.core.spi.JdkRandomUuidSource;
import com.ryuqq.uuid.core.spi.RandomUuidSource;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.UUID;

/**
 * 128비트 UUID 값 객체.
 *
 * <p>16바이트 배열이 유일한 원본 데이터이며, 문자열 표현(하이픈 형식, 16진수 형식)은
 * 최초 호출 시 계산되어 캐시됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 바이트 변경 불가. 입력 배열은 복사되어 저장되고
 * {@link #toBytes()}는 항상 복사본을 반환합니다.</p>
 *
 * <p><strong>입력 형태:</strong></p>
 * <ul>
 *   <li>36자 RFC 4122 문자열: {@code 9e472052-a654-4693-9a8b-3ce57ada3d6c}</li>
 *   <li>32자 16진수 문자열: {@code 9e472052a65446939a8b3ce57ada3d6c}</li>
 *   <li>16바이트 배열</li>
 *   <li>기존 {@code Uuid} 또는 {@code java.util.UUID} (바이트 값 복사)</li>
 * </ul>
 *
 * <p><strong>문자열과 바이트의 검증 차이:</strong></p>
 * <ul>
 *   <li>문자열 파싱은 엄격함: 버전 1~5, variant 10이 아니면 {@code UuidFormatException}</li>
 *   <li>바이트 배열 생성은 길이(16)만 검사: 임의의 16바이트 식별자를 표현하기 위한 저수준 경로</li>
 *   <li>바이트의 의미적 유효성은 {@link #isValid()} 또는 {@link UuidValidator#isValidBytes(byte[])}로 확인</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 캐시 필드는 잠금 없이 기록됩니다. 경쟁 상황에서 같은 문자열이
 * 중복 계산될 수 있지만 결과는 항상 동일합니다.</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class Uuid implements Comparable<Uuid> {

    /** UUID 바이트 길이. */
    public static final int BYTE_LENGTH = UuidParser.BYTE_LENGTH;

    private static final Uuid NIL = new Uuid(new byte[BYTE_LENGTH]);
    private static final Uuid MAX;

    static {
        byte[] max = new byte[BYTE_LENGTH];
        Arrays.fill(max, (byte) 0xFF);
        MAX = new Uuid(max);
    }

    private final byte[] bytes;

    // 지연 계산 캐시
    private String canonical;
    private String hex;

    private Uuid(byte[] ownedBytes) {
        this.bytes = ownedBytes;
    }

    /**
     * 지원되는 모든 입력 형태로부터 Uuid 생성.
     *
     * @param input String(36자/32자), byte[16], Uuid, java.util.UUID
     * @return Uuid 인스턴스
     * @throws com.ryuqq.uuid.core.exception.UuidFormatException 길이 또는 형식이 잘못된 경우
     * @throws InvalidUuidInputException 지원하지 않는 타입이거나 null인 경우
     */
    public static Uuid of(Object input) {
        return new Uuid(UuidParser.parse(input));
    }

    /**
     * RFC 4122 하이픈 형식 문자열로부터 생성.
     *
     * @param value 36자 UUID 문자열 (대소문자 무관)
     * @return Uuid 인스턴스
     * @throws com.ryuqq.uuid.core.exception.UuidFormatException 형식이 잘못된 경우
     * @throws InvalidUuidInputException value가 null인 경우
     */
    public static Uuid fromString(String value) {
        if (value == null) {
            throw new InvalidUuidInputException(null);
        }
        return new Uuid(UuidParser.parseString(value));
    }

    /**
     * 하이픈 없는 32자 16진수 문자열로부터 생성.
     *
     * @param hex 32자 16진수 문자열 (대소문자 무관)
     * @return Uuid 인스턴스
     * @throws com.ryuqq.uuid.core.exception.UuidFormatException 형식이 잘못된 경우
     * @throws InvalidUuidInputException hex가 null인 경우
     */
    public static Uuid fromHex(String hex) {
        if (hex == null) {
            throw new InvalidUuidInputException(null);
        }
        return new Uuid(UuidParser.parseHex(hex));
    }

    /**
     * 16바이트 배열로부터 생성.
     *
     * <p>길이만 검사하며 버전/variant는 검사하지 않습니다. 배열은 복사됩니다.</p>
     *
     * @param bytes 16바이트 배열
     * @return Uuid 인스턴스
     * @throws com.ryuqq.uuid.core.exception.UuidFormatException 길이가 16이 아닌 경우
     * @throws InvalidUuidInputException bytes가 null인 경우
     */
    public static Uuid fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new InvalidUuidInputException(null);
        }
        return new Uuid(UuidParser.parseBytes(bytes));
    }

    /**
     * {@link UUID}로부터 생성 (big-endian: msb → lsb).
     *
     * @param uuid JDK UUID
     * @return Uuid 인스턴스
     * @throws InvalidUuidInputException uuid가 null인 경우
     */
    public static Uuid fromJdk(UUID uuid) {
        if (uuid == null) {
            throw new InvalidUuidInputException(null);
        }
        return new Uuid(UuidParser.fromJdk(uuid));
    }

    /**
     * 모든 바이트가 0인 nil UUID.
     *
     * @return {@code 00000000-0000-0000-0000-000000000000}
     */
    public static Uuid nil() {
        return NIL;
    }

    /**
     * 모든 바이트가 0xFF인 max UUID.
     *
     * @return {@code ffffffff-ffff-ffff-ffff-ffffffffffff}
     */
    public static Uuid max() {
        return MAX;
    }

    /**
     * 기본 난수원({@link JdkRandomUuidSource})으로 버전 4 UUID 생성.
     *
     * @return 랜덤 Uuid
     */
    public static Uuid v4() {
        return v4(JdkRandomUuidSource.INSTANCE);
    }

    /**
     * 지정한 난수원으로 버전 4 UUID 생성.
     *
     * <p>난수원이 반환한 문자열은 외부 입력과 동일하게 엄격한 파서로 검증됩니다.</p>
     *
     * @param source 랜덤 UUID 문자열 공급자
     * @return 랜덤 Uuid
     * @throws IllegalArgumentException source가 null인 경우
     * @throws com.ryuqq.uuid.core.exception.UuidFormatException 난수원이 잘못된 문자열을 반환한 경우
     */
    public static Uuid v4(RandomUuidSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return fromString(source.nextUuidString());
    }

    /**
     * 버전 니블 조회 (byte 6의 상위 4비트).
     *
     * <p>범위 제한 없는 원시 값입니다 (nil = 0, max = 15).</p>
     *
     * @return 0~15
     */
    public int version() {
        return UuidParser.version(bytes);
    }

    /**
     * 버전(1~5)과 variant(10) 검증.
     *
     * @return 의미적으로 유효한 RFC 4122 UUID이면 true
     */
    public boolean isValid() {
        return UuidValidator.isValidBytes(bytes);
    }

    /**
     * 32자 소문자 16진수 표현 (캐시됨).
     *
     * @return 하이픈 없는 16진수 문자열
     */
    public String toHex() {
        String result = hex;
        if (result == null) {
            result = HexCodec.encode(bytes);
            hex = result;
        }
        return result;
    }

    /**
     * 바이트 복사본 반환.
     *
     * @return 새로 할당된 16바이트 배열
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * {@link UUID}로 변환.
     *
     * @return 동일한 128비트 값을 갖는 JDK UUID
     */
    public UUID toJdk() {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    /**
     * 다른 입력들과의 다중 동등성 비교.
     *
     * @param other 비교 대상 (null이면 false)
     * @param more 추가 비교 대상
     * @return 모든 입력이 이 값과 같으면 true
     * @see Uuids#allEqual(Object...)
     */
    public boolean isEqualTo(Object other, Object... more) {
        // isEqualTo(x, null) 호출 시 varargs 배열 자체가 null로 전달됨
        Object[] rest = more == null ? new Object[] {null} : more;
        Object[] inputs = new Object[2 + rest.length];
        inputs[0] = this;
        inputs[1] = other;
        System.arraycopy(rest, 0, inputs, 2, rest.length);
        return Uuids.allEqual(inputs);
    }

    /**
     * 지원되는 입력 형태와의 순서 비교.
     *
     * @param other 비교 대상
     * @return -1, 0, 1
     * @see Uuids#compare(Object, Object)
     */
    public int compareWith(Object other) {
        return Uuids.compare(this, other);
    }

    /**
     * 부호 없는 바이트 사전순 비교.
     *
     * @param other 비교 대상
     * @return -1, 0, 1
     */
    @Override
    public int compareTo(Uuid other) {
        return UuidParser.compare(bytes, other.bytes);
    }

    /** 같은 패키지 내부용 원본 배열 접근 (복사 없음, 변경 금지). */
    byte[] bytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Uuid uuid = (Uuid) o;
        return Arrays.equals(bytes, uuid.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * RFC 4122 하이픈 형식 (캐시됨).
     *
     * @return 36자 소문자 UUID 문자열
     */
    @Override
    public String toString() {
        String result = canonical;
        if (result == null) {
            result = UuidParser.format(toHex());
            canonical = result;
        }
        return result;
    }
}
