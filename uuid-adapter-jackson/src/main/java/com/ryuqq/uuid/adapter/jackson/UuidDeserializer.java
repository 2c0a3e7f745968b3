package com.ryuqq.uuid.adapter.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.ryuqq.uuid.core.exception.UuidFormatException;
import com.ryuqq.uuid.core.model.Uuid;
import com.ryuqq.uuid.core.model.UuidValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON 값을 {@link Uuid}로 읽는 역직렬화기.
 *
 * <p><strong>처리 규칙:</strong></p>
 * <ul>
 *   <li>문자열: 엄격한 파서 사용 (36자 하이픈 형식, 설정에 따라 32자 16진수 형식)</li>
 *   <li>24자 base64 문자열 / 임베디드 바이너리: {@code acceptBinary=true}일 때만 허용</li>
 *   <li>그 외 토큰: {@code handleUnexpectedToken}으로 위임</li>
 * </ul>
 *
 * <p>파싱 실패는 {@link InvalidFormatException}으로 변환되며 보정하지 않습니다.</p>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class UuidDeserializer extends StdScalarDeserializer<Uuid> {

    private static final long serialVersionUID = 1L;
    private static final Logger log = LoggerFactory.getLogger(UuidDeserializer.class);

    /** base64로 인코딩된 16바이트 길이 (패딩 포함). */
    private static final int BASE64_LENGTH = 24;

    private final UuidJsonConfig config;

    public UuidDeserializer() {
        this(new UuidJsonConfig());
    }

    /**
     * 생성자.
     *
     * @param config 역직렬화 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public UuidDeserializer(UuidJsonConfig config) {
        super(Uuid.class);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Uuid deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return fromText(p, ctxt, p.getText());
        }
        if (token == JsonToken.VALUE_EMBEDDED_OBJECT) {
            Object embedded = p.getEmbeddedObject();
            if (embedded instanceof Uuid) {
                return (Uuid) embedded;
            }
            if (embedded instanceof byte[] && config.acceptBinary()) {
                return fromBinary(p, (byte[]) embedded);
            }
        }
        return (Uuid) ctxt.handleUnexpectedToken(Uuid.class, p);
    }

    private Uuid fromText(JsonParser p, DeserializationContext ctxt, String text) throws IOException {
        if (text.length() == BASE64_LENGTH && config.acceptBinary()) {
            byte[] bytes;
            try {
                bytes = ctxt.getBase64Variant().decode(text);
            } catch (IllegalArgumentException e) {
                log.debug("Rejected base64 UUID value '{}': {}", text, e.getMessage());
                throw ctxt.weirdStringException(text, Uuid.class, "invalid base64 UUID: " + e.getMessage());
            }
            return fromBinary(p, bytes);
        }
        if (text.length() == 32 && !config.acceptCompactHex()) {
            log.debug("Rejected compact hex UUID value '{}'", text);
            throw ctxt.weirdStringException(text, Uuid.class, "compact hex UUID form is not accepted");
        }
        try {
            return Uuid.of(text);
        } catch (UuidFormatException e) {
            log.debug("Rejected UUID value '{}': {}", text, e.getMessage());
            throw ctxt.weirdStringException(text, Uuid.class, e.getMessage());
        }
    }

    private Uuid fromBinary(JsonParser p, byte[] bytes) throws IOException {
        if (config.requireValidBytes() && !UuidValidator.isValidBytes(bytes)) {
            log.debug("Rejected binary UUID value of {} bytes", bytes.length);
            throw InvalidFormatException.from(p,
                "Binary UUID value must be 16 bytes with version 1-5 and RFC 4122 variant", bytes, Uuid.class);
        }
        try {
            return Uuid.fromBytes(bytes);
        } catch (UuidFormatException e) {
            log.debug("Rejected binary UUID value: {}", e.getMessage());
            throw InvalidFormatException.from(p, e.getMessage(), bytes, Uuid.class);
        }
    }
}
