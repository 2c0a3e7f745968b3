package com.ryuqq.uuid.adapter.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.ryuqq.uuid.core.exception.UuidFormatException;
import com.ryuqq.uuid.core.model.Uuid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON 객체 필드명을 {@link Uuid} Map 키로 읽는 역직렬화기.
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class UuidKeyDeserializer extends KeyDeserializer {

    private static final Logger log = LoggerFactory.getLogger(UuidKeyDeserializer.class);

    private final UuidJsonConfig config;

    public UuidKeyDeserializer(UuidJsonConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
        if (key.length() == 32 && !config.acceptCompactHex()) {
            log.debug("Rejected compact hex UUID key '{}'", key);
            return ctxt.handleWeirdKey(Uuid.class, key, "compact hex UUID form is not accepted");
        }
        try {
            return Uuid.of(key);
        } catch (UuidFormatException e) {
            log.debug("Rejected UUID key '{}': {}", key, e.getMessage());
            return ctxt.handleWeirdKey(Uuid.class, key, "%s", e.getMessage());
        }
    }
}
