package com.ryuqq.uuid.adapter.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.ryuqq.uuid.core.model.Uuid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Uuid} 직렬화/역직렬화를 등록하는 Jackson 모듈.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ObjectMapper mapper = new ObjectMapper()
 *     .registerModule(new UuidJacksonModule());
 *
 * // 32자 형식 거부
 * mapper.registerModule(new UuidJacksonModule(new UuidJsonConfig().withAcceptCompactHex(false)));
 * </pre>
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class UuidJacksonModule extends SimpleModule {

    private static final long serialVersionUID = 1L;
    private static final Logger log = LoggerFactory.getLogger(UuidJacksonModule.class);

    private static final Version VERSION = new Version(1, 0, 0, null, "com.ryuqq", "uuid-adapter-jackson");

    private final UuidJsonConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public UuidJacksonModule() {
        this(new UuidJsonConfig());
    }

    /**
     * 지정한 설정으로 생성.
     *
     * @param config 역직렬화 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public UuidJacksonModule(UuidJsonConfig config) {
        super("UuidJacksonModule", VERSION);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        addSerializer(Uuid.class, new UuidSerializer());
        addDeserializer(Uuid.class, new UuidDeserializer(config));
        addKeySerializer(Uuid.class, new UuidKeySerializer());
        addKeyDeserializer(Uuid.class, new UuidKeyDeserializer(config));
        log.debug("UuidJacksonModule created with {}", config);
    }

    /**
     * 모듈 설정 조회.
     *
     * @return 역직렬화 설정
     */
    public UuidJsonConfig getConfig() {
        return config;
    }
}
