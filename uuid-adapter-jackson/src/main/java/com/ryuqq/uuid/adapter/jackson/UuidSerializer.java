package com.ryuqq.uuid.adapter.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.uuid.core.model.Uuid;

import java.io.IOException;

/**
 * {@link Uuid}를 RFC 4122 하이픈 형식 문자열로 기록.
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public class UuidSerializer extends StdSerializer<Uuid> {

    private static final long serialVersionUID = 1L;

    public UuidSerializer() {
        super(Uuid.class);
    }

    @Override
    public void serialize(Uuid value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toString());
    }
}
