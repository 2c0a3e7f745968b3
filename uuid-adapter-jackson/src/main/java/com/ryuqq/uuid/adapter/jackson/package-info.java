/**
 * Jackson databind integration for the core UUID value.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uuid.adapter.jackson.UuidJacksonModule} - Registers all serializers below</li>
 *   <li>{@link com.ryuqq.uuid.adapter.jackson.UuidSerializer} / {@link com.ryuqq.uuid.adapter.jackson.UuidDeserializer} - Values</li>
 *   <li>{@link com.ryuqq.uuid.adapter.jackson.UuidKeySerializer} / {@link com.ryuqq.uuid.adapter.jackson.UuidKeyDeserializer} - Map keys</li>
 *   <li>{@link com.ryuqq.uuid.adapter.jackson.UuidJsonConfig} - Read-side configuration</li>
 * </ul>
 *
 * <p>Values are always written in the canonical lowercase hyphenated form.</p>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.adapter.jackson;
