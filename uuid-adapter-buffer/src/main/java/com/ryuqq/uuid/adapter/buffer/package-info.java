/**
 * {@link java.nio.ByteBuffer} adapter for the core UUID value.
 *
 * <ul>
 *   <li>{@link com.ryuqq.uuid.adapter.buffer.ByteBufferCodec} - Copies the 16 bytes to and from buffers</li>
 *   <li>{@link com.ryuqq.uuid.adapter.buffer.BufferUuid} - Decorator exposing a buffer view, with its own {@code UuidFactory}</li>
 * </ul>
 *
 * <p>Byte order and length are preserved exactly; the buffer's {@code ByteOrder} is never consulted.</p>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.adapter.buffer;
