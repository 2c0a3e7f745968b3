/**
 * Hexadecimal codec used by the UUID value type.
 *
 * <p>{@link com.ryuqq.uuid.core.codec.HexCodec} converts between lowercase hex text and raw bytes.
 * It is stateless and thread-safe.</p>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.core.codec;
