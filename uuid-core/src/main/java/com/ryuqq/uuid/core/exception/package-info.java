/**
 * Exceptions raised by UUID parsing and construction.
 *
 * <ul>
 *   <li>{@link com.ryuqq.uuid.core.exception.UuidFormatException} - right input type, wrong length or pattern</li>
 *   <li>{@link com.ryuqq.uuid.core.exception.InvalidUuidInputException} - unsupported input type or null</li>
 * </ul>
 *
 * <p>Both extend {@link java.lang.IllegalArgumentException}. Usage errors that do not concern a single
 * UUID (e.g. fewer than two inputs for a multi-way equality check) are reported as a plain
 * {@code IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.core.exception;
