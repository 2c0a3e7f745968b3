/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uuid.core.spi.RandomUuidSource} - Secure random v4 UUID source used by {@code Uuid.v4()}</li>
 *   <li>{@link com.ryuqq.uuid.core.spi.UuidFactory} - Factory returning an extension type that wraps {@code Uuid}</li>
 * </ul>
 *
 * <h2>Default Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uuid.core.spi.JdkRandomUuidSource} - backed by {@code java.util.UUID.randomUUID()}</li>
 *   <li>{@code UuidFactory.identity()} - returns plain {@code Uuid} values</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Composition over inheritance:</strong> adapters wrap the core value instead of extending it</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any adapter</li>
 * </ul>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.core.spi;
