/**
 * Core UUID value type and its static API.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uuid.core.model.Uuid} - Immutable 16-byte UUID with cached string forms</li>
 * </ul>
 *
 * <h2>Static API</h2>
 * <ul>
 *   <li>{@link com.ryuqq.uuid.core.model.Uuids} - Multi-way equality, ordering and version extraction over any input shape</li>
 *   <li>{@link com.ryuqq.uuid.core.model.UuidValidator} - Side-effect-free validation predicates that never throw</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> bytes are copied on the way in and on the way out</li>
 *   <li><strong>Strict text, lenient bytes:</strong> string parsing enforces version 1-5 and the RFC 4122 variant;
 *       byte construction only enforces the length</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.core.model;
