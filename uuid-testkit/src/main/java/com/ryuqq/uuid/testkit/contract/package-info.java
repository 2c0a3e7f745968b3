/**
 * Contract test support for {@code UuidFactory} implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.uuid.testkit.contract.AbstractUuidContractTest} - Behaviour every wrapper type must share with the core value</li>
 *   <li>{@link com.ryuqq.uuid.testkit.contract.UuidFixtures} - Known valid and malformed inputs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author UUID SDK Team
 */
package com.ryuqq.uuid.testkit.contract;
