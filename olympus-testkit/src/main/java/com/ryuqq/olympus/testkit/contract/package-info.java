/**
 * Contract tests for {@link com.ryuqq.olympus.core.spi.HandlerRegistry} implementations.
 *
 * <p>Adapters extend {@link com.ryuqq.olympus.testkit.contract.AbstractHandlerRegistryContractTest}
 * from their own test sources and supply the implementation under test.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.testkit.contract;
