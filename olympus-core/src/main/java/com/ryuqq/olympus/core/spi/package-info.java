/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.olympus.core.spi.HandlerRegistry} - Event type → handler bindings</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., olympus-adapter-inmemory) provide concrete implementations.
 * Implementations are verified with the contract tests shipped in olympus-testkit.</p>
 *
 * @since 1.0.0
 * @author Olympus Team
 */
package com.ryuqq.olympus.core.spi;
