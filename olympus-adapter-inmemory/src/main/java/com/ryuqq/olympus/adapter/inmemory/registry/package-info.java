/**
 * In-memory HandlerRegistry adapter.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.olympus.core.spi.HandlerRegistry} SPI using concurrent collections.</p>
 *
 * <h2>Concurrency Model</h2>
 * <ul>
 *   <li><strong>ConcurrentHashMap:</strong> Lock-free lookup of the handler list for an event class</li>
 *   <li><strong>CopyOnWriteArrayList:</strong> Snapshot isolation while handlers are being invoked</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>Single JVM:</strong> Bindings are not shared across processes</li>
 *   <li><strong>Exact Class Lookup:</strong> No supertype or interface fan-out</li>
 * </ul>
 *
 * @see com.ryuqq.olympus.core.spi.HandlerRegistry
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.adapter.inmemory.registry;
