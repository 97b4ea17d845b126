/**
 * In-memory labeled-runtime adapter implementation package.
 *
 * <p>This package provides a reference implementation of the LabeledRuntime SPI
 * for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.adapter.inmemory.runtime.InMemoryLabeledRuntime}:
 *       Trusted bridge and sequential effect execution</li>
 *   <li>{@link com.ryuqq.lbson.adapter.inmemory.runtime.InMemoryLabeled}:
 *       Opaque label/payload pair with disabled equality and mode-gated rendering</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No label checks, clearance or privileges</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.lbson.core.spi.LabeledRuntime
 * @author LBSON Team
 * @since 1.0.0
 */
package com.ryuqq.lbson.adapter.inmemory.runtime;
