/**
 * Service Provider Interfaces for the external labeled-computation runtime.
 *
 * <p>LBSON does not implement information-flow control. It consumes these
 * interfaces from a runtime that does:</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.spi.Label} - Lattice element (canFlowTo, join, meet)</li>
 *   <li>{@link com.ryuqq.lbson.core.spi.Labeled} - Opaque label/payload pair</li>
 *   <li>{@link com.ryuqq.lbson.core.spi.TrustedBridge} - Label-preserving wrap/unwrap, used only for value bridging</li>
 *   <li>{@link com.ryuqq.lbson.core.spi.LabeledRuntime} - Computation context (trusted bridge, effect sequencing)</li>
 * </ul>
 *
 * <h2>Reference Implementation</h2>
 * <p>{@code lbson-adapter-inmemory} provides a set-based label and an in-memory runtime.</p>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.core.spi;
