/**
 * Contract test infrastructure for LBSON.
 *
 * <p>{@link com.ryuqq.lbson.testkit.contract.AbstractLbsonContractTest} wires an
 * {@link com.ryuqq.lbson.adapter.inmemory.runtime.InMemoryLabeledRuntime} into each test so
 * that value-model properties (round trips, variant fidelity, document algebra and
 * the equality restriction) can be checked against a real trusted bridge.</p>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.testkit.contract;
