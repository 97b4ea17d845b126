/**
 * Reference label lattice.
 *
 * <p>{@link com.ryuqq.lbson.adapter.inmemory.label.SetLabel} is a secrecy label over a set of
 * principal names (subset order, union join, intersection meet). It is sufficient for tests
 * and examples; production deployments supply the label type of their IFC runtime.</p>
 *
 * @see com.ryuqq.lbson.core.spi.Label
 * @author LBSON Team
 * @since 1.0.0
 */
package com.ryuqq.lbson.adapter.inmemory.label;
