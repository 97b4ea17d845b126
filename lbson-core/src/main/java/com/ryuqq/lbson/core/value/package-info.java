/**
 * LBSON value model and typed-value bridge.
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.value.Value} - Sealed interface (permits BsonVal, LabeledVal, PolicyLabeledVal)</li>
 *   <li>{@link com.ryuqq.lbson.core.value.PolicyLabeled} - Sealed interface (Unapplied = PU, Applied = PL)</li>
 * </ul>
 *
 * <h2>Typed Bridge</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.value.Primitive} / {@link com.ryuqq.lbson.core.value.Primitives} - Host type to BSON value</li>
 *   <li>{@link com.ryuqq.lbson.core.value.Val} - Host type to {@code Value} ({@code val}, {@code tryCast}, {@code cast}, {@code typed})</li>
 *   <li>{@link com.ryuqq.lbson.core.value.Vals} - Identity and plain instances</li>
 *   <li>{@link com.ryuqq.lbson.core.value.LabeledVals} - Labeled and policy-labeled instances (holds the trusted bridge)</li>
 * </ul>
 *
 * <h2>Equality and Rendering</h2>
 * <ul>
 *   <li><strong>Equality:</strong> only plain values compare equal; labeled values are unequal even to themselves</li>
 *   <li><strong>PolicyLabeled:</strong> equality and hashing throw {@link java.lang.UnsupportedOperationException}</li>
 *   <li><strong>Rendering:</strong> governed by {@link com.ryuqq.lbson.core.config.Rendering}, never by data</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.core.value;
