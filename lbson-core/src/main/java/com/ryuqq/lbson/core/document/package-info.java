/**
 * LBSON documents and fields.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.document.Field} - Key/value pair ({@code =:} and {@code =?} factories)</li>
 *   <li>{@link com.ryuqq.lbson.core.document.Document} - Immutable ordered field sequence</li>
 * </ul>
 *
 * <h2>Document Algebra</h2>
 * <ul>
 *   <li><strong>look / lookup:</strong> soft, first match wins, returns {@link com.ryuqq.lbson.core.outcome.Outcome}</li>
 *   <li><strong>valueAt / at:</strong> hard, throws {@link java.lang.IllegalStateException} on a miss</li>
 *   <li><strong>include:</strong> projection in key-list order</li>
 *   <li><strong>exclude:</strong> removal preserving document order</li>
 *   <li><strong>merge:</strong> left-biased replace-or-append</li>
 * </ul>
 *
 * <p>A labeled document ({@code LabeledDocument}) is simply
 * {@code Labeled<L, Document<L>>}; it needs no dedicated type.</p>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.core.document;
