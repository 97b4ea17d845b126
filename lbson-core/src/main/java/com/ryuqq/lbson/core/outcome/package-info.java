/**
 * Recoverable lookup and cast outcome package.
 *
 * <p>This package defines the sealed interface hierarchy returned by the "soft"
 * accessors ({@code look}, {@code lookup}, {@code cast}).</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.outcome.Ok} - Value present and of the expected type</li>
 *   <li>{@link com.ryuqq.lbson.core.outcome.Fail} - Missing key or type mismatch, with a diagnostic message</li>
 * </ul>
 *
 * <h2>Severities</h2>
 * <ul>
 *   <li><strong>Recoverable miss:</strong> {@code Fail}, handled by the caller</li>
 *   <li><strong>Fatal:</strong> {@code valueAt}, {@code at}, {@code typed} and
 *       {@link com.ryuqq.lbson.core.outcome.Outcome#orElseThrow()} throw {@link java.lang.IllegalStateException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.core.outcome;
