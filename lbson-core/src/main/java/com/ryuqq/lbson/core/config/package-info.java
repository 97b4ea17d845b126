/**
 * Startup configuration package.
 *
 * <p>Holds the build/startup-time switch controlling how labeled content is rendered:</p>
 * <ul>
 *   <li>{@link com.ryuqq.lbson.core.config.RenderMode} - PROTECTED (default) or DEBUG</li>
 *   <li>{@link com.ryuqq.lbson.core.config.LbsonConfig} - Immutable configuration record, loadable from system properties</li>
 *   <li>{@link com.ryuqq.lbson.core.config.Rendering} - Process-wide mode, resolved once</li>
 * </ul>
 *
 * <h2>Permitted Builds</h2>
 * <ul>
 *   <li><strong>Production:</strong> PROTECTED only (leave {@code lbson.render.mode} unset)</li>
 *   <li><strong>Development:</strong> {@code -Dlbson.render.mode=debug}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LBSON Team
 */
package com.ryuqq.lbson.core.config;
