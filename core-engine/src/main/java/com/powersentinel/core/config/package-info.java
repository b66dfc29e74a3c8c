/**
 * Configuration loading and validation for the anomaly engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.powersentinel.core.config.EngineConfigLoader} into an
 * {@link com.powersentinel.core.config.EngineConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.config;
