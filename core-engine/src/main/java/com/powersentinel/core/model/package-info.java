/**
 * Domain model classes for Power Sentinel.
 *
 * <ul>
 * <li>{@link com.powersentinel.core.model.Sample} — raw telemetry reading</li>
 * <li>{@link com.powersentinel.core.model.FeatureRecord} — feature-engineered
 * reading held in history</li>
 * <li>{@link com.powersentinel.core.model.Finding} — anomaly verdict emitted by
 * detectors</li>
 * <li>{@link com.powersentinel.core.model.EngineStatus} — diagnostic
 * snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.model;
