/**
 * Anomaly detectors and severity classification.
 *
 * <ul>
 * <li>{@link com.powersentinel.core.detection.StatisticalDetector} — z-score on
 * voltage, current and power; IQR fences on power</li>
 * <li>{@link com.powersentinel.core.detection.PredictiveDetector} — relative
 * error against the power model</li>
 * <li>{@link com.powersentinel.core.detection.SeverityPolicy} — score to
 * severity tier</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.powersentinel.core.detection;
