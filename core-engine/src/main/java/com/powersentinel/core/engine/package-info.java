/**
 * The anomaly engine: orchestration of history, detectors and the
 * retraining policy behind a single synchronization point.
 *
 * @since 1.0.0
 */
package com.powersentinel.core.engine;
