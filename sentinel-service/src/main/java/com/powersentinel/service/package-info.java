/**
 * Service host for the anomaly engine: telemetry decoding, alert encoding
 * and publishing, the dispatch loop, health endpoints and the entry point.
 */
package com.powersentinel.service;
