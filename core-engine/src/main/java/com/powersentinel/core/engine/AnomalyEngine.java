package com.powersentinel.core.engine;

import com.powersentinel.core.config.EngineConfig;
import com.powersentinel.core.detection.AnomalyDetector;
import com.powersentinel.core.detection.DetectionContext;
import com.powersentinel.core.detection.DetectorFactory;
import com.powersentinel.core.history.SlidingHistory;
import com.powersentinel.core.model.EngineStatus;
import com.powersentinel.core.model.FeatureRecord;
import com.powersentinel.core.model.Finding;
import com.powersentinel.core.model.Sample;
import com.powersentinel.core.prediction.PowerPredictor;
import com.powersentinel.core.prediction.QuadraticRidgeRegression;
import com.powersentinel.core.prediction.RegressionTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streaming anomaly detector for electrical telemetry.
 *
 * <p>
 * One engine is shared by all devices. It owns the sliding history and the
 * power predictor and runs, for each ingested sample:
 * </p>
 * <ol>
 * <li>feature engineering and append to history (evicting the oldest record
 * beyond capacity);</li>
 * <li>the statistical detector (once the warm-up size is reached);</li>
 * <li>the predictive detector (once a model is live and the history holds
 * enough records to train on);</li>
 * <li>the retraining check, dispatching a fit when one is due.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Every {@link #ingest} runs inside a single lock, so detectors always see a
 * history that no other ingestion is mutating. Fits run on the retraining
 * executor against a copy of the history and publish the new model by a
 * single reference swap; ingestion keeps using the previous model meanwhile.
 * At most one fit is in flight.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * Faults inside detectors or fits are logged and never reach the caller:
 * {@link #ingest} always returns a (possibly empty) list. A failed fit keeps
 * the previous model and does not advance the training time, so the next
 * ingest retries.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    private static final Executor DIRECT = Runnable::run;

    private final SlidingHistory history;
    private final PowerPredictor predictor;
    private final List<AnomalyDetector> detectors;
    private final RetrainingPolicy retrainingPolicy;
    private final Clock clock;
    private final Executor retrainExecutor;
    private final ExecutorService ownedExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean retraining = new AtomicBoolean(false);

    /**
     * Engine on the system UTC clock.
     *
     * @param config validated configuration
     */
    public AnomalyEngine(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Engine that fits on its own background thread when
     * {@link EngineConfig#isAsyncRetraining()} is set, inline otherwise.
     *
     * @param config validated configuration
     * @param clock  source of training timestamps
     */
    public AnomalyEngine(EngineConfig config, Clock clock) {
        this(config, clock, new QuadraticRidgeRegression(config.getRidgePenalty()),
                config.isAsyncRetraining() ? newRetrainExecutor() : DIRECT, true);
    }

    /**
     * Engine with an externally managed retraining executor. The executor is
     * not shut down by {@link #close()}.
     *
     * @param config          validated configuration
     * @param clock           source of training timestamps
     * @param trainer         regression trainer for the power model
     * @param retrainExecutor runs fits; {@code Runnable::run} fits inline
     */
    public AnomalyEngine(EngineConfig config, Clock clock, RegressionTrainer trainer, Executor retrainExecutor) {
        this(config, clock, trainer, retrainExecutor, false);
    }

    private AnomalyEngine(EngineConfig config, Clock clock, RegressionTrainer trainer,
            Executor retrainExecutor, boolean ownsExecutor) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        config.validate();
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.retrainExecutor = Objects.requireNonNull(retrainExecutor, "retrainExecutor must not be null");
        this.ownedExecutor = ownsExecutor && retrainExecutor instanceof ExecutorService es ? es : null;
        this.history = new SlidingHistory(config.getHistoryCapacity());
        this.predictor = new PowerPredictor(
                Objects.requireNonNull(trainer, "RegressionTrainer must not be null"), config.getMinTrainingSize());
        this.detectors = DetectorFactory.createAll(config);
        this.retrainingPolicy = new RetrainingPolicy(config.getMinTrainingSize(), config.getRetrainInterval());
        LOG.info("Anomaly engine started: capacity={} warmup={} minTrainingSize={} retrainInterval={}",
                config.getHistoryCapacity(), config.getWarmupSize(), config.getMinTrainingSize(),
                config.getRetrainInterval());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Process one sample.
     *
     * @param sample the reading; must not be {@code null}
     * @return findings in the order voltage, current, power z-score, power
     *         outlier, prediction deviation; empty when nothing fires
     */
    public List<Finding> ingest(Sample sample) {
        Objects.requireNonNull(sample, "Sample must not be null");

        lock.lock();
        try {
            history.append(FeatureRecord.from(sample));

            DetectionContext context = new DetectionContext(history, predictor);
            List<Finding> findings = new ArrayList<>();
            for (AnomalyDetector detector : detectors) {
                try {
                    findings.addAll(detector.evaluate(sample, context));
                } catch (RuntimeException e) {
                    LOG.error("Detector [{}] threw an exception – continuing with next detector",
                            detector.getName(), e);
                }
            }

            retrainIfDue();
            return Collections.unmodifiableList(findings);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Diagnostic snapshot. Has no side effects.
     *
     * @return current history size and model state
     */
    public EngineStatus status() {
        lock.lock();
        try {
            Instant lastTrained = predictor.lastTrained().orElse(null);
            return new EngineStatus(history.size(), lastTrained != null, lastTrained);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} while a fit is in flight
     */
    public boolean isRetraining() {
        return retraining.get();
    }

    /** Consistent copy of the history, oldest first. */
    List<FeatureRecord> historySnapshot() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the engine's own retraining thread, waiting briefly for an
     * in-flight fit. Externally supplied executors are left alone.
     */
    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Retraining did not finish within 5s – abandoning it");
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Anomaly engine closed");
    }

    // ---------------------------------------------------------------
    // Retraining
    // ---------------------------------------------------------------

    /** Called with the lock held. */
    private void retrainIfDue() {
        if (!retrainingPolicy.isDue(history.size(), predictor.lastTrained(), clock.instant())) {
            return;
        }
        if (!retraining.compareAndSet(false, true)) {
            LOG.trace("Retraining already in flight – skipping");
            return;
        }

        List<FeatureRecord> snapshot = history.snapshot();
        LOG.debug("Dispatching retraining over {} record(s)", snapshot.size());
        try {
            retrainExecutor.execute(() -> retrain(snapshot));
        } catch (RejectedExecutionException e) {
            retraining.set(false);
            LOG.warn("Retraining rejected by executor: {}", e.getMessage());
        }
    }

    private void retrain(List<FeatureRecord> snapshot) {
        try {
            predictor.fit(snapshot, clock.instant());
        } catch (RuntimeException e) {
            LOG.warn("Model training failed on {} record(s) – keeping previous model: {}",
                    snapshot.size(), e.getMessage(), e);
        } finally {
            retraining.set(false);
        }
    }

    private static ExecutorService newRetrainExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "model-retrainer");
            t.setDaemon(true);
            return t;
        });
    }
}
