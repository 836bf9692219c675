package com.surveillance.baseline.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.CommitError;
import com.aerospike.client.ResultCode;
import com.surveillance.baseline.config.MetricsConfig;
import com.surveillance.baseline.engine.BaselineSettings;
import com.surveillance.baseline.engine.DecayModel;
import com.surveillance.baseline.engine.EwmaStep;
import com.surveillance.baseline.model.ActivityBaseline;
import com.surveillance.baseline.model.AnomalyVerdict;
import com.surveillance.baseline.model.ClassBaseline;
import com.surveillance.baseline.model.DetectionEvent;
import com.surveillance.baseline.repository.ActivityBaselineRepository;
import com.surveillance.baseline.repository.BaselineKeys;
import com.surveillance.baseline.repository.ClassBaselineRepository;
import com.surveillance.baseline.session.BaselineSession;
import com.surveillance.baseline.session.BaselineSessionFactory;
import com.surveillance.baseline.session.TransactionMode;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Learns per-camera activity and detection-class baselines and scores detections against them.
 *
 * All learned state lives in Aerospike; the service itself only holds its settings.
 * Every update is an optimistic read-merge-write against the row's record generation,
 * so concurrent writers on the same slot never lose an observation silently.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    static final String STORE_ACTIVITY = "activity";
    static final String STORE_CLASS = "class";
    static final String STORE_TRANSACTION = "transaction";

    // Pause before re-reading a row held by another transaction, multiplied by the attempt
    static final long BLOCKED_BACKOFF_MILLIS = 10;

    private static final double DECAYED_CLASS_SCORE = 0.95;

    private final ActivityBaselineRepository activityRepository;
    private final ClassBaselineRepository classRepository;
    private final BaselineSessionFactory sessionFactory;
    private final MetricsConfig metrics;
    private final Clock clock;
    private final AtomicReference<BaselineSettings> settings;

    public BaselineService(ActivityBaselineRepository activityRepository,
                           ClassBaselineRepository classRepository,
                           BaselineSessionFactory sessionFactory,
                           MetricsConfig metrics,
                           BaselineSettings settings,
                           Clock clock) {
        this.activityRepository = activityRepository;
        this.classRepository = classRepository;
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = new AtomicReference<>(settings);
        log.info("BaselineService initialized: decay={}, window={}d, threshold={}std, minSamples={}, maxUpdateAttempts={}",
                settings.getDecayFactor(), settings.getWindowDays(), settings.getAnomalyThresholdStd(),
                settings.getMinSamples(), settings.getMaxUpdateAttempts());
    }

    public BaselineSettings getSettings() {
        return settings.get();
    }

    // ── Updates ──

    public void updateBaseline(String cameraId, String detectionClass, OffsetDateTime timestamp) {
        updateBaseline(cameraId, detectionClass, timestamp, TransactionMode.selfManaged());
    }

    public void updateBaseline(String cameraId, String detectionClass, Instant timestamp) {
        updateBaseline(cameraId, detectionClass, timestamp, TransactionMode.selfManaged());
    }

    public void updateBaseline(String cameraId, String detectionClass, Instant timestamp, TransactionMode mode) {
        updateBaseline(cameraId, detectionClass, atSettingsZone(timestamp), mode);
    }

    /**
     * Builds a batch event for an {@code Instant}, resolving its slot in the configured zone
     * exactly as the single-detection {@code Instant} overloads do.
     */
    public DetectionEvent detectionAt(String cameraId, String detectionClass, Instant timestamp) {
        return new DetectionEvent(cameraId, detectionClass, atSettingsZone(timestamp));
    }

    /**
     * Folds one detection into its activity slot and its class slot.
     *
     * The detection's own timestamp picks the slot; the clock's current time is the
     * decay reference. Under {@link TransactionMode#within} nothing is committed here.
     */
    @Observed(name = "baseline.update", contextualName = "update-baseline")
    public void updateBaseline(String cameraId, String detectionClass, OffsetDateTime timestamp,
                               TransactionMode mode) {
        DetectionEvent event = new DetectionEvent(cameraId, detectionClass, timestamp);
        validate(event);
        writeWithRetry(mode, "detection on camera " + cameraId, session -> {
            apply(session, event, clock.instant());
            return null;
        });
    }

    public void updateBaselines(List<DetectionEvent> events) {
        updateBaselines(events, TransactionMode.selfManaged());
    }

    /**
     * Folds a batch of detections inside one transaction: either all land or none do
     * (self-managed), or all join the caller's transaction.
     */
    @Observed(name = "baseline.update_batch", contextualName = "update-baseline-batch")
    public void updateBaselines(List<DetectionEvent> events, TransactionMode mode) {
        if (events.isEmpty()) {
            return;
        }
        events.forEach(this::validate);
        writeWithRetry(mode, "batch of " + events.size(), session -> {
            Instant now = clock.instant();
            for (DetectionEvent event : events) {
                apply(session, event, now);
            }
            return null;
        });
    }

    /**
     * Runs a self-managed write, restarting the whole transaction when commit finds that a
     * row it read was changed by another transaction. Caller-managed work runs once; the
     * caller owns the restart.
     */
    private <T> T writeWithRetry(TransactionMode mode, String key, Function<BaselineSession, T> work) {
        if (mode instanceof TransactionMode.CallerManaged) {
            return sessionFactory.write(mode, work);
        }
        int maxAttempts = settings.get().getMaxUpdateAttempts();
        AerospikeException lastConflict = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                return sessionFactory.write(mode, work);
            } catch (AerospikeException e) {
                if (!isTransactionConflict(e)) {
                    throw e;
                }
                lastConflict = e;
                metrics.recordUpdateConflict(STORE_TRANSACTION);
                log.warn("Baseline transaction for {} lost to a concurrent commit (result code {}), retrying (attempt {}/{})",
                        key, e.getResultCode(), i, maxAttempts);
            }
        }
        log.warn("Giving up on baseline transaction for {} after {} attempts", key, maxAttempts);
        throw new BaselineUpdateConflictException(STORE_TRANSACTION, key, maxAttempts, lastConflict);
    }

    // Commit verification failed: the transaction was aborted and nothing was written
    static boolean isTransactionConflict(AerospikeException e) {
        if (e instanceof AerospikeException.Commit commit) {
            return commit.error == CommitError.VERIFY_FAIL
                    || commit.error == CommitError.VERIFY_FAIL_CLOSE_ABANDONED
                    || commit.error == CommitError.VERIFY_FAIL_ABORT_ABANDONED;
        }
        return e.getResultCode() == ResultCode.MRT_VERSION_MISMATCH;
    }

    private void apply(BaselineSession session, DetectionEvent event, Instant now) {
        OffsetDateTime timestamp = event.getTimestamp();
        int hour = timestamp.getHour();
        int dayOfWeek = timestamp.getDayOfWeek().getValue() - 1;
        DecayModel decay = settings.get().decayModel();

        foldActivity(session, event.getCameraId(), hour, dayOfWeek, decay, now);
        foldClass(session, event.getCameraId(), event.getDetectionClass(), hour, decay, now);

        log.debug("Updated baselines for camera={}, class={}, hour={}, day={}",
                event.getCameraId(), event.getDetectionClass(), hour, dayOfWeek);
    }

    private void foldActivity(BaselineSession session, String cameraId, int hour, int dayOfWeek,
                              DecayModel decay, Instant now) {
        foldWithRetry(STORE_ACTIVITY, BaselineKeys.activityKey(cameraId, hour, dayOfWeek), () -> {
            ActivityBaseline existing = activityRepository.find(session, cameraId, hour, dayOfWeek);
            EwmaStep step = existing == null
                    ? EwmaStep.first()
                    : decay.fold(existing.getAvgCount(), existing.getSampleCount(), existing.getLastUpdated(), now);
            ActivityBaseline next = ActivityBaseline.builder()
                    .cameraId(cameraId)
                    .hour(hour)
                    .dayOfWeek(dayOfWeek)
                    .avgCount(step.value())
                    .sampleCount(step.sampleCount())
                    .lastUpdated(now)
                    .build();
            boolean written = existing == null
                    ? activityRepository.insert(session, next)
                    : activityRepository.update(session, next, existing.getGeneration());
            return written ? step : null;
        });
    }

    private void foldClass(BaselineSession session, String cameraId, String detectionClass, int hour,
                           DecayModel decay, Instant now) {
        foldWithRetry(STORE_CLASS, BaselineKeys.classKey(cameraId, hour, detectionClass), () -> {
            ClassBaseline existing = classRepository.find(session, cameraId, detectionClass, hour);
            EwmaStep step = existing == null
                    ? EwmaStep.first()
                    : decay.fold(existing.getFrequency(), existing.getSampleCount(), existing.getLastUpdated(), now);
            ClassBaseline next = ClassBaseline.builder()
                    .cameraId(cameraId)
                    .detectionClass(detectionClass)
                    .hour(hour)
                    .frequency(step.value())
                    .sampleCount(step.sampleCount())
                    .lastUpdated(now)
                    .build();
            boolean written = existing == null
                    ? classRepository.insert(session, next)
                    : classRepository.update(session, next, existing.getGeneration());
            return written ? step : null;
        });
    }

    /**
     * Runs one read-merge-write attempt until it lands. An attempt returns null when its
     * conditional write lost against a concurrent writer; the next attempt re-reads.
     */
    private void foldWithRetry(String store, String key, Supplier<EwmaStep> attempt) {
        int maxAttempts = settings.get().getMaxUpdateAttempts();
        AerospikeException lastBlocked = null;
        for (int i = 1; i <= maxAttempts; i++) {
            EwmaStep applied;
            try {
                applied = attempt.get();
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.MRT_BLOCKED) {
                    throw e;
                }
                lastBlocked = e;
                applied = null;
            }
            if (applied != null) {
                metrics.recordBaselineUpdate(store, applied.outcome());
                return;
            }
            metrics.recordUpdateConflict(store);
            log.warn("Concurrent write on {} baseline {}, retrying (attempt {}/{})", store, key, i, maxAttempts);
            if (lastBlocked != null && i < maxAttempts) {
                pauseWhileBlocked(i, lastBlocked);
            }
        }
        log.warn("Giving up on {} baseline {} after {} attempts", store, key, maxAttempts);
        throw new BaselineUpdateConflictException(store, key, maxAttempts, lastBlocked);
    }

    private void pauseWhileBlocked(int attempt, AerospikeException blocked) {
        try {
            Thread.sleep(BLOCKED_BACKOFF_MILLIS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw blocked;
        }
    }

    // ── Point queries ──

    public double getActivityRate(String cameraId, int hour, int dayOfWeek) {
        return getActivityRate(cameraId, hour, dayOfWeek, TransactionMode.selfManaged());
    }

    /**
     * Decayed activity average for a slot, or 0.0 when nothing has been learned there yet.
     */
    public double getActivityRate(String cameraId, int hour, int dayOfWeek, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        BaselineKeys.requireHour(hour);
        BaselineKeys.requireDayOfWeek(dayOfWeek);
        Instant now = clock.instant();
        return sessionFactory.read(mode, session -> {
            ActivityBaseline baseline = activityRepository.find(session, cameraId, hour, dayOfWeek);
            if (baseline == null) {
                return 0.0;
            }
            return settings.get().decayModel().decayed(baseline.getAvgCount(), baseline.getLastUpdated(), now);
        });
    }

    public double getClassFrequency(String cameraId, String detectionClass, int hour) {
        return getClassFrequency(cameraId, detectionClass, hour, TransactionMode.selfManaged());
    }

    /**
     * Decayed frequency of a class at an hour, or 0.0 when the class was never seen there.
     */
    public double getClassFrequency(String cameraId, String detectionClass, int hour, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        BaselineKeys.requireId(detectionClass, "detectionClass");
        BaselineKeys.requireHour(hour);
        Instant now = clock.instant();
        return sessionFactory.read(mode, session -> {
            ClassBaseline baseline = classRepository.find(session, cameraId, detectionClass, hour);
            if (baseline == null) {
                return 0.0;
            }
            return settings.get().decayModel().decayed(baseline.getFrequency(), baseline.getLastUpdated(), now);
        });
    }

    // ── Scoring ──

    public AnomalyVerdict isAnomalous(String cameraId, String detectionClass, OffsetDateTime timestamp) {
        return isAnomalous(cameraId, detectionClass, timestamp, TransactionMode.selfManaged());
    }

    public AnomalyVerdict isAnomalous(String cameraId, String detectionClass, Instant timestamp) {
        return isAnomalous(cameraId, detectionClass, timestamp, TransactionMode.selfManaged());
    }

    public AnomalyVerdict isAnomalous(String cameraId, String detectionClass, Instant timestamp,
                                      TransactionMode mode) {
        return isAnomalous(cameraId, detectionClass, atSettingsZone(timestamp), mode);
    }

    /**
     * Scores how unusual {@code detectionClass} is on this camera at the timestamp's hour,
     * relative to every other class seen at that hour.
     *
     * Returns {@link AnomalyVerdict#neutral()} when the hour has no class rows or fewer than
     * {@code minSamples} total samples. Otherwise the score is 1.0 for a class never seen at
     * this hour, 0.95 for one whose row has fully decayed, and {@code 1 - share} of decayed
     * mass for the rest. Read-only.
     */
    @Observed(name = "baseline.is_anomalous", contextualName = "score-detection")
    public AnomalyVerdict isAnomalous(String cameraId, String detectionClass, OffsetDateTime timestamp,
                                      TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        BaselineKeys.requireId(detectionClass, "detectionClass");
        requireTimestamp(timestamp);
        int hour = timestamp.getHour();
        Instant now = clock.instant();
        BaselineSettings current = settings.get();

        List<ClassBaseline> hourBaselines = sessionFactory.read(mode,
                session -> classRepository.findByCameraAndHour(session, cameraId, hour));

        AnomalyVerdict verdict = score(cameraId, detectionClass, hour, hourBaselines, current, now);
        metrics.recordAnomalyCheck(verdict);
        return verdict;
    }

    private AnomalyVerdict score(String cameraId, String detectionClass, int hour,
                                 List<ClassBaseline> hourBaselines, BaselineSettings current, Instant now) {
        if (hourBaselines.isEmpty()) {
            log.debug("No baselines for camera={}, hour={}. Cannot determine anomaly.", cameraId, hour);
            return AnomalyVerdict.neutral();
        }

        DecayModel decay = current.decayModel();
        double totalFrequency = 0.0;
        double classFrequency = 0.0;
        long totalSamples = 0;
        boolean classSeen = false;

        for (ClassBaseline baseline : hourBaselines) {
            double decayed = decay.decayed(baseline.getFrequency(), baseline.getLastUpdated(), now);
            totalFrequency += decayed;
            totalSamples += baseline.getSampleCount();
            if (baseline.getDetectionClass().equals(detectionClass)) {
                classFrequency = decayed;
                classSeen = true;
            }
        }

        if (totalSamples < current.getMinSamples()) {
            log.debug("Insufficient samples ({} < {}) for camera={}, hour={}. Cannot determine anomaly.",
                    totalSamples, current.getMinSamples(), cameraId, hour);
            return AnomalyVerdict.neutral();
        }

        double relativeFrequency = totalFrequency > 0 ? classFrequency / totalFrequency : 0.0;

        double anomalyScore;
        if (!classSeen) {
            anomalyScore = 1.0;
        } else if (classFrequency == 0.0) {
            anomalyScore = DECAYED_CLASS_SCORE;
        } else {
            anomalyScore = Math.max(0.0, Math.min(1.0, 1.0 - relativeFrequency));
        }

        boolean anomalous = anomalyScore > current.anomalyCutoff();

        log.debug("Anomaly check: camera={}, class={}, hour={}, relativeFreq={}, score={}, anomalous={}",
                cameraId, detectionClass, hour, String.format("%.4f", relativeFrequency),
                String.format("%.4f", anomalyScore), anomalous);

        return AnomalyVerdict.of(anomalous, anomalyScore);
    }

    // ── Lifecycle & tuning ──

    public int purgeCamera(String cameraId) {
        return purgeCamera(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Removes every activity row, class row and class index record of a camera.
     * Called when the camera itself is deleted. Returns the number of baseline rows removed.
     */
    public int purgeCamera(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        int removed = writeWithRetry(mode, "purge of " + cameraId, session ->
                activityRepository.deleteByCamera(session, cameraId) + classRepository.deleteByCamera(session, cameraId));
        log.info("Purged {} baseline rows for camera={}", removed, cameraId);
        return removed;
    }

    /**
     * Swaps in new scoring knobs. Null arguments keep the current value; an invalid value
     * throws and leaves the previous settings in place.
     */
    public BaselineSettings updateScoringConfig(Double thresholdStd, Integer minSamples) {
        BaselineSettings updated = settings.updateAndGet(current -> current.withScoring(thresholdStd, minSamples));
        log.info("BaselineService config updated: threshold={}std, minSamples={}",
                updated.getAnomalyThresholdStd(), updated.getMinSamples());
        return updated;
    }

    private void validate(DetectionEvent event) {
        BaselineKeys.requireId(event.getCameraId(), "cameraId");
        BaselineKeys.requireId(event.getDetectionClass(), "detectionClass");
        requireTimestamp(event.getTimestamp());
    }

    private static void requireTimestamp(Object timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    private OffsetDateTime atSettingsZone(Instant timestamp) {
        requireTimestamp(timestamp);
        return timestamp.atZone(settings.get().getZone()).toOffsetDateTime();
    }
}
