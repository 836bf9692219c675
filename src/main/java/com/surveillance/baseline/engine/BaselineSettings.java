package com.surveillance.baseline.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Immutable, validated tuning for the baseline engine.
 *
 * Construction fails with {@link IllegalArgumentException} on any out-of-range value;
 * nothing is clamped.
 */
@Getter
@ToString
public final class BaselineSettings {

    private final double decayFactor;
    private final int windowDays;
    private final double anomalyThresholdStd;
    private final int minSamples;
    private final int maxUpdateAttempts;
    private final ZoneId zone;

    @Builder(toBuilder = true)
    public BaselineSettings(double decayFactor, int windowDays, double anomalyThresholdStd,
                            int minSamples, int maxUpdateAttempts, ZoneId zone) {
        if (!(decayFactor > 0 && decayFactor <= 1)) {
            throw new IllegalArgumentException(
                    "decayFactor must be between 0 (exclusive) and 1 (inclusive), got " + decayFactor);
        }
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1, got " + windowDays);
        }
        if (!(anomalyThresholdStd >= 0)) {
            throw new IllegalArgumentException(
                    "anomalyThresholdStd must be non-negative, got " + anomalyThresholdStd);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        if (maxUpdateAttempts < 1) {
            throw new IllegalArgumentException("maxUpdateAttempts must be at least 1, got " + maxUpdateAttempts);
        }
        this.decayFactor = decayFactor;
        this.windowDays = windowDays;
        this.anomalyThresholdStd = anomalyThresholdStd;
        this.minSamples = minSamples;
        this.maxUpdateAttempts = maxUpdateAttempts;
        this.zone = zone != null ? zone : ZoneOffset.UTC;
    }

    public static BaselineSettings defaults() {
        return new BaselineSettings(0.1, 30, 2.0, 10, 5, ZoneOffset.UTC);
    }

    /**
     * Score above which a detection counts as anomalous: {@code 1 - 1 / (thresholdStd + 1)}.
     * A threshold of 0 flags every score above 0.
     */
    public double anomalyCutoff() {
        return 1.0 - 1.0 / (anomalyThresholdStd + 1.0);
    }

    /**
     * Returns a copy with the scoring knobs replaced. Null arguments keep the current value.
     * Unlike construction, a runtime threshold must be strictly positive.
     */
    public BaselineSettings withScoring(Double thresholdStd, Integer newMinSamples) {
        BaselineSettingsBuilder builder = toBuilder();
        if (thresholdStd != null) {
            if (!(thresholdStd > 0)) {
                throw new IllegalArgumentException("thresholdStd must be positive, got " + thresholdStd);
            }
            builder.anomalyThresholdStd(thresholdStd);
        }
        if (newMinSamples != null) {
            builder.minSamples(newMinSamples);
        }
        return builder.build();
    }

    public DecayModel decayModel() {
        return new DecayModel(decayFactor, windowDays);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BaselineSettings)) return false;
        BaselineSettings that = (BaselineSettings) o;
        return Double.compare(decayFactor, that.decayFactor) == 0
                && windowDays == that.windowDays
                && Double.compare(anomalyThresholdStd, that.anomalyThresholdStd) == 0
                && minSamples == that.minSamples
                && maxUpdateAttempts == that.maxUpdateAttempts
                && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(decayFactor, windowDays, anomalyThresholdStd, minSamples, maxUpdateAttempts, zone);
    }
}
