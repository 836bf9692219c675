package com.surveillance.baseline.model;

import java.util.Objects;

/**
 * Outcome of scoring a detection against its class baseline.
 *
 * The neutral verdict {@code (false, 0.5)} means "not enough history to judge" and is
 * distinguishable from an informed verdict that happens to carry the same numbers.
 */
public final class AnomalyVerdict {

    private static final AnomalyVerdict NEUTRAL = new AnomalyVerdict(false, 0.5, false);

    private final boolean anomalous;
    private final double score;
    private final boolean informed;

    private AnomalyVerdict(boolean anomalous, double score, boolean informed) {
        this.anomalous = anomalous;
        this.score = score;
        this.informed = informed;
    }

    public static AnomalyVerdict neutral() {
        return NEUTRAL;
    }

    public static AnomalyVerdict of(boolean anomalous, double score) {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("anomaly score must be within [0, 1], got " + score);
        }
        return new AnomalyVerdict(anomalous, score, true);
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public double getScore() {
        return score;
    }

    public boolean isNeutral() {
        return !informed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnomalyVerdict)) return false;
        AnomalyVerdict that = (AnomalyVerdict) o;
        return anomalous == that.anomalous
                && Double.compare(score, that.score) == 0
                && informed == that.informed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalous, score, informed);
    }

    @Override
    public String toString() {
        return informed
                ? "AnomalyVerdict(anomalous=" + anomalous + ", score=" + score + ")"
                : "AnomalyVerdict(neutral)";
    }
}
