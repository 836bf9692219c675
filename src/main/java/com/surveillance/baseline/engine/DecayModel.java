package com.surveillance.baseline.engine;

import java.time.Instant;

/**
 * Continuous exponential forgetting over a rolling window.
 *
 * A stored value last touched {@code d} days ago carries weight {@code decayFactor ^ d},
 * or 0 once {@code d > windowDays}. Negative elapsed time (clock skew, or a reference
 * point earlier than the row) is clamped to 0, giving full weight.
 */
public final class DecayModel {

    static final double MILLIS_PER_DAY = 86_400_000.0;

    // Each detection counts as one observation of weight 1
    private static final double OBSERVATION = 1.0;

    private final double decayFactor;
    private final int windowDays;

    public DecayModel(double decayFactor, int windowDays) {
        this.decayFactor = decayFactor;
        this.windowDays = windowDays;
    }

    public double decay(Instant lastUpdated, Instant now) {
        double daysElapsed = Math.max(0.0, (now.toEpochMilli() - lastUpdated.toEpochMilli()) / MILLIS_PER_DAY);
        if (daysElapsed > windowDays) {
            return 0.0;
        }
        return Math.pow(decayFactor, daysElapsed);
    }

    public double decayed(double storedValue, Instant lastUpdated, Instant now) {
        return storedValue * decay(lastUpdated, now);
    }

    /**
     * Blends one new detection into an existing aggregate as of {@code now}.
     */
    public EwmaStep fold(double previousValue, long previousSamples, Instant lastUpdated, Instant now) {
        double decay = decay(lastUpdated, now);
        if (decay > 0) {
            double value = decay * previousValue + (1 - decay) * OBSERVATION;
            return new EwmaStep(value, previousSamples + 1, EwmaStep.Outcome.MERGED);
        }
        return new EwmaStep(OBSERVATION, 1, EwmaStep.Outcome.RESET);
    }
}
