package com.surveillance.baseline.engine;

/**
 * Result of folding one detection into a stored aggregate.
 */
public record EwmaStep(double value, long sampleCount, Outcome outcome) {

    public enum Outcome {
        /** No row existed; the detection seeds it. */
        CREATED,
        /** Decayed previous value blended with the new observation. */
        MERGED,
        /** Previous row was past the window and restarted from scratch. */
        RESET
    }

    public static EwmaStep first() {
        return new EwmaStep(1.0, 1, Outcome.CREATED);
    }
}
