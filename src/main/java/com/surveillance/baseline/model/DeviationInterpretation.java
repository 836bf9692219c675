package com.surveillance.baseline.model;

public enum DeviationInterpretation {
    FAR_BELOW_NORMAL,
    BELOW_NORMAL,
    NORMAL,
    SLIGHTLY_ABOVE_NORMAL,
    ABOVE_NORMAL,
    FAR_ABOVE_NORMAL;

    public static DeviationInterpretation fromZScore(double zScore) {
        if (zScore < -2.0) return FAR_BELOW_NORMAL;
        if (zScore < -1.0) return BELOW_NORMAL;
        if (zScore < 1.0) return NORMAL;
        if (zScore < 2.0) return SLIGHTLY_ABOVE_NORMAL;
        if (zScore < 3.0) return ABOVE_NORMAL;
        return FAR_ABOVE_NORMAL;
    }
}
