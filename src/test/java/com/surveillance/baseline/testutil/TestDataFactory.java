package com.surveillance.baseline.testutil;

import com.aerospike.client.Record;
import com.surveillance.baseline.engine.BaselineSettings;
import com.surveillance.baseline.model.ActivityBaseline;
import com.surveillance.baseline.model.ClassBaseline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // Monday, 14:30 UTC
    public static final Instant NOW = Instant.parse("2026-03-02T14:30:00Z");

    private TestDataFactory() {}

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static Instant daysAgo(double days) {
        return NOW.minusMillis((long) (days * Duration.ofDays(1).toMillis()));
    }

    public static BaselineSettings settings(double decayFactor, double thresholdStd, int minSamples) {
        return BaselineSettings.defaults().toBuilder()
                .decayFactor(decayFactor)
                .anomalyThresholdStd(thresholdStd)
                .minSamples(minSamples)
                .build();
    }

    public static ActivityBaseline activity(String cameraId, int hour, int dayOfWeek,
                                            double avgCount, long samples, Instant lastUpdated) {
        return ActivityBaseline.builder()
                .cameraId(cameraId)
                .hour(hour)
                .dayOfWeek(dayOfWeek)
                .avgCount(avgCount)
                .sampleCount(samples)
                .lastUpdated(lastUpdated)
                .generation(1)
                .build();
    }

    public static ClassBaseline classBaseline(String cameraId, String detectionClass, int hour,
                                              double frequency, long samples, Instant lastUpdated) {
        return ClassBaseline.builder()
                .cameraId(cameraId)
                .detectionClass(detectionClass)
                .hour(hour)
                .frequency(frequency)
                .sampleCount(samples)
                .lastUpdated(lastUpdated)
                .generation(1)
                .build();
    }

    public static Record activityRecord(String cameraId, int hour, int dayOfWeek,
                                        double avgCount, long samples, Instant lastUpdated, int generation) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("cameraId", cameraId);
        bins.put("hour", (long) hour);
        bins.put("dayOfWeek", (long) dayOfWeek);
        bins.put("avgCount", avgCount);
        bins.put("sampleCount", samples);
        bins.put("lastUpdated", lastUpdated.toEpochMilli());
        return new Record(bins, generation, 0);
    }

    public static Record classRecord(String cameraId, String detectionClass, int hour,
                                     double frequency, long samples, Instant lastUpdated, int generation) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("cameraId", cameraId);
        bins.put("detClass", detectionClass);
        bins.put("hour", (long) hour);
        bins.put("frequency", frequency);
        bins.put("sampleCount", samples);
        bins.put("lastUpdated", lastUpdated.toEpochMilli());
        return new Record(bins, generation, 0);
    }

    public static Record indexRecord(String... classes) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("classes", List.of((Object[]) classes));
        return new Record(bins, 1, 0);
    }
}
