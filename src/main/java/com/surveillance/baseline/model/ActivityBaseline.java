package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * EWMA of detection activity for one (camera, hour-of-day, day-of-week) slot.
 * {@code avgCount} is only meaningful relative to {@code lastUpdated}; decay it before use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityBaseline {

    private String cameraId;
    private int hour;         // 0-23
    private int dayOfWeek;    // 0 = Monday, 6 = Sunday
    private double avgCount;
    private long sampleCount;
    private Instant lastUpdated;

    // Record generation at read time; compared on write to detect concurrent updates
    private int generation;
}
