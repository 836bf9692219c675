package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * EWMA of how often a detection class occurs on a camera at one hour of day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassBaseline {

    private String cameraId;
    private String detectionClass;
    private int hour;
    private double frequency;
    private long sampleCount;
    private Instant lastUpdated;
    private int generation;
}
