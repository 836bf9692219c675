package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyPattern {
    private double avgDetections;
    private int peakHour;
    private long totalSamples;
}
