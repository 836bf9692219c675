package com.surveillance.baseline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Diagnostic roll-up of everything learned for one camera. Totals are raw stored
 * values, not decayed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CameraBaselineSummary {

    private String cameraId;
    private int activityBaselineCount;
    private int classBaselineCount;
    private int uniqueClasses;
    private List<ClassTotal> topClasses;
    private List<HourActivity> peakHours;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClassTotal {
        private String detectionClass;
        private double totalFrequency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HourActivity {
        private int hour;
        private double totalActivity;
    }
}
