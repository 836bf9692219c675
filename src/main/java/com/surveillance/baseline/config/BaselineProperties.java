package com.surveillance.baseline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "baseline")
public class BaselineProperties {

    // Weight multiplier per elapsed day (0 < decayFactor <= 1). Closer to 1 forgets slower.
    private double decayFactor = 0.1;

    // Rows untouched for longer than this are treated as fully stale.
    private int windowDays = 30;

    // Higher values raise the anomaly cutoff, so fewer detections are flagged.
    private double anomalyThresholdStd = 2.0;

    // Total samples across classes at an hour before a verdict is trusted.
    private int minSamples = 10;

    // Optimistic write attempts per row before giving up on a contended key.
    private int maxUpdateAttempts = 5;

    // Zone used to derive hour / day-of-week from bare instants.
    private String zone = "UTC";
}
