package com.surveillance.baseline.config;

import com.surveillance.baseline.engine.BaselineSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class EngineConfig {

    @Bean
    public Clock baselineClock() {
        return Clock.systemUTC();
    }

    /**
     * Validated snapshot of the baseline properties. Invalid values abort context startup.
     */
    @Bean
    public BaselineSettings baselineSettings(BaselineProperties properties) {
        return BaselineSettings.builder()
                .decayFactor(properties.getDecayFactor())
                .windowDays(properties.getWindowDays())
                .anomalyThresholdStd(properties.getAnomalyThresholdStd())
                .minSamples(properties.getMinSamples())
                .maxUpdateAttempts(properties.getMaxUpdateAttempts())
                .zone(ZoneId.of(properties.getZone()))
                .build();
    }
}
