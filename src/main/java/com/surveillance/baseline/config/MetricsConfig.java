package com.surveillance.baseline.config;

import com.surveillance.baseline.engine.EwmaStep;
import com.surveillance.baseline.model.AnomalyVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBaselineUpdate(String store, EwmaStep.Outcome outcome) {
        Counter.builder("baseline.update.count")
                .tag("store", store)
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordUpdateConflict(String store) {
        Counter.builder("baseline.update.conflict.count")
                .tag("store", store)
                .register(registry)
                .increment();
    }

    public void recordAnomalyCheck(AnomalyVerdict verdict) {
        String outcome;
        if (verdict.isNeutral()) {
            outcome = "neutral";
        } else {
            outcome = verdict.isAnomalous() ? "anomalous" : "normal";
        }
        Counter.builder("baseline.anomaly.check.count")
                .tag("verdict", outcome)
                .register(registry)
                .increment();

        if (!verdict.isNeutral()) {
            DistributionSummary.builder("baseline.anomaly.score")
                    .register(registry)
                    .record(verdict.getScore());
        }
    }
}
