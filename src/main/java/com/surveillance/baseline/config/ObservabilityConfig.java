package com.surveillance.baseline.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    // Backs the @Observed annotations on the service layer
    @Bean
    public ObservedAspect observedAspect(ObjectProvider<ObservationRegistry> observationRegistry) {
        return new ObservedAspect(observationRegistry.getIfAvailable(ObservationRegistry::create));
    }
}
