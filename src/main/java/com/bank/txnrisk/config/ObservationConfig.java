package com.bank.txnrisk.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables {@code @Observed} on service methods.
 * Falls back to a no-op registry when observation auto-configuration is absent (sliced tests).
 */
@Configuration
public class ObservationConfig {

    @Bean
    public ObservedAspect observedAspect(ObjectProvider<ObservationRegistry> observationRegistry) {
        return new ObservedAspect(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }
}
