package com.flowhub.orderservice.config;

import com.flowhub.common.resilience.ResilienceProperties;
import com.flowhub.common.resilience.ResilientCallExecutor;
import com.flowhub.common.resilience.TransientFailureClassifier;
import com.flowhub.orderservice.selection.SelectionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({ ResilienceProperties.class, ReservationProperties.class, SelectionProperties.class })
public class ResilienceConfig {

    @Bean
    public TransientFailureClassifier transientFailureClassifier() {
        return new TransientFailureClassifier();
    }

    @Bean
    public ResilientCallExecutor resilientCallExecutor(ResilienceProperties properties,
            TransientFailureClassifier classifier, Clock clock) {
        return new ResilientCallExecutor(properties, classifier, clock);
    }
}
