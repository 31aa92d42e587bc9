package com.flowhub.orderservice.health;

import com.flowhub.common.messaging.BrokerStatus;
import com.flowhub.common.resilience.CircuitSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    public static final String UP = "UP";
    public static final String DEGRADED = "DEGRADED";

    private String status;
    private Dependencies dependencies;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dependencies {
        private BrokerStatus broker;
        // keyed by target name, sorted
        private Map<String, CircuitSnapshot> circuits;
    }
}
