package com.flowhub.orderservice.health;

import com.flowhub.common.messaging.BrokerStatus;
import com.flowhub.common.resilience.CircuitSnapshot;
import com.flowhub.common.resilience.ResilientCallExecutor;
import com.flowhub.common.messaging.ResilientBrokerClient;
import com.flowhub.orderservice.service.ReservationCoordinatorImpl;
import com.flowhub.orderservice.service.VendorCandidateProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines broker connection state and circuit states into one report.
 * The service is UP only when the broker is connected and every circuit is closed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HealthAggregator {

    // Always reported, even before the first call reached them
    private static final List<String> MONITORED_TARGETS = List.of(
            VendorCandidateProvider.CATALOG_TARGET, ReservationCoordinatorImpl.INVENTORY_TARGET);

    private final ResilientBrokerClient brokerClient;
    private final ResilientCallExecutor callExecutor;

    public HealthReport report() {
        MONITORED_TARGETS.forEach(callExecutor::snapshot);

        BrokerStatus broker = brokerClient.getStatus();
        Map<String, CircuitSnapshot> circuits = new LinkedHashMap<>();
        for (CircuitSnapshot snapshot : callExecutor.snapshots()) {
            circuits.put(snapshot.getTarget(), snapshot);
        }

        boolean healthy = broker.isConnected() && circuits.values().stream().allMatch(CircuitSnapshot::isClosed);
        if (!healthy) {
            log.debug("Service degraded. brokerState={}, pendingEvents={}", broker.getState(), broker.getPendingCount());
        }
        return HealthReport.builder()
                .status(healthy ? HealthReport.UP : HealthReport.DEGRADED)
                .dependencies(HealthReport.Dependencies.builder()
                        .broker(broker)
                        .circuits(circuits)
                        .build())
                .build();
    }

    /**
     * False while the target's circuit is open, so callers can shed work early.
     */
    public boolean acceptingTraffic(String target) {
        return callExecutor.isCallPermitted(target);
    }
}
