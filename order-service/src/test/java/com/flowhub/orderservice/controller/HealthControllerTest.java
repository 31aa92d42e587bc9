package com.flowhub.orderservice.controller;

import com.flowhub.common.messaging.BrokerStatus;
import com.flowhub.common.messaging.ConnectionState;
import com.flowhub.common.resilience.CircuitSnapshot;
import com.flowhub.orderservice.health.HealthAggregator;
import com.flowhub.orderservice.health.HealthReport;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthAggregator healthAggregator;

    @Test
    void health_Degraded_StillReturns200() throws Exception {
        when(healthAggregator.report()).thenReturn(HealthReport.builder()
                .status(HealthReport.DEGRADED)
                .dependencies(HealthReport.Dependencies.builder()
                        .broker(BrokerStatus.builder().state(ConnectionState.CONNECTING).pendingCount(4).build())
                        .circuits(Map.of("inventory", CircuitSnapshot.builder()
                                .target("inventory")
                                .state(CircuitBreaker.State.OPEN)
                                .consecutiveFailures(5)
                                .build()))
                        .build())
                .build());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.dependencies.broker.state").value("CONNECTING"))
                .andExpect(jsonPath("$.dependencies.broker.pendingCount").value(4))
                .andExpect(jsonPath("$.dependencies.circuits.inventory.state").value("OPEN"))
                .andExpect(jsonPath("$.dependencies.circuits.inventory.consecutiveFailures").value(5));
    }
}
