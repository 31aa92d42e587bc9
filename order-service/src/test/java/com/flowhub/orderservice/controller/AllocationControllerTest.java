package com.flowhub.orderservice.controller;

import com.flowhub.common.contracts.CandidateRejection;
import com.flowhub.common.contracts.RejectionReason;
import com.flowhub.orderservice.config.ReservationProperties;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.exception.AllocationFailedException;
import com.flowhub.orderservice.exception.AllocationInProgressException;
import com.flowhub.orderservice.mapper.ReservationMapperImpl;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.model.ReservationStatus;
import com.flowhub.orderservice.selection.SelectionCriteria;
import com.flowhub.orderservice.service.CancellationSignal;
import com.flowhub.orderservice.service.ReservationCoordinator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AllocationController.class)
@Import({ReservationMapperImpl.class, AllocationControllerTest.TestConfig.class})
class AllocationControllerTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        Executor allocationExecutor() {
            return Runnable::run;
        }

        @Bean
        ReservationProperties reservationProperties() {
            return new ReservationProperties();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReservationCoordinator reservationCoordinator;

    private final UUID orderId = UUID.randomUUID();

    private String requestBody(String criteria) {
        return "{\"orderId\":\"" + orderId + "\","
                + "\"items\":[{\"productId\":\"lpg-cylinder\",\"size\":\"12kg\",\"quantity\":2}],"
                + "\"latitude\":-1.28,\"longitude\":36.82,\"urgent\":true,"
                + "\"criteria\":\"" + criteria + "\"}";
    }

    @Test
    void allocate_Success_ReturnsCreatedReservation() throws Exception {
        // Arrange
        UUID reservationId = UUID.randomUUID();
        when(reservationCoordinator.allocate(any(), any())).thenReturn(ReservationResponse.builder()
                .id(reservationId)
                .orderId(orderId)
                .vendorId("A")
                .locationId("A-loc")
                .status(ReservationStatus.PENDING)
                .build());

        // Act
        MvcResult result = mockMvc.perform(post("/api/v1/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody("best_price")))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Assert
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(reservationId.toString()))
                .andExpect(jsonPath("$.vendorId").value("A"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<FulfillmentOrder> captor = ArgumentCaptor.forClass(FulfillmentOrder.class);
        verify(reservationCoordinator).allocate(captor.capture(), any(CancellationSignal.class));
        FulfillmentOrder order = captor.getValue();
        assertThat(order.getOrderId()).isEqualTo(orderId);
        assertThat(order.getCriteria()).isEqualTo(SelectionCriteria.LOWEST_PRICE);
        assertThat(order.isUrgent()).isTrue();
        assertThat(order.getDeliveryLocation().getLongitude()).isEqualTo(36.82);
        assertThat(order.totalQuantity()).isEqualTo(2);
    }

    @Test
    void allocate_AllCandidatesRefused_Returns422WithReasons() throws Exception {
        when(reservationCoordinator.allocate(any(), any())).thenThrow(new AllocationFailedException(orderId, List.of(
                CandidateRejection.builder().vendorId("B").locationId("B-loc")
                        .reason(RejectionReason.TRANSIENT_FAILURE).detail("timed out").build(),
                CandidateRejection.builder().vendorId("A").locationId("A-loc")
                        .reason(RejectionReason.REJECTED).detail("Insufficient stock").build())));

        MvcResult result = mockMvc.perform(post("/api/v1/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody("balanced")))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("ALLOCATION_FAILED"))
                .andExpect(jsonPath("$.orderId").value(orderId.toString()))
                .andExpect(jsonPath("$.rejections[0].vendorId").value("B"))
                .andExpect(jsonPath("$.rejections[0].reason").value("TRANSIENT_FAILURE"))
                .andExpect(jsonPath("$.rejections[1].reason").value("REJECTED"));
    }

    @Test
    void allocate_InProgress_Returns409() throws Exception {
        when(reservationCoordinator.allocate(any(), any()))
                .thenThrow(new AllocationInProgressException("Allocation already in progress for order " + orderId));

        MvcResult result = mockMvc.perform(post("/api/v1/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody("balanced")))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALLOCATION_IN_PROGRESS"));
    }

    @Test
    void allocate_InvalidRequest_Returns400() throws Exception {
        String body = "{\"orderId\":\"" + orderId + "\",\"items\":[],\"latitude\":120.0,\"longitude\":36.82}";

        mockMvc.perform(post("/api/v1/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.validationErrors.items").exists())
                .andExpect(jsonPath("$.validationErrors.latitude").exists());

        verify(reservationCoordinator, never()).allocate(any(), any());
    }

    @Test
    void allocate_UnknownCriteria_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody("cheapest_possible")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"));

        verify(reservationCoordinator, never()).allocate(any(), any());
    }
}
