package com.flowhub.orderservice.service;

import com.flowhub.common.dto.VendorAvailabilityResponse;
import com.flowhub.common.resilience.ResilienceProperties;
import com.flowhub.common.resilience.ResilientCallExecutor;
import com.flowhub.common.resilience.TransientFailureClassifier;
import com.flowhub.orderservice.client.CatalogClient;
import com.flowhub.orderservice.dto.CandidateSearchRequest;
import com.flowhub.orderservice.exception.ExternalServiceException;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.model.GeoPoint;
import com.flowhub.orderservice.model.OrderLine;
import com.flowhub.orderservice.model.VendorCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VendorCandidateProviderTest {

    @Mock
    private CatalogClient catalogClient;

    private VendorCandidateProvider provider;
    private FulfillmentOrder order;

    @BeforeEach
    void setUp() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.setBackoffBase(Duration.ofMillis(1));
        properties.setBackoffMax(Duration.ofMillis(5));
        properties.setJitter(false);
        properties.setCallTimeout(Duration.ofMillis(200));
        provider = new VendorCandidateProvider(catalogClient,
                new ResilientCallExecutor(properties, new TransientFailureClassifier()));

        order = FulfillmentOrder.builder()
                .orderId(UUID.randomUUID())
                .items(List.of(OrderLine.builder().productId("lpg-cylinder").size("12kg").quantity(3).build()))
                .deliveryLocation(new GeoPoint(-1.28, 36.82))
                .urgent(true)
                .build();
    }

    private static VendorCandidate candidate(String vendorId, String locationId) {
        return VendorCandidate.builder().vendorId(vendorId).locationId(locationId).availableQuantity(5).build();
    }

    private static Mono<VendorAvailabilityResponse> available(boolean available) {
        return Mono.just(VendorAvailabilityResponse.builder().available(available).capacityInfo(Map.of()).build());
    }

    @Test
    void candidatesFor_SendsOrderDetailsToCatalog() {
        when(catalogClient.findCandidates(any())).thenReturn(Mono.just(List.of()));

        provider.candidatesFor(order);

        ArgumentCaptor<CandidateSearchRequest> captor = ArgumentCaptor.forClass(CandidateSearchRequest.class);
        verify(catalogClient).findCandidates(captor.capture());
        CandidateSearchRequest request = captor.getValue();
        assertThat(request.getOrderId()).isEqualTo(order.getOrderId());
        assertThat(request.getLatitude()).isEqualTo(-1.28);
        assertThat(request.isUrgent()).isTrue();
        assertThat(request.getItems()).singleElement()
                .satisfies(item -> {
                    assertThat(item.getProductId()).isEqualTo("lpg-cylinder");
                    assertThat(item.getQuantity()).isEqualTo(3);
                });
    }

    @Test
    void candidatesFor_DropsUnavailableVendors_CheckingEachVendorOnce() {
        // Arrange
        when(catalogClient.findCandidates(any())).thenReturn(Mono.just(List.of(
                candidate("A", "A-1"), candidate("A", "A-2"), candidate("B", "B-1"))));
        when(catalogClient.availability("A")).thenReturn(available(true));
        when(catalogClient.availability("B")).thenReturn(available(false));

        // Act
        List<VendorCandidate> candidates = provider.candidatesFor(order);

        // Assert
        assertThat(candidates).extracting(VendorCandidate::getLocationId).containsExactly("A-1", "A-2");
        verify(catalogClient, times(1)).availability("A");
    }

    @Test
    void candidatesFor_KeepsVendor_WhenAvailabilityCheckFails() {
        when(catalogClient.findCandidates(any())).thenReturn(Mono.just(List.of(candidate("A", "A-1"))));
        when(catalogClient.availability("A")).thenReturn(Mono.error(new IOException("Connection reset")));

        List<VendorCandidate> candidates = provider.candidatesFor(order);

        assertThat(candidates).extracting(VendorCandidate::getVendorId).containsExactly("A");
    }

    @Test
    void candidatesFor_Fails_WhenCatalogUnavailable() {
        when(catalogClient.findCandidates(any())).thenReturn(Mono.error(new IOException("Connection refused")));

        assertThatThrownBy(() -> provider.candidatesFor(order))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining(order.getOrderId().toString());
        verify(catalogClient, never()).availability(anyString());
    }

    @Test
    void candidatesFor_ReturnsEmpty_WhenCatalogHasNoCandidates() {
        when(catalogClient.findCandidates(any())).thenReturn(Mono.just(List.of()));

        assertThat(provider.candidatesFor(order)).isEmpty();
        verify(catalogClient, never()).availability(anyString());
    }
}
