package com.flowhub.orderservice.client;

import com.flowhub.common.dto.VendorAvailabilityResponse;
import com.flowhub.orderservice.dto.CandidateSearchRequest;
import com.flowhub.orderservice.model.VendorCandidate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class HttpCatalogClient implements CatalogClient {

    private final WebClient catalogWebClient;

    public HttpCatalogClient(@Qualifier("catalogWebClient") WebClient catalogWebClient) {
        this.catalogWebClient = catalogWebClient;
    }

    @Override
    public Mono<List<VendorCandidate>> findCandidates(CandidateSearchRequest request) {
        return catalogWebClient.post()
                .uri("/vendors/candidates")
                .bodyValue(request)
                .retrieve()
                .bodyToFlux(VendorCandidate.class)
                .collectList();
    }

    @Override
    public Mono<VendorAvailabilityResponse> availability(String vendorId) {
        return catalogWebClient.get()
                .uri("/vendors/{id}/availability", vendorId)
                .retrieve()
                .bodyToMono(VendorAvailabilityResponse.class);
    }
}
