package com.flowhub.orderservice.client;

import com.flowhub.common.dto.VendorAvailabilityResponse;
import com.flowhub.orderservice.dto.CandidateSearchRequest;
import com.flowhub.orderservice.model.VendorCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

public interface CatalogClient {

    Mono<List<VendorCandidate>> findCandidates(CandidateSearchRequest request);

    Mono<VendorAvailabilityResponse> availability(String vendorId);
}
