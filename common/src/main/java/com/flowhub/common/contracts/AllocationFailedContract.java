package com.flowhub.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when no candidate vendor could hold stock for an order.
 * Carries one entry per candidate that was tried, in trial order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationFailedContract {
    private UUID orderId;
    private List<CandidateRejection> reasons;
    private Instant timestamp;
}
