package com.flowhub.orderservice.dto;

import com.flowhub.common.dto.ReserveStockItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Body of {@code POST /vendors/candidates} on the catalog service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateSearchRequest {
    private UUID orderId;
    private List<ReserveStockItem> items;
    private double latitude;
    private double longitude;
    private boolean urgent;
}
