package com.flowhub.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VendorAvailabilityResponse {
    private boolean available;
    private Map<String, Object> capacityInfo;
}
