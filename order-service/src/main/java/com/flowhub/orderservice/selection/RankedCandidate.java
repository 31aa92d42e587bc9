package com.flowhub.orderservice.selection;

import com.flowhub.orderservice.model.VendorCandidate;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RankedCandidate {
    VendorCandidate candidate;
    BigDecimal totalCost;
    // Weighted score for BALANCED, raw metric value for single-dimension criteria
    double score;
}
