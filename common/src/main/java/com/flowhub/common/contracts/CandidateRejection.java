package com.flowhub.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateRejection {
    private String vendorId;
    private String locationId;
    private RejectionReason reason;
    private String detail;
}
