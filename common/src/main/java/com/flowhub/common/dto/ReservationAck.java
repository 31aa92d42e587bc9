package com.flowhub.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Inventory answer to reserve, release and confirm calls.
 * {@code status} is one of "reserved", "released", "confirmed" or "rejected".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationAck {

    public static final String STATUS_REJECTED = "rejected";

    private UUID reservationId;
    private String status;
    private String reason;

    public boolean isRejected() {
        return STATUS_REJECTED.equalsIgnoreCase(status);
    }
}
