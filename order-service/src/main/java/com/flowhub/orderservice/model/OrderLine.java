package com.flowhub.orderservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLine {
    private String productId;
    // e.g. cylinder size "12kg"; optional
    private String size;
    private int quantity;
}
