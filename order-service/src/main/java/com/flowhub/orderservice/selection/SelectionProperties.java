package com.flowhub.orderservice.selection;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "flowhub.selection")
public class SelectionProperties {

    @Valid
    private Weights weights = new Weights();

    /**
     * Weights of the balanced score. They are not required to sum to 1.
     */
    @Data
    public static class Weights {
        @DecimalMin("0.0")
        private double distance = 0.4;
        @DecimalMin("0.0")
        private double cost = 0.3;
        @DecimalMin("0.0")
        private double quality = 0.2;
        @DecimalMin("0.0")
        private double availability = 0.1;
    }
}
