package com.flowhub.orderservice.selection;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;

/**
 * How candidate vendors are ordered for an allocation.
 * Accepts both the enum names and the marketplace wire names ({@code best_price}, ...).
 */
public enum SelectionCriteria {
    LOWEST_PRICE("best_price"),
    FASTEST_DELIVERY("fastest_delivery"),
    CLOSEST_DISTANCE("closest_vendor"),
    HIGHEST_RATING("highest_rated"),
    BALANCED("balanced");

    private final String wireName;

    SelectionCriteria(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SelectionCriteria from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(criteria -> criteria.name().equalsIgnoreCase(normalized)
                        || criteria.wireName.equals(normalized.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown selection criteria: " + value));
    }
}
