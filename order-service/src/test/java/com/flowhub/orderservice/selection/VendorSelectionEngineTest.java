package com.flowhub.orderservice.selection;

import com.flowhub.orderservice.exception.NoCandidatesAvailableException;
import com.flowhub.orderservice.model.VendorCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class VendorSelectionEngineTest {

    private VendorSelectionEngine engine;

    private VendorCandidate vendorA;
    private VendorCandidate vendorB;
    private VendorCandidate vendorC;

    @BeforeEach
    void setUp() {
        engine = new VendorSelectionEngine(new SelectionProperties());

        vendorA = candidate("A", "100", 5, 4.5, 10, 24);
        vendorB = candidate("B", "90", 20, 4.0, 10, 48);
        vendorC = candidate("C", "110", 2, 4.8, 10, 12);
    }

    private static VendorCandidate candidate(String vendorId, String unitPrice, double distanceKm, double rating,
            int availableQuantity, double deliveryHours) {
        return VendorCandidate.builder()
                .vendorId(vendorId)
                .locationId(vendorId + "-loc-1")
                .unitPrice(new BigDecimal(unitPrice))
                .deliveryFee(BigDecimal.ZERO)
                .distanceKm(distanceKm)
                .rating(rating)
                .availableQuantity(availableQuantity)
                .estimatedDeliveryHours(deliveryHours)
                .build();
    }

    private static List<String> vendorIds(List<RankedCandidate> ranked) {
        List<String> ids = new ArrayList<>();
        ranked.forEach(candidate -> ids.add(candidate.getCandidate().getVendorId()));
        return ids;
    }

    @Test
    void rank_LowestPrice_OrdersByTotalCost() {
        // Act
        List<RankedCandidate> ranked = engine.rank(List.of(vendorA, vendorB, vendorC),
                SelectionCriteria.LOWEST_PRICE, 1, false);

        // Assert
        assertThat(vendorIds(ranked)).containsExactly("B", "A", "C");
        assertThat(ranked.get(0).getTotalCost()).isEqualByComparingTo("90");
    }

    @Test
    void rank_ClosestDistance_OrdersByDistance() {
        List<RankedCandidate> ranked = engine.rank(List.of(vendorA, vendorB, vendorC),
                SelectionCriteria.CLOSEST_DISTANCE, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("C", "A", "B");
    }

    @Test
    void rank_HighestRating_OrdersByRatingDescending() {
        List<RankedCandidate> ranked = engine.rank(List.of(vendorA, vendorB, vendorC),
                SelectionCriteria.HIGHEST_RATING, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("C", "A", "B");
    }

    @Test
    void rank_FastestDelivery_OrdersByDeliveryHours() {
        List<RankedCandidate> ranked = engine.rank(List.of(vendorA, vendorB, vendorC),
                SelectionCriteria.FASTEST_DELIVERY, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("C", "A", "B");
    }

    @Test
    void rank_Balanced_CombinesWeightedNormalizedMetrics() {
        // A: 0.4*(1-3/18) + 0.3*(1-0.5) + 0.2*0.625 = 0.608
        // C: 0.4*1 + 0.3*0 + 0.2*1 = 0.6
        // B: 0.4*0 + 0.3*1 + 0.2*0 = 0.3
        List<RankedCandidate> ranked = engine.rank(List.of(vendorB, vendorC, vendorA),
                SelectionCriteria.BALANCED, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("A", "C", "B");
        assertThat(ranked.get(0).getScore()).isCloseTo(0.6083, offset(0.001));
        assertThat(ranked.get(2).getScore()).isCloseTo(0.3, offset(0.001));
    }

    @Test
    void rank_NullCriteria_DefaultsToBalanced() {
        List<RankedCandidate> balanced = engine.rank(List.of(vendorA, vendorB, vendorC),
                SelectionCriteria.BALANCED, 1, false);
        List<RankedCandidate> defaulted = engine.rank(List.of(vendorA, vendorB, vendorC), null, 1, false);

        assertThat(vendorIds(defaulted)).isEqualTo(vendorIds(balanced));
    }

    @Test
    void rank_Balanced_IdenticalMetricsFallBackToTieBreak() {
        VendorCandidate first = candidate("X", "50", 3, 4.0, 5, 10);
        VendorCandidate second = candidate("W", "50", 3, 4.0, 5, 10);

        List<RankedCandidate> ranked = engine.rank(List.of(first, second), SelectionCriteria.BALANCED, 2, false);

        assertThat(vendorIds(ranked)).containsExactly("W", "X");
        assertThat(ranked).allSatisfy(candidate -> assertThat(candidate.getScore()).isZero());
    }

    @Test
    void rank_UrgentOrder_AddsSurchargeToCost() {
        // Arrange
        VendorCandidate cheapWithSurcharge = VendorCandidate.builder()
                .vendorId("B").locationId("B-loc-1")
                .unitPrice(new BigDecimal("90")).deliveryFee(new BigDecimal("5")).surcharge(new BigDecimal("20"))
                .distanceKm(20).rating(4.0).availableQuantity(10)
                .build();
        VendorCandidate noSurcharge = VendorCandidate.builder()
                .vendorId("A").locationId("A-loc-1")
                .unitPrice(new BigDecimal("100")).deliveryFee(new BigDecimal("5"))
                .distanceKm(5).rating(4.5).availableQuantity(10)
                .build();

        // Act
        List<RankedCandidate> regular = engine.rank(List.of(noSurcharge, cheapWithSurcharge),
                SelectionCriteria.LOWEST_PRICE, 1, false);
        List<RankedCandidate> urgent = engine.rank(List.of(noSurcharge, cheapWithSurcharge),
                SelectionCriteria.LOWEST_PRICE, 1, true);

        // Assert
        assertThat(vendorIds(regular)).containsExactly("B", "A");
        assertThat(vendorIds(urgent)).containsExactly("A", "B");
        assertThat(urgent.get(1).getTotalCost()).isEqualByComparingTo("115");
    }

    @Test
    void rank_QuantityMultipliesUnitPrice() {
        VendorCandidate lowUnitHighFee = VendorCandidate.builder()
                .vendorId("A").locationId("A-1")
                .unitPrice(new BigDecimal("10")).deliveryFee(new BigDecimal("50"))
                .distanceKm(1).rating(4).availableQuantity(10)
                .build();
        VendorCandidate highUnitNoFee = VendorCandidate.builder()
                .vendorId("B").locationId("B-1")
                .unitPrice(new BigDecimal("30")).deliveryFee(BigDecimal.ZERO)
                .distanceKm(1).rating(4).availableQuantity(10)
                .build();

        assertThat(vendorIds(engine.rank(List.of(lowUnitHighFee, highUnitNoFee),
                SelectionCriteria.LOWEST_PRICE, 1, false))).containsExactly("B", "A");
        assertThat(vendorIds(engine.rank(List.of(lowUnitHighFee, highUnitNoFee),
                SelectionCriteria.LOWEST_PRICE, 5, false))).containsExactly("A", "B");
    }

    @Test
    void rank_EqualPrice_BreaksTieByDistanceThenVendorId() {
        VendorCandidate far = candidate("A", "100", 9, 4.0, 10, 24);
        VendorCandidate nearZ = candidate("Z", "100", 1, 4.0, 10, 24);
        VendorCandidate nearY = candidate("Y", "100", 1, 4.0, 10, 24);

        List<RankedCandidate> ranked = engine.rank(List.of(far, nearZ, nearY), SelectionCriteria.LOWEST_PRICE, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("Y", "Z", "A");
    }

    @Test
    void rank_IsDeterministicRegardlessOfInputOrder() {
        List<VendorCandidate> candidates = new ArrayList<>(List.of(vendorA, vendorB, vendorC,
                candidate("D", "100", 5, 4.5, 10, 24)));
        List<String> expected = vendorIds(engine.rank(candidates, SelectionCriteria.BALANCED, 2, true));

        for (int i = 0; i < 5; i++) {
            Collections.shuffle(candidates);
            assertThat(vendorIds(engine.rank(candidates, SelectionCriteria.BALANCED, 2, true))).isEqualTo(expected);
        }
    }

    @Test
    void rank_ExcludesCandidatesWithoutStock() {
        VendorCandidate soldOut = candidate("S", "1", 1, 5.0, 0, 1);

        List<RankedCandidate> ranked = engine.rank(List.of(vendorA, soldOut), SelectionCriteria.LOWEST_PRICE, 1, false);

        assertThat(vendorIds(ranked)).containsExactly("A");
    }

    @Test
    void rank_Fails_WhenNoCandidates() {
        assertThatThrownBy(() -> engine.rank(List.of(), SelectionCriteria.LOWEST_PRICE, 1, false))
                .isInstanceOf(NoCandidatesAvailableException.class);
    }

    @Test
    void rank_Fails_WhenNoCandidateHasStock() {
        VendorCandidate soldOut = candidate("S", "1", 1, 5.0, 0, 1);

        assertThatThrownBy(() -> engine.rank(List.of(soldOut), SelectionCriteria.BALANCED, 1, false))
                .isInstanceOf(NoCandidatesAvailableException.class)
                .hasMessageContaining("stock");
    }

    @Test
    void criteria_AcceptsWireAndEnumNames() {
        assertThat(SelectionCriteria.from("best_price")).isEqualTo(SelectionCriteria.LOWEST_PRICE);
        assertThat(SelectionCriteria.from("closest_vendor")).isEqualTo(SelectionCriteria.CLOSEST_DISTANCE);
        assertThat(SelectionCriteria.from("HIGHEST_RATING")).isEqualTo(SelectionCriteria.HIGHEST_RATING);
        assertThatThrownBy(() -> SelectionCriteria.from("cheapest"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
