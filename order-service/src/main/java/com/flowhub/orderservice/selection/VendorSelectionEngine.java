package com.flowhub.orderservice.selection;

import com.flowhub.orderservice.exception.NoCandidatesAvailableException;
import com.flowhub.orderservice.model.VendorCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Orders candidate vendor locations for an allocation.
 * <p>
 * Single-dimension criteria sort on their metric. {@link SelectionCriteria#BALANCED} combines
 * distance, cost, rating and available quantity with min-max normalization computed over the
 * candidates of this call only, so scores are not comparable across calls.
 * <p>
 * Ties are always broken by distance, then vendor id, then location id, which makes the ranking
 * deterministic for identical input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VendorSelectionEngine {

    private static final Comparator<RankedCandidate> TIE_BREAK = Comparator
            .comparingDouble((RankedCandidate ranked) -> ranked.getCandidate().getDistanceKm())
            .thenComparing(ranked -> ranked.getCandidate().getVendorId(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ranked -> ranked.getCandidate().getLocationId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final SelectionProperties properties;

    public List<RankedCandidate> rank(List<VendorCandidate> candidates, SelectionCriteria criteria,
            int quantity, boolean urgent) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoCandidatesAvailableException("No vendor candidates to rank");
        }

        List<VendorCandidate> inStock = candidates.stream()
                .filter(candidate -> candidate.getAvailableQuantity() > 0)
                .collect(Collectors.toList());
        if (inStock.isEmpty()) {
            throw new NoCandidatesAvailableException(
                    "None of the " + candidates.size() + " vendor candidates has stock available");
        }

        SelectionCriteria effective = criteria == null ? SelectionCriteria.BALANCED : criteria;
        List<RankedCandidate> ranked = switch (effective) {
            case LOWEST_PRICE -> byMetric(inStock, quantity, urgent,
                    candidate -> candidate.totalCost(quantity, urgent).doubleValue(), false);
            case FASTEST_DELIVERY -> byMetric(inStock, quantity, urgent,
                    VendorCandidate::getEstimatedDeliveryHours, false);
            case CLOSEST_DISTANCE -> byMetric(inStock, quantity, urgent,
                    VendorCandidate::getDistanceKm, false);
            case HIGHEST_RATING -> byMetric(inStock, quantity, urgent,
                    VendorCandidate::getRating, true);
            case BALANCED -> balanced(inStock, quantity, urgent);
        };

        log.debug("Ranked {} of {} candidates. criteria={}, urgent={}",
                ranked.size(), candidates.size(), effective, urgent);
        return ranked;
    }

    private List<RankedCandidate> byMetric(List<VendorCandidate> candidates, int quantity, boolean urgent,
            ToDoubleFunction<VendorCandidate> metric, boolean higherIsBetter) {
        Comparator<RankedCandidate> primary = Comparator.comparingDouble(RankedCandidate::getScore);
        if (higherIsBetter) {
            primary = primary.reversed();
        }
        return candidates.stream()
                .map(candidate -> new RankedCandidate(candidate, candidate.totalCost(quantity, urgent),
                        metric.applyAsDouble(candidate)))
                .sorted(primary.thenComparing(TIE_BREAK))
                .collect(Collectors.toList());
    }

    private List<RankedCandidate> balanced(List<VendorCandidate> candidates, int quantity, boolean urgent) {
        SelectionProperties.Weights weights = properties.getWeights();
        Range distance = Range.of(candidates, VendorCandidate::getDistanceKm);
        Range cost = Range.of(candidates, candidate -> candidate.totalCost(quantity, urgent).doubleValue());
        Range rating = Range.of(candidates, VendorCandidate::getRating);
        Range availability = Range.of(candidates, VendorCandidate::getAvailableQuantity);

        Comparator<RankedCandidate> byScore = Comparator.comparingDouble(RankedCandidate::getScore).reversed();
        return candidates.stream()
                .map(candidate -> {
                    double totalCost = candidate.totalCost(quantity, urgent).doubleValue();
                    double score = weights.getDistance() * (1 - distance.normalize(candidate.getDistanceKm()))
                            + weights.getCost() * (1 - cost.normalize(totalCost))
                            + weights.getQuality() * rating.normalize(candidate.getRating())
                            + weights.getAvailability() * availability.normalize(candidate.getAvailableQuantity());
                    return new RankedCandidate(candidate, candidate.totalCost(quantity, urgent), score);
                })
                .sorted(byScore.thenComparing(TIE_BREAK))
                .collect(Collectors.toList());
    }

    private static final class Range {
        private final double min;
        private final double max;

        private Range(double min, double max) {
            this.min = min;
            this.max = max;
        }

        static Range of(List<VendorCandidate> candidates, ToDoubleFunction<VendorCandidate> metric) {
            double min = candidates.stream().mapToDouble(metric).min().orElse(0);
            double max = candidates.stream().mapToDouble(metric).max().orElse(0);
            return new Range(min, max);
        }

        // 0 when every candidate has the same value
        double normalize(double value) {
            return max > min ? (value - min) / (max - min) : 0;
        }
    }
}
