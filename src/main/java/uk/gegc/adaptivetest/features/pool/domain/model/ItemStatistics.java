package uk.gegc.adaptivetest.features.pool.domain.model;

import java.util.SortedMap;

public record ItemStatistics(
        String itemId,
        long usageCount,
        long correctCount,
        double correctRate,
        Double averageResponseTimeSeconds,
        long exposureCount,
        double exposureRate,
        SortedMap<Double, Double> informationCurve
) {
}
