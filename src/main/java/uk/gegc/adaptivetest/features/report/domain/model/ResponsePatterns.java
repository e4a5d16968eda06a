package uk.gegc.adaptivetest.features.report.domain.model;

/**
 * Coarse trends over the response sequence. A trend is {@code null} when there is too little data for it.
 *
 * @param difficultyAdaptation how item difficulty moved from the first half of the test to the second
 */
public record ResponsePatterns(
        Trend responseTimeTrend,
        Trend accuracyTrend,
        Trend difficultyAdaptation
) {

    public static ResponsePatterns insufficientData() {
        return new ResponsePatterns(null, null, null);
    }
}
