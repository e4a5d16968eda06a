package uk.gegc.adaptivetest.features.report.domain.model;

/**
 * @param information total item information the topic contributed at the final theta
 */
public record TopicScore(
        String topic,
        int administered,
        int correct,
        double accuracy,
        double averageDifficulty,
        double information
) {
}
