package uk.gegc.adaptivetest.features.report.domain.model;

import lombok.Builder;
import uk.gegc.adaptivetest.features.session.domain.model.StopReason;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Scored outcome of a completed session. Created once at completion and never changed.
 *
 * @param abilityPercentile  standard normal CDF of the final theta, as a percentage rounded to one decimal
 * @param responseConsistency agreement between observed and model-expected accuracy, 1.0 is perfect
 */
@Builder
public record AdaptiveTestReport(
        UUID sessionId,
        UUID poolId,
        String examineeId,
        double finalTheta,
        double finalStandardError,
        ConfidenceInterval confidenceInterval,
        String performanceLevel,
        double abilityPercentile,
        List<String> topicStrengths,
        List<String> topicWeaknesses,
        List<TopicScore> topicScores,
        int totalQuestions,
        int correctAnswers,
        double accuracy,
        Double averageDifficulty,
        ResponsePatterns responsePatterns,
        double responseConsistency,
        List<String> recommendedTopics,
        double recommendedDifficulty,
        List<Double> abilityHistory,
        StopReason stopReason,
        Instant completedAt
) {

    public AdaptiveTestReport {
        topicStrengths = topicStrengths == null ? List.of() : List.copyOf(topicStrengths);
        topicWeaknesses = topicWeaknesses == null ? List.of() : List.copyOf(topicWeaknesses);
        topicScores = topicScores == null ? List.of() : List.copyOf(topicScores);
        recommendedTopics = recommendedTopics == null ? List.of() : List.copyOf(recommendedTopics);
        abilityHistory = abilityHistory == null ? List.of() : List.copyOf(abilityHistory);
    }
}
