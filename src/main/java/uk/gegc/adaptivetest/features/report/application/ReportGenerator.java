package uk.gegc.adaptivetest.features.report.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.application.ItemResponseModel;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.QuestionPool;
import uk.gegc.adaptivetest.features.report.domain.model.AdaptiveTestReport;
import uk.gegc.adaptivetest.features.report.domain.model.ConfidenceInterval;
import uk.gegc.adaptivetest.features.report.domain.model.ResponsePatterns;
import uk.gegc.adaptivetest.features.report.domain.model.TopicScore;
import uk.gegc.adaptivetest.features.report.domain.model.Trend;
import uk.gegc.adaptivetest.features.session.domain.model.AdaptiveSession;
import uk.gegc.adaptivetest.features.session.domain.model.ItemResponse;
import uk.gegc.adaptivetest.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivetest.shared.config.AdaptiveTestingProperties;
import uk.gegc.adaptivetest.shared.exception.SessionNotCompletedException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the report of a completed session. Output depends only on the session, the pool's
 * item parameters and configuration, so generating twice gives equal reports.
 */
@Component
@RequiredArgsConstructor
public class ReportGenerator {

    private static final int MIN_RESPONSES_FOR_PATTERNS = 3;
    private static final int MIN_TIMED_RESPONSES_FOR_TREND = 4;
    private static final int ACCURACY_WINDOW = 3;
    private static final double ACCURACY_TREND_MARGIN = 0.2;
    private static final double DIFFICULTY_TREND_MARGIN = 0.3;
    private static final double RESPONSE_TIME_SLOPE_MARGIN = 1.0;
    private static final int MIN_RESPONSES_FOR_CONSISTENCY = 5;
    private static final double[][] CONSISTENCY_BANDS = {{-3, -1}, {-1, 1}, {1, 3}};

    private final ItemResponseModel responseModel;
    private final AdaptiveTestingProperties properties;

    public AdaptiveTestReport generate(AdaptiveSession session, QuestionPool pool) {
        if (session.status() != SessionStatus.COMPLETED) {
            throw new SessionNotCompletedException(session.id());
        }
        AdaptiveTestingProperties.Report config = properties.getReport();
        AdaptiveTestingProperties.Estimation bounds = properties.getEstimation();
        double theta = session.theta();
        double se = session.standardError();
        List<ItemResponse> responses = session.responses();

        List<TopicScore> topicScores = topicScores(responses, pool, theta);
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        for (TopicScore score : topicScores) {
            if (score.accuracy() >= config.getStrengthThreshold()) {
                strengths.add(score.topic());
            } else if (score.accuracy() < config.getWeaknessThreshold()) {
                weaknesses.add(score.topic());
            }
        }
        List<String> recommended = topicScores.stream()
                .filter(s -> weaknesses.contains(s.topic()))
                .sorted(Comparator.comparingDouble(TopicScore::accuracy))
                .limit(config.getRecommendedTopicLimit())
                .map(TopicScore::topic)
                .toList();

        int total = responses.size();
        int correct = (int) session.correctAnswers();
        Double averageDifficulty = total == 0 ? null
                : responses.stream().mapToDouble(ItemResponse::difficulty).average().orElse(0.0);

        double z = config.getConfidenceZ();
        ConfidenceInterval interval = new ConfidenceInterval(
                Math.max(bounds.getMinTheta(), theta - z * se),
                Math.min(bounds.getMaxTheta(), theta + z * se),
                z);

        return AdaptiveTestReport.builder()
                .sessionId(session.id())
                .poolId(session.poolId())
                .examineeId(session.examineeId())
                .finalTheta(theta)
                .finalStandardError(se)
                .confidenceInterval(interval)
                .performanceLevel(performanceLevel(theta, config.getPerformanceLevels()))
                .abilityPercentile(Math.round(StandardNormal.cdf(theta) * 1000.0) / 10.0)
                .topicStrengths(strengths)
                .topicWeaknesses(weaknesses)
                .topicScores(topicScores)
                .totalQuestions(total)
                .correctAnswers(correct)
                .accuracy(total == 0 ? 0.0 : (double) correct / total)
                .averageDifficulty(averageDifficulty)
                .responsePatterns(responsePatterns(responses))
                .responseConsistency(consistency(responses, pool))
                .recommendedTopics(recommended)
                .recommendedDifficulty(Math.max(bounds.getMinTheta(),
                        Math.min(bounds.getMaxTheta(), theta + config.getRecommendedDifficultyOffset())))
                .abilityHistory(session.abilityHistory())
                .stopReason(session.stopReason())
                .completedAt(session.endedAt())
                .build();
    }

    /**
     * Band whose lower bound is the highest one not above theta; a band without a bound is the floor.
     */
    String performanceLevel(double theta, List<AdaptiveTestingProperties.PerformanceLevel> levels) {
        AdaptiveTestingProperties.PerformanceLevel chosen = null;
        for (AdaptiveTestingProperties.PerformanceLevel level : levels) {
            double min = level.getMinTheta() == null ? Double.NEGATIVE_INFINITY : level.getMinTheta();
            if (theta < min) {
                continue;
            }
            if (chosen == null || min > lowerBound(chosen)) {
                chosen = level;
            }
        }
        return chosen == null ? levels.get(0).getName() : chosen.getName();
    }

    private static double lowerBound(AdaptiveTestingProperties.PerformanceLevel level) {
        return level.getMinTheta() == null ? Double.NEGATIVE_INFINITY : level.getMinTheta();
    }

    private List<TopicScore> topicScores(List<ItemResponse> responses, QuestionPool pool, double theta) {
        Map<String, List<ItemResponse>> byTopic = new LinkedHashMap<>();
        responses.forEach(r -> byTopic.computeIfAbsent(r.topic(), t -> new ArrayList<>()).add(r));

        List<TopicScore> scores = new ArrayList<>();
        byTopic.forEach((topic, topicResponses) -> {
            int administered = topicResponses.size();
            int correct = (int) topicResponses.stream().filter(ItemResponse::correct).count();
            double averageDifficulty = topicResponses.stream().mapToDouble(ItemResponse::difficulty).average().orElse(0.0);
            double information = topicResponses.stream()
                    .mapToDouble(r -> responseModel.information(theta, pool.getItem(r.itemId())))
                    .sum();
            scores.add(new TopicScore(topic, administered, correct, (double) correct / administered,
                    averageDifficulty, information));
        });
        return scores;
    }

    private ResponsePatterns responsePatterns(List<ItemResponse> responses) {
        if (responses.size() < MIN_RESPONSES_FOR_PATTERNS) {
            return ResponsePatterns.insufficientData();
        }

        Trend timeTrend = null;
        List<Double> times = responses.stream()
                .map(ItemResponse::responseTimeSeconds)
                .filter(Objects::nonNull)
                .toList();
        if (times.size() >= MIN_TIMED_RESPONSES_FOR_TREND) {
            double slope = (times.get(times.size() - 1) - times.get(0)) / (times.size() - 1);
            timeTrend = trend(slope, RESPONSE_TIME_SLOPE_MARGIN);
        }

        double firstWindow = windowAccuracy(responses, 0);
        double lastWindow = windowAccuracy(responses, responses.size() - ACCURACY_WINDOW);
        Trend accuracyTrend = trend(lastWindow - firstWindow, ACCURACY_TREND_MARGIN);

        int half = responses.size() / 2;
        double firstHalf = responses.subList(0, half).stream().mapToDouble(ItemResponse::difficulty).average().orElse(0.0);
        double secondHalf = responses.subList(half, responses.size()).stream().mapToDouble(ItemResponse::difficulty).average().orElse(0.0);
        Trend difficultyTrend = trend(secondHalf - firstHalf, DIFFICULTY_TREND_MARGIN);

        return new ResponsePatterns(timeTrend, accuracyTrend, difficultyTrend);
    }

    private static double windowAccuracy(List<ItemResponse> responses, int from) {
        long correct = responses.subList(from, from + ACCURACY_WINDOW).stream().filter(ItemResponse::correct).count();
        return (double) correct / ACCURACY_WINDOW;
    }

    private static Trend trend(double change, double margin) {
        if (change > margin) {
            return Trend.INCREASING;
        }
        if (change < -margin) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    /**
     * Mean over difficulty bands of 1 - |observed accuracy - expected accuracy|, where expected
     * accuracy uses the ability held just before each response.
     */
    private double consistency(List<ItemResponse> responses, QuestionPool pool) {
        if (responses.size() < MIN_RESPONSES_FOR_CONSISTENCY) {
            return 1.0;
        }
        List<Double> bandScores = new ArrayList<>();
        for (double[] band : CONSISTENCY_BANDS) {
            List<ItemResponse> inBand = responses.stream()
                    .filter(r -> r.difficulty() >= band[0] && r.difficulty() <= band[1])
                    .toList();
            if (inBand.size() < 2) {
                continue;
            }
            double observed = (double) inBand.stream().filter(ItemResponse::correct).count() / inBand.size();
            double expected = inBand.stream()
                    .mapToDouble(r -> {
                        Item item = pool.getItem(r.itemId());
                        return responseModel.probability(r.thetaBefore(), item);
                    })
                    .average()
                    .orElse(0.0);
            bandScores.add(1.0 - Math.abs(observed - expected));
        }
        return bandScores.stream().mapToDouble(Double::doubleValue).average().orElse(1.0);
    }
}
