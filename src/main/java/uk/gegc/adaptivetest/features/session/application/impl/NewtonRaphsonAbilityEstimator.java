package uk.gegc.adaptivetest.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.application.ItemResponseModel;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.session.application.AbilityEstimator;
import uk.gegc.adaptivetest.shared.config.AdaptiveTestingProperties;
import uk.gegc.adaptivetest.shared.exception.EstimationDivergenceException;

import java.util.List;

/**
 * Maximum likelihood ability estimation by Fisher scoring, with a fixed-step fallback
 * while the response pattern is all-correct or all-incorrect.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NewtonRaphsonAbilityEstimator implements AbilityEstimator {

    // keeps the step finite when the administered items carry almost no information at theta
    private static final double MIN_INFORMATION = 1e-6;

    private final ItemResponseModel responseModel;
    private final AdaptiveTestingProperties properties;

    @Override
    public Estimate estimate(double priorTheta, List<ScoredItem> history) {
        AdaptiveTestingProperties.Estimation config = properties.getEstimation();
        double start = clamp(priorTheta, config);
        if (history.isEmpty()) {
            return new Estimate(start, Double.POSITIVE_INFINITY, Method.PRIOR, 0);
        }

        List<Item> items = history.stream().map(ScoredItem::item).toList();
        boolean anyCorrect = history.stream().anyMatch(ScoredItem::correct);
        boolean anyIncorrect = history.stream().anyMatch(s -> !s.correct());

        Estimate estimate;
        if (anyCorrect && anyIncorrect) {
            estimate = maximumLikelihood(start, history, config);
        } else {
            boolean lastCorrect = history.get(history.size() - 1).correct();
            double step = lastCorrect ? config.getDegenerateStep() : -config.getDegenerateStep();
            double theta = clamp(start + step, config);
            estimate = new Estimate(theta, standardError(theta, items), Method.DEGENERATE_STEP, 0);
        }

        if (!Double.isFinite(estimate.theta()) || Double.isNaN(estimate.standardError())) {
            throw new EstimationDivergenceException("Ability estimate diverged: theta=" + estimate.theta()
                    + ", se=" + estimate.standardError() + " after " + history.size() + " responses");
        }
        log.debug("Estimated theta={} se={} via {} in {} iterations from {} responses",
                estimate.theta(), estimate.standardError(), estimate.method(), estimate.iterations(), history.size());
        return estimate;
    }

    @Override
    public double standardError(double theta, List<Item> items) {
        double total = totalInformation(theta, items);
        return total > 0 ? Math.sqrt(1.0 / total) : Double.POSITIVE_INFINITY;
    }

    private Estimate maximumLikelihood(double start, List<ScoredItem> history, AdaptiveTestingProperties.Estimation config) {
        double theta = start;
        int iterations = 0;
        while (iterations < config.getMaxIterations()) {
            iterations++;
            double score = 0.0;
            double information = 0.0;
            for (ScoredItem scored : history) {
                Item item = scored.item();
                double p = responseModel.probability(theta, item);
                double r = scored.correct() ? 1.0 : 0.0;
                score += item.discrimination() * (r - p) * guessingWeight(theta, item);
                information += responseModel.information(theta, item);
            }
            double next = clamp(theta + score / Math.max(information, MIN_INFORMATION), config);
            double change = Math.abs(next - theta);
            theta = next;
            if (change < config.getTolerance()) {
                break;
            }
        }
        List<Item> items = history.stream().map(ScoredItem::item).toList();
        return new Estimate(theta, standardError(theta, items), Method.MAXIMUM_LIKELIHOOD, iterations);
    }

    /**
     * (p - c) / (p (1 - c)) rewritten as L / (c + (1 - c) L) with L the logistic part, so an
     * underflowing probability gives 0 or 1 instead of 0/0.
     */
    private static double guessingWeight(double theta, Item item) {
        double c = item.guessing();
        if (c == 0.0) {
            return 1.0;
        }
        double logistic = 1.0 / (1.0 + Math.exp(-item.discrimination() * (theta - item.difficulty())));
        return logistic / (c + (1 - c) * logistic);
    }

    private double totalInformation(double theta, List<Item> items) {
        double total = 0.0;
        for (Item item : items) {
            total += responseModel.information(theta, item);
        }
        return total;
    }

    private static double clamp(double theta, AdaptiveTestingProperties.Estimation config) {
        if (Double.isNaN(theta)) {
            throw new EstimationDivergenceException("Ability estimate is not a number");
        }
        return Math.max(config.getMinTheta(), Math.min(config.getMaxTheta(), theta));
    }
}
