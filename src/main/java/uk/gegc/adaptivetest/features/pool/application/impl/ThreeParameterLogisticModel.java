package uk.gegc.adaptivetest.features.pool.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.application.ItemResponseModel;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;

/**
 * 3PL model: P(theta) = c + (1 - c) / (1 + exp(-a (theta - b))).
 */
@Component
public class ThreeParameterLogisticModel implements ItemResponseModel {

    @Override
    public double probability(double theta, Item item) {
        double a = item.discrimination();
        double b = item.difficulty();
        double c = item.guessing();
        return c + (1 - c) / (1 + Math.exp(-a * (theta - b)));
    }

    @Override
    public double information(double theta, Item item) {
        double p = probability(theta, item);
        if (p <= 0 || p >= 1) {
            return 0.0;
        }
        double a = item.discrimination();
        double c = item.guessing();
        double scaled = (p - c) / (1 - c);
        if (scaled == 0.0) {
            return 0.0;
        }
        return a * a * scaled * scaled * (1 - p) / p;
    }
}
