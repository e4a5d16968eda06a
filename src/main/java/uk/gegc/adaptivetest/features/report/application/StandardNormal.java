package uk.gegc.adaptivetest.features.report.application;

/**
 * Standard normal distribution helpers.
 */
public final class StandardNormal {

    private StandardNormal() {
    }

    /**
     * Cumulative distribution function, accurate to about 1e-7.
     */
    public static double cdf(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        return 0.5 * erfc(-x / Math.sqrt(2.0));
    }

    // Chebyshev fit of the complementary error function (Numerical Recipes, erfcc)
    static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1.0 / (1.0 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196 + t * (0.09678418
                + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398 + t * (1.48851587
                + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2.0 - ans;
    }
}
