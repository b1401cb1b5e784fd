package com.phillippitts.agentgovernor.service.evaluation;

import java.util.Collection;

/**
 * Descriptive statistics over small metric populations.
 *
 * <p>Standard deviation is the population form (divides by n, not n-1).
 */
public final class Statistics {

    private Statistics() {}

    /** Arithmetic mean; 0 for an empty population. */
    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Population standard deviation; 0 for an empty population. */
    public static double standardDeviation(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double avg = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - avg) * (v - avg);
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * Whether {@code value} lies more than {@code zThreshold} standard deviations from the
     * population mean.
     *
     * @return false when the population has fewer than two values or no spread
     */
    public static boolean isOutlier(double value, Collection<Double> population, double zThreshold) {
        if (population.size() < 2) {
            return false;
        }
        double stdDev = standardDeviation(population);
        if (stdDev == 0.0) {
            return false;
        }
        double z = Math.abs((value - mean(population)) / stdDev);
        return z > zThreshold;
    }
}
