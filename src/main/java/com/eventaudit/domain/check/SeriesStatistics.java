package com.eventaudit.domain.check;

import java.time.LocalDate;
import java.util.List;

/**
 * Small numeric helpers shared by the checks.
 */
final class SeriesStatistics {

    private SeriesStatistics() {
    }

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n - 1). Zero for fewer than two values.
     */
    static double stddev(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double var = 0.0;
        for (double v : values) {
            double d = v - mean;
            var += d * d;
        }
        return Math.sqrt(var / (n - 1));
    }

    /**
     * Least-squares slope of {@code values} per calendar day. Gaps in
     * {@code dates} widen the x distance; nothing is interpolated.
     */
    static double slopePerDay(List<LocalDate> dates, List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double meanX = 0.0;
        for (LocalDate date : dates) {
            meanX += date.toEpochDay();
        }
        meanX /= n;
        double meanY = mean(values);

        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = dates.get(i).toEpochDay() - meanX;
            num += dx * (values.get(i) - meanY);
            den += dx * dx;
        }
        return den == 0.0 ? 0.0 : num / den;
    }
}
