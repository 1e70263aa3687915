package com.xammer.costhub.service;

import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.PriorityLevel;
import com.xammer.costhub.dto.Anomaly;
import com.xammer.costhub.dto.AnomalyReport;
import com.xammer.costhub.dto.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Flags suspicious savings figures for an operator to double check. Nothing is filtered out.
 * <p>
 * Extreme values are measured against the mean and sample deviation of the other records in the
 * batch (leave-one-out), with the deviation floored at a tenth of that mean. The remaining rules use
 * the batch mean.
 */
@Component
public class AnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    static final int MIN_BATCH_SIZE = 3;
    static final double EXTREME_SIGMA = 3.0;
    /** Floor for the deviation, as a share of the others' mean. */
    static final double MIN_RELATIVE_DEVIATION = 0.1;
    static final double ROUND_NUMBER_FLOOR = 1000.0;
    static final double VERY_LOW_THRESHOLD = 1.0;
    private static final double EPSILON = 1e-9;

    public AnomalyReport detect(List<CostRecommendation> recommendations) {
        if (recommendations.size() < MIN_BATCH_SIZE) {
            return AnomalyReport.notAnalyzed();
        }
        double[] values = recommendations.stream().mapToDouble(CostRecommendation::getMonthlySavings).toArray();
        double mean = mean(values);
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = 0; i < values.length; i++) {
            CostRecommendation rec = recommendations.get(i);
            double value = values[i];

            double[] others = withoutIndex(values, i);
            double othersMean = mean(others);
            double othersDeviation = sampleStandardDeviation(others, othersMean);
            double distance = Math.abs(value - othersMean);
            double spread = Math.max(othersDeviation, MIN_RELATIVE_DEVIATION * Math.abs(othersMean));
            if (distance > EXTREME_SIGMA * spread + EPSILON) {
                anomalies.add(new Anomaly(rec.getId(), AnomalyType.EXTREME_SAVINGS, value,
                        String.format(Locale.ROOT, "Savings of $%.2f deviate from the rest of the batch (mean $%.2f, stdev $%.2f)",
                                value, othersMean, othersDeviation)));
            }
            if (value >= ROUND_NUMBER_FLOOR && value % 100 == 0) {
                anomalies.add(new Anomaly(rec.getId(), AnomalyType.ROUND_NUMBER_ESTIMATE, value,
                        String.format(Locale.ROOT, "Savings of $%.2f look like a rounded estimate", value)));
            }
            if (value < VERY_LOW_THRESHOLD) {
                anomalies.add(new Anomaly(rec.getId(), AnomalyType.VERY_LOW_SAVINGS, value,
                        String.format(Locale.ROOT, "Savings of $%.2f per month may not justify the change", value)));
            }
            if (rec.getPriorityLevel() == PriorityLevel.HIGH && value < 0.5 * mean) {
                anomalies.add(new Anomaly(rec.getId(), AnomalyType.PRIORITY_SAVINGS_MISMATCH, value,
                        String.format(Locale.ROOT, "High priority despite savings below half the batch mean ($%.2f)", mean)));
            }
        }

        if (!anomalies.isEmpty()) {
            logger.info("Detected {} anomalies across {} recommendations", anomalies.size(), values.length);
        }
        return AnomalyReport.builder()
                .analyzed(true)
                .mean(round2(mean))
                .median(round2(median(values)))
                .standardDeviation(round2(sampleStandardDeviation(values, mean)))
                .anomalies(anomalies)
                .build();
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    static double sampleStandardDeviation(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    private static double[] withoutIndex(double[] values, int skip) {
        double[] out = new double[values.length - 1];
        for (int i = 0, j = 0; i < values.length; i++) {
            if (i != skip) {
                out[j++] = values[i];
            }
        }
        return out;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
