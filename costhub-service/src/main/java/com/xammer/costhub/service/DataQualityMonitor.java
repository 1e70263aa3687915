package com.xammer.costhub.service;

import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.dto.DataQuality;
import com.xammer.costhub.dto.DataQualityStatus;
import com.xammer.costhub.dto.MonitoringReport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch-level health figures: where recommendations came from, how savings are spread and how
 * old the data is.
 */
@Component
public class DataQualityMonitor {

    private final Clock clock;

    public DataQualityMonitor(Clock clock) {
        this.clock = clock;
    }

    public MonitoringReport analyze(List<CostRecommendation> recommendations, Instant collectedAt) {
        Map<String, Integer> sources = new LinkedHashMap<>();
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (CostRecommendation rec : recommendations) {
            if (rec.getSource() != null) {
                sources.merge(rec.getSource().getWireName(), 1, Integer::sum);
            }
            if (rec.getCategory() != null) {
                categories.merge(rec.getCategory().getWireName(), 1, Integer::sum);
            }
        }
        double ageMinutes = collectedAt == null ? 0.0
                : Math.max(0.0, Duration.between(collectedAt, clock.instant()).toMillis() / 60000.0);
        return MonitoringReport.builder()
                .sourceDistribution(sources)
                .categoryDistribution(categories)
                .savingsStatistics(savingsStatistics(recommendations))
                .freshnessScore(freshnessScore(ageMinutes))
                .dataAgeMinutes(Math.round(ageMinutes * 100.0) / 100.0)
                .build();
    }

    /**
     * Completeness is the share of sources that answered; reliability loses 0.1 per error message.
     */
    public DataQuality assess(List<RecommendationSource> availableSources, int totalSources,
                              int totalRecommendations, int errorCount) {
        double completeness = totalSources == 0 ? 0.0 : (double) availableSources.size() / totalSources;
        double reliability = Math.max(0.0, 1.0 - 0.1 * errorCount);
        return DataQuality.builder()
                .status(DataQualityStatus.of(completeness, reliability))
                .completeness(Math.round(completeness * 100.0) / 100.0)
                .reliability(Math.round(reliability * 100.0) / 100.0)
                .availableSources(availableSources)
                .totalRecommendations(totalRecommendations)
                .errorCount(errorCount)
                .build();
    }

    /**
     * 1.0 below five minutes, linear down to 0.5 at thirty minutes and to 0 at two hours.
     */
    static double freshnessScore(double ageMinutes) {
        if (ageMinutes < 5) {
            return 1.0;
        }
        if (ageMinutes <= 30) {
            return 1.0 - 0.5 * (ageMinutes - 5) / 25.0;
        }
        if (ageMinutes <= 120) {
            return 0.5 - 0.5 * (ageMinutes - 30) / 90.0;
        }
        return 0.0;
    }

    private static MonitoringReport.SavingsStatistics savingsStatistics(List<CostRecommendation> recommendations) {
        double[] values = recommendations.stream().mapToDouble(CostRecommendation::getMonthlySavings).toArray();
        if (values.length == 0) {
            return MonitoringReport.SavingsStatistics.builder().build();
        }
        double total = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            total += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return MonitoringReport.SavingsStatistics.builder()
                .count(values.length)
                .total(ExecutiveSummaryGenerator.round2(total))
                .mean(ExecutiveSummaryGenerator.round2(total / values.length))
                .median(ExecutiveSummaryGenerator.round2(AnomalyDetector.median(values)))
                .min(min)
                .max(max)
                .build();
    }
}
