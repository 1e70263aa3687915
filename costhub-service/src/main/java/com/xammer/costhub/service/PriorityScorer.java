package com.xammer.costhub.service;

import com.xammer.costhub.domain.ConfidenceLevel;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.ImplementationEffort;
import com.xammer.costhub.domain.PriorityLevel;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Composite score out of 160: financial impact relative to the batch average (up to 100),
 * effort (10-30), confidence (10-20) and breadth of affected resources (up to 10).
 * Scores only compare within one batch.
 */
@Component
public class PriorityScorer {

    public void score(List<CostRecommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return;
        }
        // Summed in sorted order so the average does not depend on list order.
        double total = recommendations.stream()
                .mapToDouble(CostRecommendation::getMonthlySavings)
                .sorted()
                .reduce(0.0, Double::sum);
        double average = total / recommendations.size();
        double denominator = Math.max(average, 1.0);

        for (CostRecommendation rec : recommendations) {
            double score = Math.round(scoreOf(rec, denominator) * 100.0) / 100.0;
            rec.setPriorityScore(score);
            rec.setPriorityLevel(PriorityLevel.fromScore(score));
        }
    }

    static double scoreOf(CostRecommendation rec, double averageSavings) {
        double financial = Math.min(100.0, rec.getMonthlySavings() / averageSavings * 40.0);
        ImplementationEffort effort = rec.getImplementationEffort() == null
                ? ImplementationEffort.MEDIUM : rec.getImplementationEffort();
        ConfidenceLevel confidence = rec.getConfidenceLevel() == null
                ? ConfidenceLevel.MEDIUM : rec.getConfidenceLevel();
        int resourceCount = rec.getAffectedResources() == null ? 0 : rec.getAffectedResources().size();
        double resource = Math.min(10, resourceCount * 2);
        return Math.max(0.0, financial) + effort.getScore() + confidence.getScore() + resource;
    }
}
