package com.xammer.costhub.service;

import com.xammer.costhub.domain.Category;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.ImplementationEffort;
import com.xammer.costhub.domain.PriorityLevel;
import com.xammer.costhub.dto.ExecutiveSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class ExecutiveSummaryGenerator {

    static final int TOP_CATEGORY_LIMIT = 5;

    public ExecutiveSummary generate(List<CostRecommendation> recommendations, Instant dataFreshness) {
        if (recommendations.isEmpty()) {
            return ExecutiveSummary.empty(dataFreshness);
        }
        double monthly = 0.0;
        double annual = 0.0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (CostRecommendation rec : recommendations) {
            monthly += rec.getMonthlySavings();
            annual += rec.getAnnualSavings();
            if (rec.getPriorityLevel() == PriorityLevel.HIGH) {
                high++;
            } else if (rec.getPriorityLevel() == PriorityLevel.MEDIUM) {
                medium++;
            } else {
                low++;
            }
        }
        return ExecutiveSummary.builder()
                .totalRecommendations(recommendations.size())
                .totalMonthlySavings(round2(monthly))
                .totalAnnualSavings(round2(annual))
                .highPriorityCount(high)
                .mediumPriorityCount(medium)
                .lowPriorityCount(low)
                .topCategories(topCategories(recommendations))
                .implementationRoadmap(roadmap(recommendations))
                .dataFreshness(dataFreshness)
                .build();
    }

    private List<ExecutiveSummary.CategorySavings> topCategories(List<CostRecommendation> recommendations) {
        Map<Category, double[]> totals = new EnumMap<>(Category.class);
        for (CostRecommendation rec : recommendations) {
            Category category = rec.getCategory() == null ? Category.GENERAL : rec.getCategory();
            double[] acc = totals.computeIfAbsent(category, c -> new double[2]);
            acc[0] += rec.getMonthlySavings();
            acc[1]++;
        }
        return totals.entrySet().stream()
                .map(e -> new ExecutiveSummary.CategorySavings(e.getKey(), round2(e.getValue()[0]), (int) e.getValue()[1]))
                .sorted(Comparator.comparingDouble(ExecutiveSummary.CategorySavings::getSavings).reversed()
                        .thenComparing(c -> c.getCategory().getWireName()))
                .limit(TOP_CATEGORY_LIMIT)
                .collect(Collectors.toList());
    }

    private List<ExecutiveSummary.RoadmapPhase> roadmap(List<CostRecommendation> recommendations) {
        List<CostRecommendation> quickWins = new ArrayList<>();
        List<CostRecommendation> highImpact = new ArrayList<>();
        List<CostRecommendation> strategic = new ArrayList<>();
        for (CostRecommendation rec : recommendations) {
            if (rec.getPriorityLevel() == PriorityLevel.HIGH && rec.getImplementationEffort() == ImplementationEffort.LOW) {
                quickWins.add(rec);
            } else if (rec.getPriorityLevel() == PriorityLevel.HIGH
                    && rec.getImplementationEffort() == ImplementationEffort.MEDIUM) {
                highImpact.add(rec);
            } else {
                strategic.add(rec);
            }
        }
        List<ExecutiveSummary.RoadmapPhase> phases = new ArrayList<>();
        addPhase(phases, "Phase 1: Quick Wins", "0-30 days",
                "High-priority changes with low implementation effort", quickWins);
        addPhase(phases, "Phase 2: High Impact", "1-3 months",
                "High-priority changes that need moderate effort and planning", highImpact);
        addPhase(phases, "Phase 3: Strategic", "3-6 months",
                "Remaining opportunities for longer-term optimization work", strategic);
        return phases;
    }

    private void addPhase(List<ExecutiveSummary.RoadmapPhase> phases, String name, String timeframe,
                          String description, List<CostRecommendation> members) {
        if (members.isEmpty()) {
            return;
        }
        phases.add(ExecutiveSummary.RoadmapPhase.builder()
                .phase(name)
                .timeframe(timeframe)
                .count(members.size())
                .totalSavings(round2(members.stream().mapToDouble(CostRecommendation::getMonthlySavings).sum()))
                .description(description)
                .recommendationIds(members.stream().map(CostRecommendation::getId).collect(Collectors.toList()))
                .build());
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
