package com.xammer.costhub.service;

import com.xammer.costhub.domain.AffectedResource;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.PriorityLevel;
import com.xammer.costhub.domain.SecurityFinding;
import com.xammer.costhub.domain.Severity;
import com.xammer.costhub.dto.CrossReferenceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Correlates cost recommendations with externally supplied security findings that touch the same
 * resources. Missing or empty finding input yields an empty report.
 */
@Component
public class CrossReferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(CrossReferenceEngine.class);

    static final double COST_WEIGHT = 0.4;
    static final double SECURITY_WEIGHT = 0.6;

    private static final List<ConflictPattern> CONFLICT_PATTERNS = List.of(
            new ConflictPattern("encryption",
                    List.of("unencrypted", "standard", "basic"),
                    List.of("encryption", "kms", "ssl", "tls"),
                    "Cost optimization may weaken encryption on this resource"),
            new ConflictPattern("monitoring",
                    List.of("disable", "reduce", "minimal"),
                    List.of("logging", "monitoring", "cloudtrail", "cloudwatch"),
                    "Cost reduction may reduce security monitoring coverage"),
            new ConflictPattern("access_control",
                    List.of("public", "open", "unrestricted"),
                    List.of("iam", "policy", "access", "permission"),
                    "Cost optimization may change access controls")
    );

    private static final List<ComplementaryPattern> COMPLEMENTARY_PATTERNS = List.of(
            new ComplementaryPattern("rightsizing",
                    List.of("instance", "size", "utilization", "capacity"),
                    List.of("Lower instance costs", "Better resource utilization"),
                    List.of("Smaller attack surface", "Fewer exposed resources"),
                    List.of("Right-size instances", "Remove unused resources", "Tighten configurations")),
            new ComplementaryPattern("automation",
                    List.of("manual", "automate", "script", "process"),
                    List.of("Less operational overhead", "Fewer manual processes"),
                    List.of("Consistently applied security policies", "Less room for human error"),
                    List.of("Adopt infrastructure as code", "Automate security policies", "Prefer managed services")),
            new ComplementaryPattern("consolidation",
                    List.of("multiple", "separate", "consolidate", "centralize"),
                    List.of("Lower licensing costs", "Higher resource efficiency"),
                    List.of("Centralized security management", "Consistent policies"),
                    List.of("Consolidate accounts", "Centralize logging", "Standardize configurations"))
    );

    static final List<String> IMPLEMENTATION_ORDER = List.of(
            "1. Assess the current security posture of the resource",
            "2. Fix high-priority security findings",
            "3. Apply the cost optimization with security validation",
            "4. Monitor cost and security outcomes together"
    );

    public CrossReferenceReport crossReference(List<CostRecommendation> recommendations,
                                               Map<String, List<SecurityFinding>> findingsByService) {
        int recommendationCount = recommendations == null ? 0 : recommendations.size();
        if (findingsByService == null || findingsByService.isEmpty() || recommendationCount == 0) {
            return CrossReferenceReport.empty(recommendationCount);
        }

        Map<String, List<IndexedFinding>> findingsByResource = new LinkedHashMap<>();
        int totalFindings = 0;
        for (Map.Entry<String, List<SecurityFinding>> entry : findingsByService.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            int index = 0;
            for (SecurityFinding finding : entry.getValue()) {
                if (finding == null) {
                    continue;
                }
                String findingId = finding.getId() != null && !finding.getId().isBlank()
                        ? finding.getId() : entry.getKey() + "#" + index;
                IndexedFinding indexed = new IndexedFinding(entry.getKey(), findingId, finding);
                for (String resourceId : finding.allResourceIds()) {
                    findingsByResource.computeIfAbsent(resourceId, k -> new ArrayList<>()).add(indexed);
                }
                totalFindings++;
                index++;
            }
        }

        CrossReferenceReport report = CrossReferenceReport.builder().build();
        Map<String, List<CostRecommendation>> recsByResource = new LinkedHashMap<>();
        Map<String, Set<IndexedFinding>> overlapFindings = new LinkedHashMap<>();

        for (CostRecommendation rec : recommendations) {
            Set<IndexedFinding> overlapping = new LinkedHashSet<>();
            for (String resourceId : resourceIds(rec)) {
                List<IndexedFinding> matches = findingsByResource.get(resourceId);
                if (matches == null) {
                    continue;
                }
                overlapping.addAll(matches);
                recsByResource.computeIfAbsent(resourceId, k -> new ArrayList<>()).add(rec);
                overlapFindings.computeIfAbsent(resourceId, k -> new LinkedHashSet<>()).addAll(matches);
            }
            if (overlapping.isEmpty()) {
                continue;
            }
            List<IndexedFinding> related = new ArrayList<>(overlapping);
            report.getIntegratedRecommendations().add(integrate(rec, related));
            report.getCostSecurityConflicts().addAll(conflicts(rec, related));
            report.getComplementaryActions().addAll(complementary(rec, related));
        }

        for (Map.Entry<String, List<CostRecommendation>> entry : recsByResource.entrySet()) {
            String resourceId = entry.getKey();
            List<CostRecommendation> recs = entry.getValue();
            List<IndexedFinding> findings = new ArrayList<>(overlapFindings.get(resourceId));
            report.getResourceOverlapAnalysis().put(resourceId, new CrossReferenceReport.ResourceOverlap(
                    recs.stream().map(CostRecommendation::getId).collect(Collectors.toList()),
                    findings.stream().map(IndexedFinding::getId).collect(Collectors.toList()),
                    round2(recs.stream().mapToDouble(CostRecommendation::getMonthlySavings).sum()),
                    maxSeverity(findings)));
            report.getUnifiedActionPlans().add(unifiedPlan(resourceId, recs, findings));
        }

        report.setSummary(new CrossReferenceReport.Summary(
                recommendationCount,
                totalFindings,
                report.getResourceOverlapAnalysis().size(),
                report.getIntegratedRecommendations().size(),
                report.getCostSecurityConflicts().size(),
                report.getComplementaryActions().size()));
        logger.info("Cross-reference: {} recommendations, {} findings, {} overlapping resources, {} conflicts",
                recommendationCount, totalFindings, report.getResourceOverlapAnalysis().size(),
                report.getCostSecurityConflicts().size());
        return report;
    }

    private CrossReferenceReport.IntegratedRecommendation integrate(CostRecommendation rec, List<IndexedFinding> findings) {
        Severity severity = maxSeverity(findings);
        PriorityLevel costPriority = rec.getPriorityLevel() == null ? PriorityLevel.MEDIUM : rec.getPriorityLevel();
        double score = integratedScore(costPriority, severity);
        return CrossReferenceReport.IntegratedRecommendation.builder()
                .recommendationId("integrated_" + rec.getId())
                .costRecommendationId(rec.getId())
                .title("Integrated Optimization: " + rec.getTitle())
                .monthlySavings(rec.getMonthlySavings())
                .annualSavings(rec.getAnnualSavings())
                .costPriority(costPriority)
                .maxSeverity(severity)
                .affectedFindings(findings.size())
                .securityServices(findings.stream().map(IndexedFinding::getService).distinct().collect(Collectors.toList()))
                .integratedScore(score)
                .priority(integratedPriority(score))
                .integratedSteps(integratedSteps(rec))
                .affectedResources(rec.getAffectedResources() == null
                        ? new ArrayList<>() : new ArrayList<>(rec.getAffectedResources()))
                .build();
    }

    static double integratedScore(PriorityLevel costPriority, Severity severity) {
        return round2(costPriority.getWeight() * COST_WEIGHT + severity.getWeight() * SECURITY_WEIGHT);
    }

    static PriorityLevel integratedPriority(double score) {
        if (score >= 3) {
            return PriorityLevel.HIGH;
        }
        if (score >= 2) {
            return PriorityLevel.MEDIUM;
        }
        return PriorityLevel.LOW;
    }

    private List<String> integratedSteps(CostRecommendation rec) {
        List<String> steps = new ArrayList<>();
        steps.add("1. Review security implications and confirm compliance requirements");
        List<String> costSteps = rec.getImplementationSteps() == null ? List.of() : rec.getImplementationSteps();
        for (String step : costSteps) {
            steps.add((steps.size() + 1) + ". " + step + " (keep security policies in place)");
        }
        steps.add((steps.size() + 1) + ". Address the related security findings before implementation");
        steps.add((steps.size() + 1) + ". Validate security controls after the cost change");
        return steps;
    }

    private List<CrossReferenceReport.Conflict> conflicts(CostRecommendation rec, List<IndexedFinding> findings) {
        String costText = (nullToEmpty(rec.getTitle()) + " " + nullToEmpty(rec.getDescription()) + " "
                + String.join(" ", rec.getImplementationSteps() == null ? List.of() : rec.getImplementationSteps()))
                .toLowerCase(Locale.ROOT);
        List<CrossReferenceReport.Conflict> conflicts = new ArrayList<>();
        for (IndexedFinding indexed : findings) {
            String findingText = indexed.getFinding().searchableText();
            for (ConflictPattern pattern : CONFLICT_PATTERNS) {
                if (containsAny(costText, pattern.costKeywords) && containsAny(findingText, pattern.securityKeywords)) {
                    conflicts.add(new CrossReferenceReport.Conflict(pattern.name, rec.getId(), indexed.getId(),
                            pattern.description));
                }
            }
        }
        return conflicts;
    }

    private List<CrossReferenceReport.ComplementaryAction> complementary(CostRecommendation rec,
                                                                         List<IndexedFinding> findings) {
        String costText = (nullToEmpty(rec.getTitle()) + " " + nullToEmpty(rec.getDescription())).toLowerCase(Locale.ROOT);
        List<String> findingIds = findings.stream().map(IndexedFinding::getId).collect(Collectors.toList());
        List<CrossReferenceReport.ComplementaryAction> actions = new ArrayList<>();
        for (ComplementaryPattern pattern : COMPLEMENTARY_PATTERNS) {
            if (!containsAny(costText, pattern.keywords)) {
                continue;
            }
            actions.add(CrossReferenceReport.ComplementaryAction.builder()
                    .type(pattern.name)
                    .costRecommendationId(rec.getId())
                    .securityFindingIds(new ArrayList<>(findingIds))
                    .costBenefits(pattern.costBenefits)
                    .securityBenefits(pattern.securityBenefits)
                    .recommendedActions(pattern.actions)
                    .priority(rec.getPriorityLevel() == PriorityLevel.HIGH ? PriorityLevel.HIGH : PriorityLevel.MEDIUM)
                    .build());
        }
        return actions;
    }

    private CrossReferenceReport.UnifiedActionPlan unifiedPlan(String resourceId, List<CostRecommendation> recs,
                                                               List<IndexedFinding> findings) {
        double maxSavings = recs.stream().mapToDouble(CostRecommendation::getMonthlySavings).max().orElse(0.0);
        boolean highCostPriority = recs.stream().anyMatch(r -> r.getPriorityLevel() == PriorityLevel.HIGH);
        boolean criticalFinding = findings.stream()
                .anyMatch(f -> f.getFinding().getSeverity() == Severity.CRITICAL);

        String priority;
        if (criticalFinding || (highCostPriority && maxSavings > 500)) {
            priority = "critical";
        } else if (highCostPriority || maxSavings > 200) {
            priority = "high";
        } else {
            priority = "medium";
        }

        String approach;
        if (findings.size() > recs.size()) {
            approach = "Security first: resolve the security findings before making cost changes";
        } else if (recs.stream().anyMatch(r -> r.getMonthlySavings() > 1000)) {
            approach = "Balanced: apply the cost optimization with security validation at each step";
        } else {
            approach = "Cost first: optimize cost while keeping the security baseline intact";
        }

        Map<String, List<String>> mitigation = new LinkedHashMap<>();
        mitigation.put("pre_implementation", List.of(
                "Back up current configurations",
                "Document the security baseline",
                "Define rollback procedures"));
        mitigation.put("during_implementation", List.of(
                "Watch security metrics continuously",
                "Validate each change before moving on",
                "Keep an audit trail of every change"));
        mitigation.put("post_implementation", List.of(
                "Verify security controls are intact",
                "Confirm the savings show up in billing data",
                "Update documentation and runbooks"));

        return CrossReferenceReport.UnifiedActionPlan.builder()
                .resourceId(resourceId)
                .priority(priority)
                .totalMonthlySavings(round2(recs.stream().mapToDouble(CostRecommendation::getMonthlySavings).sum()))
                .costRecommendationsCount(recs.size())
                .securityFindingsCount(findings.size())
                .recommendedApproach(approach)
                .implementationOrder(IMPLEMENTATION_ORDER)
                .riskMitigation(mitigation)
                .build();
    }

    private static Set<String> resourceIds(CostRecommendation rec) {
        Set<String> ids = new LinkedHashSet<>();
        if (rec.getAffectedResources() != null) {
            for (AffectedResource resource : rec.getAffectedResources()) {
                if (resource != null && resource.getId() != null && !resource.getId().isBlank()) {
                    ids.add(resource.getId());
                }
            }
        }
        return ids;
    }

    private static Severity maxSeverity(List<IndexedFinding> findings) {
        Severity max = Severity.LOW;
        for (IndexedFinding finding : findings) {
            Severity severity = finding.getFinding().getSeverity();
            if (severity != null && severity.getWeight() > max.getWeight()) {
                max = severity;
            }
        }
        return max;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class IndexedFinding {
        private final String service;
        private final String id;
        private final SecurityFinding finding;

        IndexedFinding(String service, String id, SecurityFinding finding) {
            this.service = service;
            this.id = id;
            this.finding = finding;
        }

        String getService() {
            return service;
        }

        String getId() {
            return id;
        }

        SecurityFinding getFinding() {
            return finding;
        }
    }

    private static final class ConflictPattern {
        private final String name;
        private final List<String> costKeywords;
        private final List<String> securityKeywords;
        private final String description;

        ConflictPattern(String name, List<String> costKeywords, List<String> securityKeywords, String description) {
            this.name = name;
            this.costKeywords = costKeywords;
            this.securityKeywords = securityKeywords;
            this.description = description;
        }
    }

    private static final class ComplementaryPattern {
        private final String name;
        private final List<String> keywords;
        private final List<String> costBenefits;
        private final List<String> securityBenefits;
        private final List<String> actions;

        ComplementaryPattern(String name, List<String> keywords, List<String> costBenefits,
                             List<String> securityBenefits, List<String> actions) {
            this.name = name;
            this.keywords = keywords;
            this.costBenefits = costBenefits;
            this.securityBenefits = securityBenefits;
            this.actions = actions;
        }
    }
}
