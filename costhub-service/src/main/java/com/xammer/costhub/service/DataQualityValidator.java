package com.xammer.costhub.service;

import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.PriorityLevel;
import com.xammer.costhub.domain.RecommendationStatus;
import com.xammer.costhub.dto.ValidationIssue;
import com.xammer.costhub.dto.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drops structurally broken recommendations and repairs the derived fields that can be recomputed.
 */
@Component
public class DataQualityValidator {

    private static final Logger logger = LoggerFactory.getLogger(DataQualityValidator.class);

    static final double ANNUAL_TOLERANCE = 0.01;

    public Outcome validate(List<CostRecommendation> recommendations) {
        List<CostRecommendation> valid = new ArrayList<>();
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> fixes = new ArrayList<>();
        int corrected = 0;

        for (CostRecommendation rec : recommendations) {
            Optional<ValidationIssue> structural = structuralIssue(rec);
            if (structural.isPresent()) {
                logger.warn("Dropping recommendation {}: {}", structural.get().getRecommendationId(),
                        structural.get().getMessage());
                errors.add(structural.get());
                continue;
            }
            List<ValidationIssue> applied = autoCorrect(rec);
            if (!applied.isEmpty()) {
                corrected++;
                applied.forEach(fix -> logger.info("Fixed recommendation {}: {}", fix.getRecommendationId(), fix.getMessage()));
                fixes.addAll(applied);
            }
            valid.add(rec);
        }

        int total = recommendations.size();
        ValidationReport report = ValidationReport.builder()
                .totalProcessed(total)
                .validCount(valid.size())
                .removedCount(total - valid.size())
                .correctedCount(corrected)
                .errors(errors)
                .fixes(fixes)
                .qualityScore(total == 0 ? 1.0 : (double) valid.size() / total)
                .build();
        return new Outcome(valid, report);
    }

    private Optional<ValidationIssue> structuralIssue(CostRecommendation rec) {
        if (rec == null) {
            return Optional.of(new ValidationIssue(null, "record", "null recommendation"));
        }
        String id = rec.getId();
        if (isBlank(id)) {
            return issue(id, "id", "missing required field");
        }
        if (rec.getSource() == null) {
            return issue(id, "source", "missing required field");
        }
        if (rec.getCategory() == null) {
            return issue(id, "category", "missing required field");
        }
        if (isBlank(rec.getService())) {
            return issue(id, "service", "missing required field");
        }
        if (isBlank(rec.getTitle())) {
            return issue(id, "title", "missing required field");
        }
        if (!Double.isFinite(rec.getMonthlySavings()) || rec.getMonthlySavings() < 0) {
            return issue(id, "monthly_savings", "savings must be a non-negative number, got " + rec.getMonthlySavings());
        }
        if (rec.getConfidenceLevel() == null) {
            return issue(id, "confidence_level", "value outside the allowed set");
        }
        if (rec.getImplementationEffort() == null) {
            return issue(id, "implementation_effort", "value outside the allowed set");
        }
        if (rec.getImplementationSteps() == null) {
            return issue(id, "implementation_steps", "expected a list");
        }
        if (rec.getRequiredPermissions() == null) {
            return issue(id, "required_permissions", "expected a list");
        }
        if (rec.getPotentialRisks() == null) {
            return issue(id, "potential_risks", "expected a list");
        }
        if (rec.getAffectedResources() == null) {
            return issue(id, "affected_resources", "expected a list");
        }
        return Optional.empty();
    }

    private List<ValidationIssue> autoCorrect(CostRecommendation rec) {
        List<ValidationIssue> applied = new ArrayList<>();
        double expectedAnnual = CostRecommendation.annualize(rec.getMonthlySavings());
        if (!Double.isFinite(rec.getAnnualSavings()) || Math.abs(rec.getAnnualSavings() - expectedAnnual) > ANNUAL_TOLERANCE) {
            applied.add(new ValidationIssue(rec.getId(), "annual_savings",
                    "annual savings " + rec.getAnnualSavings() + " corrected to " + expectedAnnual));
        }
        // Always store the exact rounded value so the invariant holds bit for bit.
        rec.setAnnualSavings(expectedAnnual);

        int actualCount = rec.getAffectedResources().size();
        if (rec.getResourceCount() != actualCount) {
            applied.add(new ValidationIssue(rec.getId(), "resource_count",
                    "resource count " + rec.getResourceCount() + " corrected to " + actualCount));
            rec.setResourceCount(actualCount);
        }
        PriorityLevel expectedLevel = PriorityLevel.fromScore(rec.getPriorityScore());
        if (rec.getPriorityLevel() != expectedLevel) {
            applied.add(new ValidationIssue(rec.getId(), "priority_level",
                    "priority level " + rec.getPriorityLevel() + " corrected to " + expectedLevel));
            rec.setPriorityLevel(expectedLevel);
        }
        if (rec.getStatus() == null) {
            applied.add(new ValidationIssue(rec.getId(), "status", "missing status set to new"));
            rec.setStatus(RecommendationStatus.NEW);
        }
        return applied;
    }

    private static Optional<ValidationIssue> issue(String id, String field, String message) {
        return Optional.of(new ValidationIssue(id, field, message));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static final class Outcome {
        private final List<CostRecommendation> valid;
        private final ValidationReport report;

        Outcome(List<CostRecommendation> valid, ValidationReport report) {
            this.valid = valid;
            this.report = report;
        }

        public List<CostRecommendation> getValid() {
            return valid;
        }

        public ValidationReport getReport() {
            return report;
        }
    }
}
