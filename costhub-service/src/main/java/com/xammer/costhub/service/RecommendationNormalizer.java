package com.xammer.costhub.service;

import com.xammer.costhub.domain.AffectedResource;
import com.xammer.costhub.domain.Category;
import com.xammer.costhub.domain.ConfidenceLevel;
import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.domain.ImplementationEffort;
import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.domain.RecommendationStatus;
import com.xammer.costhub.dto.NormalizationResult;
import com.xammer.costhub.dto.SkipReason;
import com.xammer.costhub.dto.raw.CohRawRecommendation;
import com.xammer.costhub.dto.raw.RawRecommendation;
import com.xammer.costhub.dto.raw.RightsizingRawRecommendation;
import com.xammer.costhub.dto.raw.SavingsPlansRawRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps each provider's raw record onto {@link CostRecommendation}. One mapping method per provider.
 * Priority fields are left unset for the scorer.
 */
@Component
public class RecommendationNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationNormalizer.class);

    static final String GENERIC_RECOMMENDED_SUMMARY = "Review and optimize resource configuration";
    static final String GENERIC_CURRENT_SUMMARY = "Current configuration";

    private static final Map<RecommendationSource, List<String>> REQUIRED_PERMISSIONS = Map.of(
            RecommendationSource.COH, List.of(
                    "cost-optimization-hub:ListRecommendations",
                    "cost-optimization-hub:GetRecommendation"),
            RecommendationSource.COST_EXPLORER, List.of(
                    "ce:GetRightsizingRecommendation"),
            RecommendationSource.SAVINGS_PLANS, List.of(
                    "ce:GetSavingsPlansPurchaseRecommendation",
                    "savingsplans:CreateSavingsPlan")
    );

    /** Cost Optimization Hub resource types: service, category, display name. */
    private static final Map<String, ResourceTypeInfo> RESOURCE_TYPES = Map.ofEntries(
            Map.entry("ec2instance", new ResourceTypeInfo("ec2", Category.COMPUTE, "EC2 instance")),
            Map.entry("aws::ec2::instance", new ResourceTypeInfo("ec2", Category.COMPUTE, "EC2 instance")),
            Map.entry("ec2autoscalinggroup", new ResourceTypeInfo("ec2", Category.COMPUTE, "Auto Scaling group")),
            Map.entry("ebsvolume", new ResourceTypeInfo("ebs", Category.STORAGE, "EBS volume")),
            Map.entry("aws::ec2::volume", new ResourceTypeInfo("ebs", Category.STORAGE, "EBS volume")),
            Map.entry("lambdafunction", new ResourceTypeInfo("lambda", Category.COMPUTE, "Lambda function")),
            Map.entry("aws::lambda::function", new ResourceTypeInfo("lambda", Category.COMPUTE, "Lambda function")),
            Map.entry("ecsservice", new ResourceTypeInfo("ecs", Category.COMPUTE, "ECS service")),
            Map.entry("rdsdbinstance", new ResourceTypeInfo("rds", Category.DATABASE, "RDS instance")),
            Map.entry("aws::rds::dbinstance", new ResourceTypeInfo("rds", Category.DATABASE, "RDS instance")),
            Map.entry("rdsdbinstancestorage", new ResourceTypeInfo("rds", Category.DATABASE, "RDS storage")),
            Map.entry("auroradbclusterstorage", new ResourceTypeInfo("rds", Category.DATABASE, "Aurora cluster storage")),
            Map.entry("dynamodbreservedcapacity", new ResourceTypeInfo("dynamodb", Category.COMMITMENT, "DynamoDB reserved capacity")),
            Map.entry("ec2reservedinstances", new ResourceTypeInfo("reserved_instances", Category.COMMITMENT, "EC2 Reserved Instances")),
            Map.entry("rdsreservedinstances", new ResourceTypeInfo("reserved_instances", Category.COMMITMENT, "RDS Reserved Instances")),
            Map.entry("elasticachereservedinstances", new ResourceTypeInfo("reserved_instances", Category.COMMITMENT, "ElastiCache Reserved Instances")),
            Map.entry("opensearchreservedinstances", new ResourceTypeInfo("reserved_instances", Category.COMMITMENT, "OpenSearch Reserved Instances")),
            Map.entry("redshiftreservednodes", new ResourceTypeInfo("reserved_instances", Category.COMMITMENT, "Redshift reserved nodes")),
            Map.entry("computesavingsplans", new ResourceTypeInfo("savings_plans", Category.COMMITMENT, "Compute Savings Plans")),
            Map.entry("ec2instancesavingsplans", new ResourceTypeInfo("savings_plans", Category.COMMITMENT, "EC2 Instance Savings Plans")),
            Map.entry("sagemakersavingsplans", new ResourceTypeInfo("savings_plans", Category.COMMITMENT, "SageMaker Savings Plans"))
    );

    private static final ResourceTypeInfo UNKNOWN_RESOURCE_TYPE =
            new ResourceTypeInfo("general", Category.GENERAL, "Resource");

    private final Clock clock;

    public RecommendationNormalizer(Clock clock) {
        this.clock = clock;
    }

    public List<NormalizationResult> normalizeAll(List<? extends RawRecommendation> records) {
        List<NormalizationResult> results = new ArrayList<>(records.size());
        for (RawRecommendation raw : records) {
            results.add(normalize(raw));
        }
        return results;
    }

    /**
     * Never throws: an unexpected failure on one record becomes a skip for that record.
     */
    public NormalizationResult normalize(RawRecommendation raw) {
        if (raw == null) {
            return NormalizationResult.skipped(new SkipReason(null, null, "null record"));
        }
        try {
            if (raw instanceof CohRawRecommendation) {
                return fromCostOptimizationHub((CohRawRecommendation) raw);
            }
            if (raw instanceof RightsizingRawRecommendation) {
                return fromRightsizing((RightsizingRawRecommendation) raw);
            }
            if (raw instanceof SavingsPlansRawRecommendation) {
                return fromSavingsPlans((SavingsPlansRawRecommendation) raw);
            }
            return NormalizationResult.skipped(new SkipReason(raw.getSource(), null,
                    "unsupported record type " + raw.getClass().getSimpleName()));
        } catch (RuntimeException e) {
            logger.warn("Failed to normalize {} record: {}", raw.getSource(), e.getMessage(), e);
            return NormalizationResult.skipped(new SkipReason(raw.getSource(), null,
                    "normalization failed: " + e.getMessage()));
        }
    }

    NormalizationResult fromCostOptimizationHub(CohRawRecommendation raw) {
        if (isBlank(raw.getRecommendationId())) {
            return skip(raw.getSource(), null, "missing recommendation id");
        }
        ResourceTypeInfo type = resourceTypeInfo(raw.getCurrentResourceType());
        ActionKind action = ActionKind.classify(raw.getActionType(), raw.getRecommendedResourceType());
        double monthlySavings = valueOrZero(raw.getEstimatedMonthlySavings());
        double monthlyCost = valueOrZero(raw.getEstimatedMonthlyCost());
        String resourceId = !isBlank(raw.getResourceId()) ? raw.getResourceId() : raw.getResourceArn();
        List<AffectedResource> resources = isBlank(resourceId)
                ? new ArrayList<>()
                : new ArrayList<>(List.of(new AffectedResource(resourceId, type.displayName, raw.getRegion())));
        boolean restart = Boolean.TRUE.equals(raw.getRestartNeeded());
        boolean rollback = raw.getRollbackPossible() == null || raw.getRollbackPossible();
        String label = action.label(type.category);

        String description = !isBlank(raw.getDescription()) ? raw.getDescription()
                : String.format(Locale.ROOT, "%s for %s %s in %s. Estimated savings $%.2f per month.",
                label, type.displayName, resourceId == null ? "" : displayId(resourceId),
                raw.getRegion() == null ? "an unknown region" : raw.getRegion(), monthlySavings);

        return NormalizationResult.success(baseBuilder(RecommendationSource.COH, "coh-" + raw.getRecommendationId())
                .category(type.category)
                .service(type.service)
                .title(label + (resourceId == null ? "" : ": " + displayId(resourceId)))
                .description(description)
                .monthlySavings(monthlySavings)
                .annualSavings(CostRecommendation.annualize(monthlySavings))
                .confidenceLevel(ConfidenceLevel.HIGH)
                .implementationEffort(ImplementationEffort.fromUpstream(raw.getImplementationEffort()))
                .implementationSteps(new ArrayList<>(action.getImplementationSteps()))
                .requiredPermissions(new ArrayList<>(REQUIRED_PERMISSIONS.get(RecommendationSource.COH)))
                .potentialRisks(risks(action, restart, rollback))
                .affectedResources(resources)
                .resourceCount(resources.size())
                .topRecommendedAction(label)
                .recommendedResourceSummary(recommendedSummary(raw.getRecommendedResourceSummary(), action,
                        type.category, type.displayName, raw.getRecommendedResourceType(), raw.getDescription()))
                .currentResourceSummary(currentSummary(resources))
                .estimatedMonthlyCost(monthlyCost)
                .estimatedSavingsPercentage(savingsPercentage(monthlySavings, raw.getEstimatedMonthlyCost()))
                .region(raw.getRegion())
                .accountId(raw.getAccountId())
                .restartRequired(restart)
                .rollbackPossible(rollback)
                .resourceType(type.displayName)
                .lastUpdated(raw.getLastRefreshTimestamp() != null ? raw.getLastRefreshTimestamp() : clock.instant())
                .build());
    }

    NormalizationResult fromRightsizing(RightsizingRawRecommendation raw) {
        if (isBlank(raw.getResourceId())) {
            return skip(raw.getSource(), null, "missing instance id");
        }
        boolean terminate = "TERMINATE".equalsIgnoreCase(raw.getRightsizingType());
        ActionKind action = terminate ? ActionKind.DELETE
                : ActionKind.classify("Rightsize", raw.getTargetInstanceType());
        double monthlySavings = valueOrZero(raw.getEstimatedMonthlySavings());
        String typeName = "EC2 instance";
        List<AffectedResource> resources = new ArrayList<>(List.of(
                new AffectedResource(raw.getResourceId(), typeName, raw.getRegion())));
        String instanceLabel = !isBlank(raw.getInstanceName())
                ? raw.getInstanceName() + " (" + raw.getResourceId() + ")" : raw.getResourceId();

        String title;
        StringBuilder description = new StringBuilder();
        if (terminate) {
            title = "Terminate idle EC2 instance " + instanceLabel;
            description.append("Instance ").append(instanceLabel).append(" appears idle");
        } else {
            title = "Rightsize EC2 instance " + instanceLabel
                    + (isBlank(raw.getTargetInstanceType()) ? "" : " to " + raw.getTargetInstanceType());
            description.append("Instance ").append(instanceLabel).append(" (")
                    .append(raw.getInstanceType() == null ? "unknown type" : raw.getInstanceType())
                    .append(") is over-provisioned");
        }
        if (raw.getMaxCpuUtilization() != null) {
            description.append(String.format(Locale.ROOT, " with peak CPU at %.1f%%", raw.getMaxCpuUtilization()));
        }
        description.append('.');
        if (raw.getFindingReasonCodes() != null && !raw.getFindingReasonCodes().isEmpty()) {
            description.append(" Findings: ").append(String.join(", ", raw.getFindingReasonCodes())).append('.');
        }

        List<String> permissions = new ArrayList<>(REQUIRED_PERMISSIONS.get(RecommendationSource.COST_EXPLORER));
        if (terminate) {
            permissions.add("ec2:TerminateInstances");
        } else {
            permissions.addAll(List.of("ec2:StopInstances", "ec2:ModifyInstanceAttribute", "ec2:StartInstances"));
        }

        String id = "ce-" + raw.getResourceId() + "-" + (terminate ? "terminate" : "modify");
        return NormalizationResult.success(baseBuilder(RecommendationSource.COST_EXPLORER, id)
                .category(Category.COMPUTE)
                .service("ec2")
                .title(title)
                .description(description.toString())
                .monthlySavings(monthlySavings)
                .annualSavings(CostRecommendation.annualize(monthlySavings))
                .confidenceLevel(terminate ? ConfidenceLevel.HIGH : ConfidenceLevel.MEDIUM)
                .implementationEffort(terminate ? ImplementationEffort.LOW : ImplementationEffort.MEDIUM)
                .implementationSteps(new ArrayList<>(action.getImplementationSteps()))
                .requiredPermissions(permissions)
                .potentialRisks(risks(action, !terminate, !terminate))
                .affectedResources(resources)
                .resourceCount(resources.size())
                .topRecommendedAction(action.label(Category.COMPUTE))
                .recommendedResourceSummary(terminate
                        ? "Terminate the instance after confirming it is unused"
                        : recommendedSummary(null, action, Category.COMPUTE, typeName, raw.getTargetInstanceType(), null))
                .currentResourceSummary(currentSummary(resources))
                .estimatedMonthlyCost(valueOrZero(raw.getCurrentMonthlyCost()))
                .estimatedSavingsPercentage(savingsPercentage(monthlySavings, raw.getCurrentMonthlyCost()))
                .region(raw.getRegion())
                .accountId(raw.getAccountId())
                .restartRequired(!terminate)
                .rollbackPossible(!terminate)
                .resourceType(typeName)
                .build());
    }

    NormalizationResult fromSavingsPlans(SavingsPlansRawRecommendation raw) {
        String planType = humanize(raw.getSavingsPlansType(), "Savings Plan");
        String term = "THREE_YEARS".equalsIgnoreCase(raw.getTermInYears()) ? "3 year" : "1 year";
        String payment = humanize(raw.getPaymentOption(), "No Upfront");
        String detailId = !isBlank(raw.getRecommendationDetailId()) ? raw.getRecommendationDetailId()
                : String.join("-", String.valueOf(raw.getSavingsPlansType()), String.valueOf(raw.getTermInYears()),
                String.valueOf(raw.getPaymentOption()), String.valueOf(raw.getInstanceFamily()));
        double monthlySavings = valueOrZero(raw.getEstimatedMonthlySavings());
        ActionKind action = ActionKind.PURCHASE_SAVINGS_PLANS;

        String description = String.format(Locale.ROOT,
                "Commit to $%.3f per hour of %s usage for %s (%s) based on the last %s of usage.",
                valueOrZero(raw.getHourlyCommitment()), planType, term, payment,
                humanize(raw.getLookbackPeriod(), "lookback period").toLowerCase(Locale.ROOT));

        return NormalizationResult.success(baseBuilder(RecommendationSource.SAVINGS_PLANS, "sp-" + detailId)
                .category(Category.COMMITMENT)
                .service("savings_plans")
                .title("Purchase " + planType + " (" + term + ", " + payment + ")")
                .description(description)
                .monthlySavings(monthlySavings)
                .annualSavings(CostRecommendation.annualize(monthlySavings))
                .confidenceLevel(ConfidenceLevel.MEDIUM)
                .implementationEffort(ImplementationEffort.LOW)
                .implementationSteps(new ArrayList<>(action.getImplementationSteps()))
                .requiredPermissions(new ArrayList<>(REQUIRED_PERMISSIONS.get(RecommendationSource.SAVINGS_PLANS)))
                .potentialRisks(risks(action, false, false))
                .affectedResources(new ArrayList<>())
                .resourceCount(0)
                .topRecommendedAction(action.label(Category.COMMITMENT))
                .recommendedResourceSummary(recommendedSummary(null, action, Category.COMMITMENT,
                        planType, null, description))
                .currentResourceSummary(GENERIC_CURRENT_SUMMARY)
                .estimatedMonthlyCost(valueOrZero(raw.getEstimatedMonthlyOnDemandCost()))
                .estimatedSavingsPercentage(savingsPercentage(monthlySavings, raw.getEstimatedMonthlyOnDemandCost()))
                .region(raw.getRegion())
                .accountId(raw.getAccountId())
                .restartRequired(false)
                .rollbackPossible(false)
                .resourceType(planType)
                .build());
    }

    private CostRecommendation.CostRecommendationBuilder baseBuilder(RecommendationSource source, String id) {
        Instant now = clock.instant();
        return CostRecommendation.builder()
                .id(id)
                .source(source)
                .status(RecommendationStatus.NEW)
                .createdDate(now)
                .lastUpdated(now);
    }

    /**
     * Upstream summary when present, else a pattern heuristic, else the first sentence of the
     * description, else a generic string.
     */
    static String recommendedSummary(String upstreamSummary, ActionKind action, Category category,
                                     String resourceTypeName, String recommendedType, String description) {
        if (!isBlank(upstreamSummary)) {
            return upstreamSummary.trim();
        }
        String typeName = resourceTypeName == null ? "" : resourceTypeName.toLowerCase(Locale.ROOT);
        if (category == Category.STORAGE && action == ActionKind.DELETE && typeName.contains("volume")) {
            return "Detach volume from instance, create a snapshot and delete.";
        }
        if (category == Category.COMPUTE && action == ActionKind.GRAVITON) {
            return isBlank(recommendedType) ? "Migrate to Graviton-based instance type" : "Migrate to " + recommendedType;
        }
        if (category == Category.COMPUTE && action == ActionKind.RIGHTSIZE) {
            return isBlank(recommendedType)
                    ? "Optimize instance type for better performance and cost" : "Change instance type to " + recommendedType;
        }
        if (action == ActionKind.PURCHASE_RESERVED_INSTANCES) {
            return "Purchase Reserved Instances for predictable workloads";
        }
        if (action == ActionKind.PURCHASE_SAVINGS_PLANS) {
            return "Purchase Savings Plans for flexible compute usage";
        }
        String sentence = firstSentence(description);
        return sentence != null ? sentence : GENERIC_RECOMMENDED_SUMMARY;
    }

    /**
     * Up to the first three resource ids, ARNs and paths reduced to their last segment.
     */
    static String currentSummary(List<AffectedResource> resources) {
        if (resources == null || resources.isEmpty()) {
            return GENERIC_CURRENT_SUMMARY;
        }
        List<String> ids = new ArrayList<>();
        for (AffectedResource resource : resources) {
            if (ids.size() == 3) {
                break;
            }
            if (resource != null && !isBlank(resource.getId())) {
                ids.add(displayId(resource.getId()));
            }
        }
        if (ids.isEmpty()) {
            return GENERIC_CURRENT_SUMMARY;
        }
        String summary = String.join(", ", ids);
        int remaining = resources.size() - ids.size();
        return remaining > 0 ? summary + " (+" + remaining + " more)" : summary;
    }

    /**
     * {@code round(clamp(savings / cost * 100, 0, 100))}; 100 when cost is unknown or zero and
     * savings are positive, otherwise 0.
     */
    static int savingsPercentage(double monthlySavings, Double monthlyCost) {
        if (monthlyCost == null || !Double.isFinite(monthlyCost) || monthlyCost <= 0) {
            return monthlySavings > 0 ? 100 : 0;
        }
        double pct = monthlySavings / monthlyCost * 100.0;
        return (int) Math.round(Math.max(0.0, Math.min(100.0, pct)));
    }

    static String displayId(String id) {
        String value = id.trim();
        int colon = value.lastIndexOf(':');
        if (colon >= 0 && colon < value.length() - 1) {
            value = value.substring(colon + 1);
        }
        int slash = value.lastIndexOf('/');
        if (slash >= 0 && slash < value.length() - 1) {
            value = value.substring(slash + 1);
        }
        return value;
    }

    private static String firstSentence(String text) {
        if (isBlank(text)) {
            return null;
        }
        String trimmed = text.trim();
        int end = trimmed.indexOf(". ");
        String sentence = end >= 0 ? trimmed.substring(0, end + 1) : trimmed;
        return sentence.length() > 200 ? sentence.substring(0, 197) + "..." : sentence;
    }

    private static List<String> risks(ActionKind action, boolean restartRequired, boolean rollbackPossible) {
        List<String> risks = new ArrayList<>();
        if (restartRequired) {
            risks.add("Requires a restart, plan for downtime");
        }
        if (!rollbackPossible && !action.isPurchase()) {
            risks.add("Change cannot be rolled back automatically");
        }
        switch (action) {
            case DELETE:
                risks.add("Data loss if the resource is still needed");
                break;
            case RIGHTSIZE:
            case GRAVITON:
                risks.add("Performance may degrade if utilization grows");
                break;
            case PURCHASE_RESERVED_INSTANCES:
            case PURCHASE_SAVINGS_PLANS:
                risks.add("Commitment is billed for the whole term even if usage drops");
                break;
            default:
                break;
        }
        return risks;
    }

    private static ResourceTypeInfo resourceTypeInfo(String currentResourceType) {
        if (isBlank(currentResourceType)) {
            return UNKNOWN_RESOURCE_TYPE;
        }
        ResourceTypeInfo info = RESOURCE_TYPES.get(currentResourceType.trim().toLowerCase(Locale.ROOT));
        return info != null ? info : new ResourceTypeInfo("general", Category.GENERAL, currentResourceType);
    }

    private static String humanize(String enumValue, String fallback) {
        if (isBlank(enumValue)) {
            return fallback;
        }
        switch (enumValue.toUpperCase(Locale.ROOT)) {
            case "COMPUTE_SP":
                return "Compute Savings Plan";
            case "EC2_INSTANCE_SP":
                return "EC2 Instance Savings Plan";
            case "SAGEMAKER_SP":
                return "SageMaker Savings Plan";
            default:
                break;
        }
        String[] words = enumValue.toLowerCase(Locale.ROOT).split("_");
        List<String> out = new ArrayList<>(words.length);
        for (String word : words) {
            if (!word.isEmpty()) {
                out.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
            }
        }
        return out.isEmpty() ? fallback : String.join(" ", out);
    }

    private static NormalizationResult skip(RecommendationSource source, String recordId, String reason) {
        SkipReason skipReason = new SkipReason(source, recordId, reason);
        logger.warn("{}", skipReason);
        return NormalizationResult.skipped(skipReason);
    }

    private static double valueOrZero(Double value) {
        return value == null || !Double.isFinite(value) ? 0.0 : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static final class ResourceTypeInfo {
        private final String service;
        private final Category category;
        private final String displayName;

        private ResourceTypeInfo(String service, Category category, String displayName) {
            this.service = service;
            this.category = category;
            this.displayName = displayName;
        }
    }
}
