package com.xammer.costhub.service;

import com.xammer.costhub.domain.Category;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Kind of change a recommendation asks for, with its display label and step template.
 */
public enum ActionKind {
    DELETE("Delete idle or unused resources", List.of(
            "Confirm the resource is no longer used by any workload",
            "Create a backup or snapshot if the data must be retained",
            "Delete the resource",
            "Verify the charge disappears from the next billing cycle")),
    STOP("Stop idle or unused resources", List.of(
            "Confirm the resource is idle outside of known schedules",
            "Notify the resource owner",
            "Stop the resource",
            "Verify no dependent workload is affected")),
    RIGHTSIZE("Rightsize instance", List.of(
            "Review utilization metrics for the lookback period",
            "Schedule a maintenance window",
            "Change the resource to the recommended size",
            "Monitor performance after the change")),
    GRAVITON("Migrate to Graviton", List.of(
            "Verify the workload and its dependencies support arm64",
            "Test the application on a Graviton-based instance",
            "Switch to the recommended Graviton instance type",
            "Monitor performance after the change")),
    UPGRADE("Upgrade to newer generation", List.of(
            "Check compatibility with the newer generation",
            "Schedule a maintenance window",
            "Upgrade the resource",
            "Monitor performance after the change")),
    PURCHASE_RESERVED_INSTANCES("Purchase Reserved Instances", List.of(
            "Confirm the workload runs steadily for the whole term",
            "Review the recommended quantity and payment option",
            "Purchase the reservation",
            "Track reservation utilization and coverage monthly")),
    PURCHASE_SAVINGS_PLANS("Purchase Savings Plans", List.of(
            "Confirm the hourly commitment matches the steady-state spend",
            "Review the term and payment option",
            "Purchase the Savings Plan",
            "Track Savings Plan utilization and coverage monthly")),
    OTHER(null, List.of(
            "Review the recommendation details",
            "Plan the change with the resource owner",
            "Apply the change",
            "Validate cost and performance afterwards"));

    // m6g.large, c7gn.xlarge, db.r6g.large, cache.t4g.micro
    private static final Pattern GRAVITON_INSTANCE = Pattern.compile("^(db\\.|cache\\.)?[a-z]+\\d+g[a-z]*\\..+");

    private final String label;
    private final List<String> implementationSteps;

    ActionKind(String label, List<String> implementationSteps) {
        this.label = label;
        this.implementationSteps = implementationSteps;
    }

    public List<String> getImplementationSteps() {
        return implementationSteps;
    }

    public boolean isPurchase() {
        return this == PURCHASE_RESERVED_INSTANCES || this == PURCHASE_SAVINGS_PLANS;
    }

    /**
     * Display label. OTHER falls back to a category-specific label.
     */
    public String label(Category category) {
        if (label != null) {
            return label;
        }
        switch (category == null ? Category.GENERAL : category) {
            case COMPUTE:
                return "Optimize compute resources";
            case STORAGE:
                return "Optimize storage configuration";
            case DATABASE:
                return "Optimize database configuration";
            case NETWORKING:
                return "Optimize network configuration";
            case COMMITMENT:
                return "Review commitment purchase";
            default:
                return "Review and optimize";
        }
    }

    /**
     * Ordered keyword match over an upstream action type. First match wins.
     */
    public static ActionKind classify(String actionType, String recommendedResourceType) {
        String action = actionType == null ? "" : actionType.toLowerCase(Locale.ROOT);
        if (action.contains("terminate") || action.contains("delete")) {
            return DELETE;
        }
        if (action.contains("stop")) {
            return STOP;
        }
        if (action.contains("graviton")) {
            return GRAVITON;
        }
        if (action.contains("rightsize") || action.contains("modify")) {
            return isGravitonType(recommendedResourceType) ? GRAVITON : RIGHTSIZE;
        }
        if (action.contains("upgrade")) {
            return UPGRADE;
        }
        if (action.contains("reserved")) {
            return PURCHASE_RESERVED_INSTANCES;
        }
        if (action.contains("savingsplans") || action.contains("savings plans")) {
            return PURCHASE_SAVINGS_PLANS;
        }
        return OTHER;
    }

    public static boolean isGravitonType(String instanceType) {
        if (instanceType == null) {
            return false;
        }
        String lower = instanceType.toLowerCase(Locale.ROOT);
        return lower.contains("graviton") || lower.contains("arm64") || GRAVITON_INSTANCE.matcher(lower).matches();
    }
}
