package com.xammer.costhub.controller;

import com.xammer.costhub.domain.SecurityFinding;
import com.xammer.costhub.dto.AggregationResult;
import com.xammer.costhub.dto.CrossReferenceReport;
import com.xammer.costhub.service.CostOptimizationService;
import com.xammer.costhub.service.resilience.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/cost-optimization")
public class CostOptimizationController {

    private static final Logger logger = LoggerFactory.getLogger(CostOptimizationController.class);

    private final CostOptimizationService costOptimizationService;

    public CostOptimizationController(CostOptimizationService costOptimizationService) {
        this.costOptimizationService = costOptimizationService;
    }

    /**
     * Aggregated, prioritized recommendations with executive summary and degradation details.
     */
    @GetMapping("/recommendations")
    public CompletableFuture<ResponseEntity<AggregationResult>> getRecommendations(
            @RequestParam(defaultValue = "false") boolean forceRefresh) {
        logger.info("📊 Fetching cost optimization recommendations (forceRefresh={})", forceRefresh);
        return costOptimizationService.runAsync(forceRefresh)
                .thenApply(result -> {
                    logger.info("✅ Returning {} recommendations", result.getRecommendations().size());
                    return ResponseEntity.ok(result);
                });
    }

    @GetMapping(value = "/recommendations/raw", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getRecommendationsJson() {
        return ResponseEntity.ok(costOptimizationService.getResultAsJson());
    }

    @GetMapping("/circuits")
    public ResponseEntity<Map<String, CircuitState>> getCircuitStates() {
        return ResponseEntity.ok(costOptimizationService.getCircuitStates());
    }

    @PostMapping("/cache/evict")
    public ResponseEntity<Map<String, String>> evictCache() {
        logger.info("🧹 Evicting cost optimization response cache");
        costOptimizationService.clearCache();
        return ResponseEntity.ok(Map.of("message", "Cost optimization cache cleared"));
    }

    /**
     * Correlates the current recommendations with security findings keyed by service name.
     */
    @PostMapping("/cross-reference")
    public ResponseEntity<CrossReferenceReport> crossReference(
            @RequestBody(required = false) Map<String, List<SecurityFinding>> findingsByService) {
        logger.info("🔗 Cross-referencing recommendations with findings from {} services",
                findingsByService == null ? 0 : findingsByService.size());
        return ResponseEntity.ok(costOptimizationService.crossReference(findingsByService));
    }
}
