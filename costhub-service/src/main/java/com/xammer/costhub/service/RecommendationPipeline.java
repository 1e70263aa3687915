package com.xammer.costhub.service;

import com.xammer.costhub.domain.CostRecommendation;
import com.xammer.costhub.dto.AnomalyReport;
import com.xammer.costhub.dto.ExecutiveSummary;
import com.xammer.costhub.dto.MonitoringReport;
import com.xammer.costhub.dto.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Post-collection processing: dedup, score, validate, detect anomalies, sort, summarize.
 */
@Component
public class RecommendationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationPipeline.class);

    private final RecommendationDeduplicator deduplicator;
    private final PriorityScorer priorityScorer;
    private final DataQualityValidator validator;
    private final AnomalyDetector anomalyDetector;
    private final ExecutiveSummaryGenerator summaryGenerator;
    private final DataQualityMonitor monitor;

    public RecommendationPipeline(RecommendationDeduplicator deduplicator,
                                  PriorityScorer priorityScorer,
                                  DataQualityValidator validator,
                                  AnomalyDetector anomalyDetector,
                                  ExecutiveSummaryGenerator summaryGenerator,
                                  DataQualityMonitor monitor) {
        this.deduplicator = deduplicator;
        this.priorityScorer = priorityScorer;
        this.validator = validator;
        this.anomalyDetector = anomalyDetector;
        this.summaryGenerator = summaryGenerator;
        this.monitor = monitor;
    }

    public Output process(List<CostRecommendation> collected, Instant collectedAt) {
        List<CostRecommendation> unique = deduplicator.deduplicate(collected);
        priorityScorer.score(unique);
        DataQualityValidator.Outcome validation = validator.validate(unique);
        List<CostRecommendation> valid = validation.getValid();
        AnomalyReport anomalies = anomalyDetector.detect(valid);

        // List.sort is stable: equal scores keep discovery order.
        valid.sort(Comparator.comparingDouble(CostRecommendation::getPriorityScore).reversed());

        ExecutiveSummary summary = summaryGenerator.generate(valid, collectedAt);
        MonitoringReport monitoring = monitor.analyze(valid, collectedAt);
        logger.info("Pipeline finished: {} collected, {} unique, {} valid, ${} monthly savings",
                collected.size(), unique.size(), valid.size(), summary.getTotalMonthlySavings());
        return new Output(valid, summary, validation.getReport(), anomalies, monitoring);
    }

    public static final class Output {
        private final List<CostRecommendation> recommendations;
        private final ExecutiveSummary summary;
        private final ValidationReport validationReport;
        private final AnomalyReport anomalyReport;
        private final MonitoringReport monitoring;

        Output(List<CostRecommendation> recommendations, ExecutiveSummary summary, ValidationReport validationReport,
               AnomalyReport anomalyReport, MonitoringReport monitoring) {
            this.recommendations = recommendations;
            this.summary = summary;
            this.validationReport = validationReport;
            this.anomalyReport = anomalyReport;
            this.monitoring = monitoring;
        }

        public List<CostRecommendation> getRecommendations() {
            return recommendations;
        }

        public ExecutiveSummary getSummary() {
            return summary;
        }

        public ValidationReport getValidationReport() {
            return validationReport;
        }

        public AnomalyReport getAnomalyReport() {
            return anomalyReport;
        }

        public MonitoringReport getMonitoring() {
            return monitoring;
        }
    }
}
