package com.xammer.costhub.service;

import com.xammer.costhub.domain.Category;
import com.xammer.costhub.domain.CostRecommendation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.xammer.costhub.service.TestRecommendations.builder;
import static com.xammer.costhub.service.TestRecommendations.rec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class RecommendationDeduplicatorTest {

    private final RecommendationDeduplicator deduplicator = new RecommendationDeduplicator();

    @Test
    void keepsHigherSavingsForSameResource() {
        CostRecommendation fromHub = rec("coh-1", 100.0, "i-abc");
        CostRecommendation fromExplorer = rec("ce-i-abc-modify", 150.0, "i-abc");

        List<CostRecommendation> result = deduplicator.deduplicate(List.of(fromHub, fromExplorer));

        assertEquals(1, result.size());
        assertEquals("ce-i-abc-modify", result.get(0).getId());
        assertEquals(150.0, result.get(0).getMonthlySavings());
    }

    @Test
    void firstOccurrenceWinsOnEqualSavings() {
        List<CostRecommendation> result = deduplicator.deduplicate(List.of(
                rec("first", 100.0, "i-abc"), rec("second", 100.0, "i-abc")));

        assertEquals(List.of("first"), ids(result));
    }

    @Test
    void resourceOrderDoesNotMatter() {
        CostRecommendation a = rec("a", 10.0, "vol-1", "vol-2");
        CostRecommendation b = rec("b", 20.0, "vol-2", "vol-1");

        assertEquals(RecommendationDeduplicator.dedupKey(a), RecommendationDeduplicator.dedupKey(b));
    }

    @Test
    void differentCategoryOrServiceAreDistinct() {
        CostRecommendation compute = rec("compute", 10.0, "i-abc");
        CostRecommendation storage = builder("storage", 10.0, "i-abc").category(Category.STORAGE).build();
        CostRecommendation lambda = builder("lambda", 10.0, "i-abc").service("lambda").build();

        assertNotEquals(RecommendationDeduplicator.dedupKey(compute), RecommendationDeduplicator.dedupKey(storage));
        assertEquals(3, deduplicator.deduplicate(List.of(compute, storage, lambda)).size());
    }

    @Test
    void survivorKeepsPositionOfFirstOccurrence() {
        List<CostRecommendation> result = deduplicator.deduplicate(List.of(
                rec("x", 5.0, "i-1"),
                rec("y", 7.0, "i-2"),
                rec("x2", 9.0, "i-1")));

        assertEquals(List.of("x2", "y"), ids(result));
    }

    private static List<String> ids(List<CostRecommendation> recs) {
        return recs.stream().map(CostRecommendation::getId).collect(Collectors.toList());
    }
}
