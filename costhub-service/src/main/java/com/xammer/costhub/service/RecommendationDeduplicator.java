package com.xammer.costhub.service;

import com.xammer.costhub.domain.AffectedResource;
import com.xammer.costhub.domain.CostRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collapses recommendations that describe the same opportunity. The survivor keeps the position
 * of the first occurrence; it is replaced only by a strictly larger monthly saving.
 */
@Component
public class RecommendationDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationDeduplicator.class);

    public List<CostRecommendation> deduplicate(List<CostRecommendation> recommendations) {
        Map<String, CostRecommendation> byKey = new LinkedHashMap<>();
        for (CostRecommendation rec : recommendations) {
            String key = dedupKey(rec);
            CostRecommendation existing = byKey.get(key);
            if (existing == null || rec.getMonthlySavings() > existing.getMonthlySavings()) {
                if (existing != null) {
                    logger.debug("Duplicate {} replaces {} (savings {} > {})",
                            rec.getId(), existing.getId(), rec.getMonthlySavings(), existing.getMonthlySavings());
                }
                byKey.put(key, rec);
            }
        }
        int removed = recommendations.size() - byKey.size();
        if (removed > 0) {
            logger.info("Removed {} duplicate recommendations", removed);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * MD5 of {@code service|category|sorted resource ids}.
     */
    public static String dedupKey(CostRecommendation rec) {
        List<AffectedResource> resources = rec.getAffectedResources() == null ? List.of() : rec.getAffectedResources();
        String ids = resources.stream()
                .filter(Objects::nonNull)
                .map(AffectedResource::getId)
                .filter(Objects::nonNull)
                .sorted()
                .collect(Collectors.joining(","));
        String raw = rec.getService() + "|" + (rec.getCategory() == null ? "" : rec.getCategory().getWireName()) + "|" + ids;
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
