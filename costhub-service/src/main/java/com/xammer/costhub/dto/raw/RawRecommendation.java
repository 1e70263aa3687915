package com.xammer.costhub.dto.raw;

import com.xammer.costhub.domain.RecommendationSource;

/**
 * Provider-specific record as returned by a source client, before normalization.
 * Each provider has exactly one implementation.
 */
public interface RawRecommendation {

    RecommendationSource getSource();
}
