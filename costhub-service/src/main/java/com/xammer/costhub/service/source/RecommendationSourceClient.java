package com.xammer.costhub.service.source;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.dto.FetchFilters;
import com.xammer.costhub.dto.raw.RawRecommendation;
import com.xammer.costhub.exception.SourceException;

import java.util.List;

/**
 * One upstream recommendation provider.
 *
 * @param <R> raw record type produced by this provider
 */
public interface RecommendationSourceClient<R extends RawRecommendation> {

    RecommendationSource getSource();

    /**
     * Fetches up to {@code maxResults} raw records from one region.
     *
     * @throws SourceException classified as terminal or transient
     */
    List<R> fetch(String region, int maxResults, FetchFilters filters);

    /**
     * Fetches across the given regions. Providers with a single global endpoint ignore the list and
     * query their home region once.
     */
    default List<R> collect(List<String> regions, int maxResults, FetchFilters filters) {
        return fetch(getHomeRegion(), maxResults, filters);
    }

    default String getHomeRegion() {
        return "us-east-1";
    }
}
