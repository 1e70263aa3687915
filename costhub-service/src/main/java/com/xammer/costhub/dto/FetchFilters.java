package com.xammer.costhub.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.TreeSet;

/**
 * Optional upstream filters. Providers ignore the ones they do not support.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchFilters {
    private List<String> implementationEfforts;
    private Boolean restartNeeded;

    public static FetchFilters none() {
        return new FetchFilters();
    }

    public boolean hasImplementationEfforts() {
        return implementationEfforts != null && !implementationEfforts.isEmpty();
    }

    /** Order-insensitive representation used in cache keys. */
    public String cacheKey() {
        String efforts = hasImplementationEfforts() ? String.join(",", new TreeSet<>(implementationEfforts)) : "*";
        return "efforts=" + efforts + ";restart=" + (restartNeeded == null ? "*" : restartNeeded);
    }
}
