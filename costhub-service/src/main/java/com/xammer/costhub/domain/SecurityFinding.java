package com.xammer.costhub.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finding produced by an external scanner. Either {@code resourceId} or {@code resourceIds} may be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SecurityFinding {
    private String id;
    private String resourceId;
    private List<String> resourceIds;
    private String title;
    private String description;
    private Severity severity;

    @JsonIgnore
    public Set<String> allResourceIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (resourceId != null && !resourceId.isBlank()) {
            ids.add(resourceId);
        }
        if (resourceIds != null) {
            for (String rid : resourceIds) {
                if (rid != null && !rid.isBlank()) {
                    ids.add(rid);
                }
            }
        }
        return ids;
    }

    @JsonIgnore
    public String searchableText() {
        return ((title == null ? "" : title) + " " + (description == null ? "" : description)).toLowerCase();
    }
}
