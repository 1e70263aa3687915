package com.xammer.costhub.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AffectedResource {
    private String id;
    private String type;
    private String region;
}
