package com.bko.planner.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Research sources and reference tools the plan was grounded on.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provenance(List<Source> sources, List<String> clinicalTools) {

    public List<Source> sourceList() {
        return sources == null ? List.of() : sources;
    }

    public List<String> toolList() {
        return clinicalTools == null ? List.of() : clinicalTools;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Source(String name, String status, String url) {

        public boolean successful() {
            return "success".equalsIgnoreCase(status);
        }
    }
}
