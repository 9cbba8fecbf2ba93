package com.bko.planner.api;

import com.bko.planner.resolver.ResolvedContext;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArchetypeResponse(String concern, String domain, String archetype, boolean fallback, List<String> lanes) {

    public static ArchetypeResponse from(String concern, ResolvedContext resolved, List<String> lanes) {
        return new ArchetypeResponse(concern, resolved.domain().label(), resolved.archetype().key(),
                resolved.fallback(), lanes);
    }
}
