package com.bko.planner.resolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArchetypeResolver {

    public static final Archetype FALLBACK_ARCHETYPE = Archetype.PREVENTABILITY_DETECTIVE;
    public static final Domain DEFAULT_DOMAIN = Domain.HAC;

    private static final Map<Archetype, List<String>> LANE_KEYWORDS = Map.of(
            Archetype.EXCLUSION_HUNTER, List.of("exclusion", "rule out", "contraindication"),
            Archetype.PROCESS_AUDITOR, List.of("time to", "delay", "protocol"),
            Archetype.PREVENTABILITY_DETECTIVE, List.of("bundle", "compliance", "preventable", "infection"));

    private final ArchetypeRegistry registry;

    /**
     * Classifies a concern against the registry. The first rule in table order that matches wins;
     * the domain hint is only consulted when nothing matches.
     */
    public ResolvedContext resolve(String concern, @Nullable Domain domainHint) {
        String normalized = concern == null ? "" : concern.trim();
        for (ArchetypeMapping mapping : registry.getMappings()) {
            if (mapping.matcher().matches(normalized)) {
                log.debug("Concern {} matched rule {} ({}).", normalized, mapping.matcher().describe(), mapping.description());
                return ResolvedContext.matched(mapping);
            }
        }
        Domain domain = domainHint != null ? domainHint : DEFAULT_DOMAIN;
        log.warn("No archetype mapping for concern '{}'. Falling back to {} in domain {}.",
                normalized, FALLBACK_ARCHETYPE.key(), domain.label());
        return new ResolvedContext(domain, FALLBACK_ARCHETYPE, true);
    }

    /**
     * Expands the primary archetype into the full set of analysis lanes suggested by the concern's
     * risk factors. The primary archetype is always present and the result is in lane order.
     */
    public List<Archetype> deriveLanes(Archetype primary, @Nullable Collection<String> riskFactors) {
        Set<Archetype> lanes = EnumSet.of(primary);
        if (riskFactors != null) {
            for (String factor : riskFactors) {
                if (!StringUtils.hasText(factor)) {
                    continue;
                }
                String text = factor.toLowerCase(Locale.ROOT);
                LANE_KEYWORDS.forEach((archetype, keywords) -> {
                    if (keywords.stream().anyMatch(text::contains)) {
                        lanes.add(archetype);
                    }
                });
            }
        }
        if (lanes.size() > 1) {
            log.info("Derived {} analysis lanes for primary archetype {}: {}.", lanes.size(), primary.key(), lanes);
        }
        return List.copyOf(lanes);
    }
}
