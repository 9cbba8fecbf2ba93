package com.bko.planner.resolver;

/**
 * Outcome of concern classification. {@code fallback} is set when no rule matched and the
 * default archetype was used.
 */
public record ResolvedContext(Domain domain, Archetype archetype, boolean fallback) {

    public static ResolvedContext matched(ArchetypeMapping mapping) {
        return new ResolvedContext(mapping.domain(), mapping.archetype(), false);
    }
}
