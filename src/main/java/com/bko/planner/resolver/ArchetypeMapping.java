package com.bko.planner.resolver;

public record ArchetypeMapping(ConcernMatcher matcher, Domain domain, Archetype archetype, String description) {
}
