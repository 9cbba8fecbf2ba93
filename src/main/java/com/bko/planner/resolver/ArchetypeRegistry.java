package com.bko.planner.resolver;

import com.bko.planner.config.PlannerProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered, read-only concern classification table. Loaded once from the classpath and checked
 * for integrity before any lookup; table order is significant because the first matching rule wins.
 */
@Component
@Slf4j
public class ArchetypeRegistry {

    private final String version;
    private final List<ArchetypeMapping> mappings;

    public ArchetypeRegistry(PlannerProperties properties, ObjectMapper objectMapper) {
        this(load(objectMapper, properties.getRegistryLocation()));
    }

    ArchetypeRegistry(RegistryDocument document) {
        List<String> problems = new ArrayList<>();
        if (!StringUtils.hasText(document.version())) {
            problems.add("Registry version is missing");
        }
        List<RegistryEntry> entries = document.mappings() != null ? document.mappings() : List.of();
        if (entries.isEmpty()) {
            problems.add("Registry contains no mappings");
        }
        List<ArchetypeMapping> parsed = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            ArchetypeMapping mapping = toMapping(i, entries.get(i), problems);
            if (mapping != null) {
                parsed.add(mapping);
            }
        }
        if (!problems.isEmpty()) {
            throw new RegistryConfigurationException("Archetype registry failed integrity check: " + String.join("; ", problems));
        }
        this.version = document.version();
        this.mappings = List.copyOf(parsed);
        log.info("Loaded archetype registry v{} with {} mappings.", version, mappings.size());
    }

    public String getVersion() {
        return version;
    }

    public List<ArchetypeMapping> getMappings() {
        return mappings;
    }

    static RegistryDocument load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, RegistryDocument.class);
        } catch (IOException ex) {
            throw new RegistryConfigurationException("Unable to read archetype registry from " + location, ex);
        }
    }

    private ArchetypeMapping toMapping(int index, RegistryEntry entry, List<String> problems) {
        String label = "mapping[" + index + "]";
        boolean hasExact = StringUtils.hasText(entry.exact());
        boolean hasPattern = StringUtils.hasText(entry.pattern());
        if (hasExact == hasPattern) {
            problems.add(label + " must declare exactly one of exact or pattern");
            return null;
        }
        if (!StringUtils.hasText(entry.description())) {
            problems.add(label + " is missing a description");
        }
        Domain domain = parse(label, "domain", entry.domain(), Domain::fromLabel, problems);
        Archetype archetype = parse(label, "archetype", entry.archetype(), Archetype::fromKey, problems);
        ConcernMatcher matcher;
        if (hasExact) {
            matcher = new ConcernMatcher.ExactMatch(entry.exact().trim());
        } else {
            try {
                matcher = ConcernMatcher.PatternMatch.of(entry.pattern());
            } catch (PatternSyntaxException ex) {
                problems.add(label + " has an invalid pattern: " + ex.getDescription());
                return null;
            }
        }
        if (domain == null || archetype == null) {
            return null;
        }
        return new ArchetypeMapping(matcher, domain, archetype, entry.description());
    }

    private <T> T parse(String label, String field, String value, java.util.function.Function<String, T> parser,
                        List<String> problems) {
        if (!StringUtils.hasText(value)) {
            problems.add(label + " is missing " + field);
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            problems.add(label + " " + ex.getMessage());
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryDocument(String version, List<RegistryEntry> mappings) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryEntry(String exact, String pattern, String domain, String archetype, String description) {
    }
}
