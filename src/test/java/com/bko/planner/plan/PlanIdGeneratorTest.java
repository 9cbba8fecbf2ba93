package com.bko.planner.plan;

import com.bko.planner.resolver.Domain;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PlanIdGeneratorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
    private final PlanIdGenerator generator = new PlanIdGenerator(clock);

    @Test
    void testIdFormat() {
        String id = generator.generate("CLABSI", Domain.HAC);

        assertTrue(id.matches("plan_clabsi_hac_20260105_[0-9a-f]{8}"), id);
        assertEquals(id, generator.generate("CLABSI", Domain.HAC));
    }

    @Test
    void testDomainIsTruncated() {
        String id = generator.generate("L27", Domain.BEHAVIORAL_HEALTH);

        assertTrue(id.startsWith("plan_l27_behavioral_20260105_"), id);
    }

    @Test
    void testDifferentConcernsGetDifferentHashes() {
        String clabsi = generator.generate("CLABSI", Domain.HAC);
        String cauti = generator.generate("CAUTI", Domain.HAC);

        assertNotEquals(clabsi.substring(clabsi.length() - 8), cauti.substring(cauti.length() - 8));
    }

    @Test
    void testSlug() {
        assertEquals("psi_09_perioperative_hem", PlanIdGenerator.slug("PSI.09 / Perioperative Hem"));
        assertEquals("clabsi", PlanIdGenerator.slug("  CLABSI!"));
    }
}
