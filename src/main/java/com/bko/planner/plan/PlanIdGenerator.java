package com.bko.planner.plan;

import com.bko.planner.resolver.Domain;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Plan ids of the form {@code plan_<concern>_<domain>_<yyyyMMdd>_<hash>}.
 */
@Component
public class PlanIdGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int DOMAIN_LENGTH = 10;

    private final Clock clock;

    public PlanIdGenerator() {
        this(Clock.systemUTC());
    }

    PlanIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String concernId, Domain domain) {
        String concern = slug(concernId);
        String domainPart = slug(domain.label());
        if (domainPart.length() > DOMAIN_LENGTH) {
            domainPart = domainPart.substring(0, DOMAIN_LENGTH);
        }
        String date = LocalDate.now(clock).format(DATE);
        String hash = sha256(concernId + "|" + domain.label() + "|" + clock.instant().toEpochMilli()).substring(0, 8);
        return "plan_" + concern + "_" + domainPart + "_" + date + "_" + hash;
    }

    public static String slug(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
