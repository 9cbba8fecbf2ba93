package com.bko.planner.refinement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchScore(String batchId, double score, List<CaseScore> cases) {

    static final int EVIDENCE_LIMIT = 3;

    public BatchScore {
        cases = List.copyOf(cases);
    }

    /**
     * The most frequent misses across the batch, used as rewrite evidence.
     */
    public String failureEvidence() {
        StringBuilder evidence = new StringBuilder();
        append(evidence, "Missed signals", top(CaseScore::missedSignals));
        append(evidence, "Missing summary phrases", top(CaseScore::missedPhrases));
        append(evidence, "Forbidden terms used in questions", top(CaseScore::violations));
        return evidence.length() == 0 ? "No failures recorded." : evidence.toString().trim();
    }

    private List<String> top(Function<CaseScore, List<String>> extractor) {
        Map<String, Long> counts = cases.stream()
                .flatMap(score -> extractor.apply(score).stream())
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(EVIDENCE_LIMIT)
                .map(entry -> entry.getKey() + " (" + entry.getValue() + " cases)")
                .toList();
    }

    private static void append(StringBuilder evidence, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        evidence.append(heading).append(":\n");
        items.forEach(item -> evidence.append("- ").append(item).append('\n'));
    }
}
