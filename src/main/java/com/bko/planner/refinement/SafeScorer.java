package com.bko.planner.refinement;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic case scoring. Signals match on normalized ids (or appear in the summary), phrases
 * match on normalized text and forbidden terms are searched in the follow-up questions.
 */
@Component
public class SafeScorer {

    static final double CR_PASS = 0.8;
    static final double CR_REVIEW = 0.5;
    static final double AH_PASS = 1.0;
    static final double AH_REVIEW = 0.5;
    static final double AC_PASS = 0.8;
    static final double AC_REVIEW = 0.5;

    private static final Map<String, List<String>> SYNONYMS = Map.of(
            "ssi", List.of("surgicalsiteinf", "woundinf", "infectionatsite", "siteinf"),
            "unplannedadm", List.of("unplannedreturn", "readmission", "returntoor", "unplannedre"),
            "antibiotic", List.of("prophylaxis", "ancef", "cefazolin", "preopmed", "antibioticadmin"));

    public BatchScore scoreBatch(EvaluationBatch batch, Map<String, CaseOutput> outputs, boolean strict) {
        List<CaseScore> scores = new ArrayList<>();
        for (EvaluationCase evaluationCase : batch.cases()) {
            CaseOutput output = outputs.getOrDefault(evaluationCase.testId(), CaseOutput.empty(evaluationCase.testId()));
            scores.add(score(evaluationCase, output, strict));
        }
        double mean = scores.stream().mapToDouble(CaseScore::composite).average().orElse(0.0);
        return new BatchScore(batch.batchId(), mean, scores);
    }

    public CaseScore score(EvaluationCase evaluationCase, CaseOutput output, boolean strict) {
        List<String> missedSignals = new ArrayList<>();
        for (String expected : evaluationCase.mustFindSignals()) {
            boolean found = output.signals().stream().anyMatch(signal -> signalMatches(expected, signal))
                    || normalizeText(output.summary()).contains(normalizeText(expected));
            if (!found) {
                missedSignals.add(expected);
            }
        }
        double cr = coverage(evaluationCase.mustFindSignals().size(), missedSignals.size());

        String questions = normalizeText(String.join(" ", output.followupQuestions()));
        List<String> violations = evaluationCase.forbiddenTerms().stream()
                .filter(term -> questions.contains(normalizeText(term)))
                .toList();
        double ah;
        if (strict) {
            ah = violations.isEmpty() ? 1.0 : 0.0;
        } else {
            ah = 1.0 - (double) violations.size() / Math.max(1, evaluationCase.forbiddenTerms().size());
        }

        String summary = normalizeText(output.summary());
        String conceptSummary = normalizeId(summary);
        List<String> missedPhrases = new ArrayList<>();
        for (String phrase : evaluationCase.mustContainPhrases()) {
            String concept = normalizeId(phrase);
            boolean found = summary.contains(normalizeText(phrase))
                    || conceptSummary.contains(concept)
                    || SYNONYMS.getOrDefault(concept, List.of()).stream().anyMatch(conceptSummary::contains);
            if (!found) {
                missedPhrases.add(phrase);
            }
        }
        double ac = coverage(evaluationCase.mustContainPhrases().size(), missedPhrases.size());

        double composite = (cr + ah + ac) / 3.0;
        return new CaseScore(evaluationCase.testId(), cr, ah, ac, composite, label(cr, ah, ac), missedSignals,
                missedPhrases, violations);
    }

    static SafeLabel label(double cr, double ah, double ac) {
        if (cr < CR_REVIEW || ah < AH_REVIEW || ac < AC_REVIEW) {
            return SafeLabel.FAIL;
        }
        if (cr < CR_PASS || ah < AH_PASS || ac < AC_PASS) {
            return SafeLabel.REVIEW;
        }
        return SafeLabel.PASS;
    }

    static boolean signalMatches(String expected, String found) {
        String e = normalizeId(expected);
        String f = normalizeId(found);
        if (e.isEmpty() || f.isEmpty()) {
            return false;
        }
        if (e.equals(f) || f.contains(e) || e.contains(f)) {
            return true;
        }
        for (Map.Entry<String, List<String>> synonym : SYNONYMS.entrySet()) {
            if (mentions(e, synonym) && mentions(f, synonym)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lower-cases and strips separators and filler words so "Surgical Site Infection" and
     * "surgical_site_inf" compare equal.
     */
    static String normalizeId(String value) {
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[\\s_-]+", "")
                .replace("infection", "inf")
                .replace("prevention", "")
                .replace("bundle", "")
                .replace("protocol", "");
    }

    private static boolean mentions(String normalized, Map.Entry<String, List<String>> synonym) {
        return normalized.contains(synonym.getKey()) || synonym.getValue().stream().anyMatch(normalized::contains);
    }

    private static String normalizeText(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static double coverage(int expected, int missed) {
        return expected == 0 ? 1.0 : (double) (expected - missed) / expected;
    }
}
