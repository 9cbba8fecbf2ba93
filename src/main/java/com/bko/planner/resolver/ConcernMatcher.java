package com.bko.planner.resolver;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matcher half of an {@link ArchetypeMapping}. A rule either names one concern exactly or
 * describes a family of concerns with a case-insensitive pattern.
 */
public sealed interface ConcernMatcher permits ConcernMatcher.ExactMatch, ConcernMatcher.PatternMatch {

    boolean matches(String concern);

    String describe();

    record ExactMatch(String value) implements ConcernMatcher {

        @Override
        public boolean matches(String concern) {
            return value.toUpperCase(Locale.ROOT).equals(concern.toUpperCase(Locale.ROOT));
        }

        @Override
        public String describe() {
            return value;
        }
    }

    record PatternMatch(Pattern pattern) implements ConcernMatcher {

        public static PatternMatch of(String regex) {
            return new PatternMatch(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }

        @Override
        public boolean matches(String concern) {
            return pattern.matcher(concern).find();
        }

        @Override
        public String describe() {
            return "/" + pattern.pattern() + "/i";
        }
    }
}
