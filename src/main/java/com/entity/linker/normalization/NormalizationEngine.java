package com.entity.linker.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes free text for comparison.
 *
 * <p>Every input is first lowercased and diacritic-folded, then the configured rules
 * are applied in priority order (lower number first), and finally whitespace is
 * collapsed. The result is idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a single text value. Null or blank input yields an empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = DiacriticFolder.foldAndLowercase(text);

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }

    /**
     * Normalizes every value, dropping values that normalize to empty and duplicates.
     * Order of first occurrence is preserved.
     */
    public List<String> normalizeAll(List<String> values) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            String n = normalize(value);
            if (!n.isEmpty()) {
                normalized.add(n);
            }
        }
        return List.copyOf(normalized);
    }

    /**
     * Checks if two values are equivalent after normalization.
     */
    public boolean areEquivalent(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
