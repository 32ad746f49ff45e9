package com.entity.linker.normalization;

import java.util.List;

/**
 * Built-in normalization rule sets.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with the common rules: bracketed annotations removed,
     * punctuation and symbols turned into spaces.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getCommonRules());
    }

    /**
     * Creates an engine with the common rules plus person-name rules
     * (honorific prefixes and generational suffixes removed).
     */
    public static NormalizationEngine createPersonNameEngine() {
        NormalizationEngine engine = createDefaultEngine();
        engine.addRules(getPersonNameRules());
        return engine;
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // "Bach (composer)", "Paris [France]" - innermost first, repeated for nesting
                NormalizationRule.builder()
                        .name("bracketed-annotation")
                        .pattern("\\([^()]*\\)|\\[[^\\[\\]]*\\]|\\{[^{}]*\\}")
                        .replacement(" ")
                        .priority(10)
                        .repeatUntilStable(true)
                        .build(),

                // Unicode punctuation and symbols only; letters of any script survive
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[\\p{P}\\p{S}]+")
                        .replacement(" ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("control-characters")
                        .pattern("\\p{Cc}+")
                        .replacement(" ")
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getPersonNameRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^\\s*(mr|mrs|ms|miss|dr|prof|sir|dame|rev)\\s+")
                        .replacement("")
                        .priority(40)
                        .repeatUntilStable(true)
                        .build(),

                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .pattern("\\s+(jr|sr|ii|iii|iv)\\s*$")
                        .replacement("")
                        .priority(40)
                        .repeatUntilStable(true)
                        .build()
        );
    }
}
