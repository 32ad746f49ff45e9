package com.entity.linker.baseline;

import com.entity.linker.features.FeatureSets;

import java.util.Set;

/**
 * Predefined baseline rules over the built-in feature names.
 */
public final class LinkingRules {

    public static final String PERFECT_NAME = "perfect-name";
    public static final String PERFECT_NAME_AND_DATES = "perfect-name-and-dates";
    public static final String NAME_AND_LINK = "name-and-link";
    public static final String SIMILAR_LINKS = "similar-links";

    private LinkingRules() {
        // Utility class
    }

    public static Set<String> names() {
        return Set.of(PERFECT_NAME, PERFECT_NAME_AND_DATES, NAME_AND_LINK, SIMILAR_LINKS);
    }

    /**
     * @throws IllegalArgumentException for an unknown rule name
     */
    public static LinkingRule byName(String name) {
        return switch (name) {
            case PERFECT_NAME -> perfectName();
            case PERFECT_NAME_AND_DATES -> perfectNameAndDates();
            case NAME_AND_LINK -> nameAndLink();
            case SIMILAR_LINKS -> similarLinks();
            default -> throw new IllegalArgumentException("Unknown linking rule: " + name + ", expected one of " + names());
        };
    }

    /**
     * Identical normalized name.
     */
    public static LinkingRule perfectName() {
        return LinkingRule.builder()
                .name(PERFECT_NAME)
                .requireExact(FeatureSets.NAME_EXACT)
                .build();
    }

    /**
     * Identical normalized name and full agreement of the birth date on the shared precision.
     */
    public static LinkingRule perfectNameAndDates() {
        return LinkingRule.builder()
                .name(PERFECT_NAME_AND_DATES)
                .requireExact(FeatureSets.NAME_EXACT)
                .requireExact(FeatureSets.BIRTH_DATE)
                .build();
    }

    /**
     * Identical normalized name and at least one identical normalized link.
     */
    public static LinkingRule nameAndLink() {
        return LinkingRule.builder()
                .name(NAME_AND_LINK)
                .requireExact(FeatureSets.NAME_EXACT)
                .requireExact(FeatureSets.URL_EXACT)
                .build();
    }

    /**
     * At least half of the link tokens shared.
     */
    public static LinkingRule similarLinks() {
        return LinkingRule.builder()
                .name(SIMILAR_LINKS)
                .require(FeatureSets.URL_TOKENS, 0.5)
                .build();
    }
}
