package com.entity.linker.features;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.normalization.Tokenizer;
import com.entity.linker.normalization.UrlNormalizer;
import com.entity.linker.similarity.BoundedEditDistance;
import com.entity.linker.similarity.CharacterNGramCosineSimilarity;
import com.entity.linker.similarity.JaroWinklerSimilarity;
import com.entity.linker.similarity.LevenshteinSimilarity;
import com.entity.linker.similarity.TokenOverlap;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Built-in feature sets, selectable by name from configuration.
 */
public final class FeatureSets {

    public static final String DEFAULT = "default";
    public static final String NAMES = "names";
    public static final String LINKS = "links";

    public static final String NAME_EXACT = "name_exact";
    public static final String NAME_LEVENSHTEIN = "name_levenshtein";
    public static final String NAME_JARO_WINKLER = "name_jaro_winkler";
    public static final String NAME_EDIT_DISTANCE = "name_edit_distance";
    public static final String NAME_COSINE = "name_cosine";
    public static final String NAME_TOKENS = "name_tokens";
    public static final String BIRTH_DATE = "birth_date";
    public static final String DEATH_DATE = "death_date";
    public static final String URL_EXACT = "url_exact";
    public static final String URL_SAME_HOST = "url_same_host";
    public static final String URL_TOKENS = "url_tokens";
    public static final String OCCUPATION = "occupation";
    public static final String GENRE_TOKENS = "genre_tokens";
    public static final String DESCRIPTION_TOKENS = "description_tokens";

    private FeatureSets() {
        // Utility class
    }

    public static Set<String> names() {
        return Set.of(DEFAULT, NAMES, LINKS);
    }

    /**
     * Creates the feature set with the given name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static FeatureSet create(String name, OccupationHierarchy hierarchy) {
        return switch (name) {
            case DEFAULT -> defaultSet(hierarchy);
            case NAMES -> new FeatureSet(NAMES, nameFeatures(Tokenizer.defaults()));
            case LINKS -> new FeatureSet(LINKS, linkFeatures(new UrlNormalizer()));
            default -> throw new IllegalArgumentException("Unknown feature set: " + name + ", expected one of " + names());
        };
    }

    /**
     * Names, dates, links, occupations, genres and descriptions.
     */
    public static FeatureSet defaultSet(OccupationHierarchy hierarchy) {
        Tokenizer tokenizer = Tokenizer.defaults();
        List<Feature> features = new ArrayList<>(nameFeatures(tokenizer));
        features.add(new SimilarDatesFeature(BIRTH_DATE, AttributeKeys.BIRTH_DATE));
        features.add(new SimilarDatesFeature(DEATH_DATE, AttributeKeys.DEATH_DATE));
        features.addAll(linkFeatures(new UrlNormalizer()));
        features.add(new SharedOccupationsFeature(OCCUPATION, AttributeKeys.OCCUPATION, hierarchy));
        features.add(SharedTokensFeature.ofTokenSet(GENRE_TOKENS, AttributeKeys.GENRE, TokenOverlap.JACCARD));
        features.add(SharedTokensFeature.ofText(DESCRIPTION_TOKENS, AttributeKeys.DESCRIPTION, tokenizer,
                TokenOverlap.JACCARD));
        return new FeatureSet(DEFAULT, features);
    }

    private static List<Feature> nameFeatures(Tokenizer tokenizer) {
        return List.of(
                new ExactMatchFeature(NAME_EXACT, AttributeKeys.NAME),
                new SimilarStringsFeature(NAME_LEVENSHTEIN, AttributeKeys.NAME, new LevenshteinSimilarity()),
                new SimilarStringsFeature(NAME_JARO_WINKLER, AttributeKeys.NAME, new JaroWinklerSimilarity()),
                new SimilarStringsFeature(NAME_EDIT_DISTANCE, AttributeKeys.NAME, new BoundedEditDistance()),
                new SimilarStringsFeature(NAME_COSINE, AttributeKeys.NAME, new CharacterNGramCosineSimilarity()),
                SharedTokensFeature.ofText(NAME_TOKENS, AttributeKeys.NAME, tokenizer, TokenOverlap.JACCARD)
        );
    }

    private static List<Feature> linkFeatures(UrlNormalizer urlNormalizer) {
        return List.of(
                new LinkAgreementFeature(URL_EXACT, AttributeKeys.URL, LinkAgreementFeature.Mode.EXACT, urlNormalizer),
                new LinkAgreementFeature(URL_SAME_HOST, AttributeKeys.URL, LinkAgreementFeature.Mode.SAME_HOST,
                        urlNormalizer),
                SharedTokensFeature.ofLinks(URL_TOKENS, AttributeKeys.URL, urlNormalizer, TokenOverlap.JACCARD)
        );
    }
}
