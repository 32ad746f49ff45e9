package com.entity.linker.features;

import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.Tokenizer;
import com.entity.linker.normalization.UrlNormalizer;
import com.entity.linker.similarity.TokenOverlap;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Overlap between the token sets of both entities.
 * Tokens come from a token-set attribute directly, or from tokenized text or link values.
 */
public class SharedTokensFeature implements Feature {

    private final String name;
    private final Function<Entity, Set<String>> tokenSource;
    private final TokenOverlap overlap;

    public SharedTokensFeature(String name, Function<Entity, Set<String>> tokenSource, TokenOverlap overlap) {
        this.name = name;
        this.tokenSource = tokenSource;
        this.overlap = overlap;
    }

    /**
     * Compares the raw values of a token-set attribute such as genres.
     */
    public static SharedTokensFeature ofTokenSet(String name, String attribute, TokenOverlap overlap) {
        return new SharedTokensFeature(name, e -> new LinkedHashSet<>(e.values(attribute)), overlap);
    }

    /**
     * Compares the tokens of every value of a text attribute.
     */
    public static SharedTokensFeature ofText(String name, String attribute, Tokenizer tokenizer,
                                             TokenOverlap overlap) {
        return new SharedTokensFeature(name, e -> tokenizer.tokens(e.values(attribute)), overlap);
    }

    /**
     * Compares the tokens of every URL of a link attribute.
     */
    public static SharedTokensFeature ofLinks(String name, String attribute, UrlNormalizer urlNormalizer,
                                              TokenOverlap overlap) {
        return new SharedTokensFeature(name, e -> {
            Set<String> tokens = new LinkedHashSet<>();
            for (String url : e.values(attribute)) {
                tokens.addAll(urlNormalizer.tokens(url));
            }
            return tokens;
        }, overlap);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        return overlap.compute(tokenSource.apply(source), tokenSource.apply(target));
    }
}
