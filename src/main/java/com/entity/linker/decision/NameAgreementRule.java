package com.entity.linker.decision;

import com.entity.linker.classifier.Prediction;
import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.Tokenizer;

import java.util.Set;

/**
 * Rejects pairs whose names share no token. Pairs where either side has no name are left alone.
 */
public class NameAgreementRule implements PostClassificationRule {

    public static final String NAME = "name-agreement";

    private final Tokenizer tokenizer;
    private final String attribute;

    public NameAgreementRule(Tokenizer tokenizer) {
        this(tokenizer, AttributeKeys.NAME);
    }

    public NameAgreementRule(Tokenizer tokenizer, String attribute) {
        this.tokenizer = tokenizer;
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Prediction apply(Entity source, Entity target, Prediction prediction) {
        Set<String> sourceTokens = tokenizer.tokens(source.values(attribute));
        Set<String> targetTokens = tokenizer.tokens(target.values(attribute));
        if (sourceTokens.isEmpty() || targetTokens.isEmpty()) {
            return prediction;
        }
        for (String token : sourceTokens) {
            if (targetTokens.contains(token)) {
                return prediction;
            }
        }
        return PostClassificationRule.forceNonMatch(prediction);
    }
}
