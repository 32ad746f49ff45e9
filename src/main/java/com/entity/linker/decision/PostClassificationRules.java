package com.entity.linker.decision;

import com.entity.linker.classifier.Prediction;
import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.Tokenizer;

import java.util.List;

/**
 * Named post-classification rules, as referenced from configuration.
 */
public final class PostClassificationRules {

    private PostClassificationRules() {
    }

    public static List<String> names() {
        return List.of(NameAgreementRule.NAME, KnowledgeBaseLinkRule.NAME);
    }

    /**
     * @throws IllegalArgumentException for an unknown rule name
     */
    public static PostClassificationRule byName(String name, Tokenizer tokenizer) {
        return switch (name) {
            case NameAgreementRule.NAME -> new NameAgreementRule(tokenizer);
            case KnowledgeBaseLinkRule.NAME -> new KnowledgeBaseLinkRule();
            default -> throw new IllegalArgumentException("Unknown post-classification rule: " + name
                    + ", expected one of " + names());
        };
    }

    public static Prediction applyAll(List<PostClassificationRule> rules, Entity source, Entity target,
                                      Prediction prediction) {
        Prediction current = prediction;
        for (PostClassificationRule rule : rules) {
            current = rule.apply(source, target, current);
        }
        return current;
    }
}
