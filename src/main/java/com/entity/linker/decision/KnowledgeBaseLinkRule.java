package com.entity.linker.decision;

import com.entity.linker.classifier.Prediction;
import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.UrlNormalizer;

import java.util.Optional;

/**
 * Trusts an explicit link from the target back into the source knowledge base.
 *
 * <p>If one of the target's URLs matches the formatter URL (for example
 * {@code https://www.wikidata.org/wiki/$1}), the pair becomes a certain match when the
 * extracted identifier is the source id and a certain non-match otherwise.</p>
 */
public class KnowledgeBaseLinkRule implements PostClassificationRule {

    public static final String NAME = "knowledge-base-link";
    public static final String DEFAULT_FORMATTER_URL = "https://www.wikidata.org/wiki/$1";

    private final String formatterUrl;
    private final String attribute;
    private final UrlNormalizer urlNormalizer;

    public KnowledgeBaseLinkRule() {
        this(DEFAULT_FORMATTER_URL, AttributeKeys.URL, new UrlNormalizer());
    }

    public KnowledgeBaseLinkRule(String formatterUrl, String attribute, UrlNormalizer urlNormalizer) {
        if (formatterUrl == null || !formatterUrl.contains("$1")) {
            throw new IllegalArgumentException("formatterUrl must contain the $1 placeholder");
        }
        this.formatterUrl = formatterUrl;
        this.attribute = attribute;
        this.urlNormalizer = urlNormalizer;
    }

    @Override
    public String name() {
        return NAME;
    }

    public String getFormatterUrl() {
        return formatterUrl;
    }

    @Override
    public Prediction apply(Entity source, Entity target, Prediction prediction) {
        boolean linked = false;
        for (String url : target.values(attribute)) {
            Optional<String> identifier = urlNormalizer.extractIdentifier(url, formatterUrl);
            if (identifier.isEmpty()) {
                continue;
            }
            if (identifier.get().equals(source.getId())) {
                return PostClassificationRule.forceMatch(prediction);
            }
            linked = true;
        }
        return linked ? PostClassificationRule.forceNonMatch(prediction) : prediction;
    }
}
