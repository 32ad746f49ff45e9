package com.entity.linker.normalization;

import com.entity.linker.core.exception.DataException;
import com.entity.linker.core.model.Attribute;
import com.entity.linker.core.model.DateAttribute;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.LinkAttribute;
import com.entity.linker.core.model.TextAttribute;
import com.entity.linker.core.model.TokenSetAttribute;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the canonical copy of an entity that blocking and feature extraction work on.
 *
 * <p>Text values go through the {@link NormalizationEngine}, links through the
 * {@link UrlNormalizer}, tokens are trimmed. Values that normalize to nothing are dropped,
 * and attributes left without values are removed.</p>
 */
public class EntityNormalizer {

    private final NormalizationEngine textEngine;
    private final UrlNormalizer urlNormalizer;
    private final Set<String> requiredAttributes;

    public EntityNormalizer(NormalizationEngine textEngine, UrlNormalizer urlNormalizer,
                            Set<String> requiredAttributes) {
        this.textEngine = textEngine;
        this.urlNormalizer = urlNormalizer;
        this.requiredAttributes = Set.copyOf(requiredAttributes);
    }

    public static EntityNormalizer defaults(Set<String> requiredAttributes) {
        return new EntityNormalizer(DefaultNormalizationRules.createDefaultEngine(),
                new UrlNormalizer(), requiredAttributes);
    }

    /**
     * Returns the normalized entity.
     *
     * @throws DataException if a required attribute is missing after normalization
     */
    public Entity normalize(Entity entity) {
        Entity.Builder builder = Entity.identityOf(entity);
        for (Map.Entry<String, Attribute> entry : entity.getAttributes().entrySet()) {
            Attribute normalized = normalize(entry.getValue());
            if (!normalized.isEmpty()) {
                builder.attribute(entry.getKey(), normalized);
            }
        }
        Entity result = builder.build();

        for (String required : requiredAttributes) {
            if (!result.has(required)) {
                throw new DataException(entity.getId(),
                        "Entity " + entity.getId() + " has no usable value for required attribute '" + required + "'");
            }
        }
        return result;
    }

    private Attribute normalize(Attribute attribute) {
        return switch (attribute.kind()) {
            case TEXT -> new TextAttribute(textEngine.normalizeAll(attribute.asStrings()));
            case LINK -> new LinkAttribute(normalizeLinks(attribute.asStrings()));
            case TOKEN_SET -> new TokenSetAttribute(normalizeTokens(attribute.asStrings()));
            case DATE -> new DateAttribute(((DateAttribute) attribute).dates().stream().distinct().toList());
        };
    }

    private List<String> normalizeLinks(List<String> urls) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String url : urls) {
            urlNormalizer.normalize(url).ifPresent(normalized::add);
        }
        return List.copyOf(normalized);
    }

    private static Set<String> normalizeTokens(List<String> tokens) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token != null && !token.isBlank()) {
                normalized.add(token.strip());
            }
        }
        return normalized;
    }
}
