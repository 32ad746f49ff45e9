package com.entity.linker.features;

import com.entity.linker.core.model.Entity;
import com.entity.linker.normalization.UrlNormalizer;

/**
 * Agreement between normalized links.
 *
 * <p>{@link Mode#EXACT} scores 1.0 when both sides share a URL. {@link Mode#SAME_HOST} is the
 * weaker "same external ID space" check: 1.0 when both sides link into the same site.</p>
 */
public class LinkAgreementFeature implements Feature {

    public enum Mode { EXACT, SAME_HOST }

    private final String name;
    private final String attribute;
    private final Mode mode;
    private final UrlNormalizer urlNormalizer;

    public LinkAgreementFeature(String name, String attribute, Mode mode, UrlNormalizer urlNormalizer) {
        this.name = name;
        this.attribute = attribute;
        this.mode = mode;
        this.urlNormalizer = urlNormalizer;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        if (mode == Mode.EXACT) {
            return Aggregations.maxPairwise(source.values(attribute), target.values(attribute),
                    (s, t) -> s.equals(t) ? 1.0 : 0.0);
        }
        return Aggregations.maxPairwise(source.values(attribute), target.values(attribute),
                (s, t) -> {
                    String sourceHost = urlNormalizer.host(s).orElse(null);
                    return sourceHost != null && sourceHost.equals(urlNormalizer.host(t).orElse(null)) ? 1.0 : 0.0;
                });
    }
}
