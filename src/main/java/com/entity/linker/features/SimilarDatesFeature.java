package com.entity.linker.features;

import com.entity.linker.core.model.DatePrecision;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.PartialDate;

/**
 * Component-wise date agreement, tolerant of unknown components.
 *
 * <p>For a pair of dates only the components both sides define are compared, from year
 * downwards, stopping at the first disagreement. The score is the number of agreeing
 * components over the number of shared components; the best pair wins. So 1897 vs
 * 1897-06-05 scores 1.0, while 1897-05 vs 1897-06 scores 0.5.</p>
 */
public class SimilarDatesFeature implements Feature {

    private final String name;
    private final String attribute;

    public SimilarDatesFeature(String name, String attribute) {
        this.name = name;
        this.attribute = attribute;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        return Aggregations.maxPairwise(source.dates(attribute), target.dates(attribute),
                SimilarDatesFeature::agreement);
    }

    static double agreement(PartialDate a, PartialDate b) {
        DatePrecision shared = DatePrecision.lowest(a.precision(), b.precision());
        int matched = 0;
        for (DatePrecision component : DatePrecision.values()) {
            if (component.ordinal() > shared.ordinal()
                    || !a.component(component).equals(b.component(component))) {
                break;
            }
            matched++;
        }
        return (double) matched / (shared.ordinal() + 1);
    }
}
