package com.entity.linker.features;

import com.entity.linker.core.model.Entity;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Occupation overlap that credits related occupations.
 *
 * <p>Target codes are expanded with their super- and subclasses before intersecting with
 * the source codes; the shared count is divided by the smaller of the two original set
 * sizes and capped at 1.0.</p>
 */
public class SharedOccupationsFeature implements Feature {

    private final String name;
    private final String attribute;
    private final OccupationHierarchy hierarchy;

    public SharedOccupationsFeature(String name, String attribute, OccupationHierarchy hierarchy) {
        this.name = name;
        this.attribute = attribute;
        this.hierarchy = hierarchy;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double compute(Entity source, Entity target) {
        List<String> sourceCodes = source.values(attribute);
        List<String> targetCodes = target.values(attribute);
        if (sourceCodes.isEmpty() || targetCodes.isEmpty()) {
            return 0.0;
        }

        Set<String> expanded = new HashSet<>();
        for (String code : targetCodes) {
            expanded.addAll(hierarchy.expand(code));
        }
        long shared = new HashSet<>(sourceCodes).stream().filter(expanded::contains).count();
        return Math.min(1.0, (double) shared / Math.min(sourceCodes.size(), targetCodes.size()));
    }
}
