package com.entity.linker.features;

import java.util.Set;

/**
 * Class hierarchy over occupation codes, used to treat "composer" and "musician" as related.
 */
public interface OccupationHierarchy {

    /**
     * Returns the code together with its superclasses and subclasses.
     */
    Set<String> expand(String code);

    /**
     * A hierarchy that knows no relations: every code expands to itself.
     */
    OccupationHierarchy FLAT = Set::of;
}
