package com.entity.linker.core.model;

/**
 * The finest component a {@link PartialDate} defines.
 * Ordinal order goes from coarsest to finest.
 */
public enum DatePrecision {
    YEAR,
    MONTH,
    DAY;

    /**
     * Returns the coarser of the two precisions.
     */
    public static DatePrecision lowest(DatePrecision a, DatePrecision b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
