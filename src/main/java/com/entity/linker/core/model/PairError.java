package com.entity.linker.core.model;

/**
 * A failure confined to one candidate pair, reported next to the successful decisions.
 *
 * @param pair    the pair that failed
 * @param stage   pipeline stage, e.g. {@code extract} or {@code score}
 * @param message the error message
 */
public record PairError(CandidatePair pair, String stage, String message) {

    public static final String STAGE_EXTRACT = "extract";
    public static final String STAGE_SCORE = "score";
    public static final String STAGE_RULE = "rule";
}
